package com.example.presence.tracker.backfill;

import com.example.presence.shared.util.Constants.Scope;
import com.example.presence.tracker.dto.BoardSnapshot;
import com.example.presence.tracker.dto.LeaderboardEntry;
import com.example.presence.tracker.dto.LeaderboardSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks run on a rebuilt snapshot before it is replayed to publishers.
 */
final class SnapshotValidator {

    private static final Set<String> SCOPES = Arrays.stream(Scope.values()).map(Scope::key).collect(Collectors.toSet());

    private SnapshotValidator() {}

    /**
     * @return the problems found; empty when the snapshot is publishable
     */
    static List<String> validate(LeaderboardSnapshot snapshot) {
        List<String> problems = new ArrayList<>();
        if (snapshot.getPostedAt() == null) {
            problems.add("postedAt missing");
        }
        if (snapshot.getBoards() == null || snapshot.getBoards().isEmpty()) {
            problems.add("no boards");
            return problems;
        }
        for (BoardSnapshot board : snapshot.getBoards()) {
            if (!SCOPES.contains(board.getScope())) {
                problems.add("unknown scope " + board.getScope());
            }
            if (board.getPeriodStart() == null || board.getPeriodEnd() == null || board.getPeriodStart().isAfter(board.getPeriodEnd())) {
                problems.add(board.getScope() + ": invalid bounds");
            }
            List<LeaderboardEntry> entries = board.getEntries() == null ? List.of() : board.getEntries();
            if (board.isNobodyQualified() != entries.isEmpty()) {
                problems.add(board.getScope() + ": nobodyQualified does not match entries");
            }
            for (LeaderboardEntry entry : entries) {
                if (entry.getRank() < 1 || entry.getUserId() == null || entry.getUserId().isBlank()
                        || entry.getSeconds() <= 0 || entry.getMinutes() != entry.getSeconds() / 60
                        || entry.getDisplayName() == null || entry.getBadge() == null) {
                    problems.add(board.getScope() + ": malformed entry " + entry);
                }
            }
        }
        return problems;
    }
}
