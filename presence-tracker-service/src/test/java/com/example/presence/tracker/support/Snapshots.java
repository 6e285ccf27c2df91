package com.example.presence.tracker.support;

import com.example.presence.tracker.dto.BoardSnapshot;
import com.example.presence.tracker.dto.LeaderboardEntry;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import com.example.presence.tracker.leaderboard.BadgeTier;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Well-formed snapshots for publisher and backfill tests.
 */
public final class Snapshots {

    private Snapshots() {}

    public static LeaderboardSnapshot forDate(LocalDate date, boolean live) {
        List<BoardSnapshot> boards = new ArrayList<>();
        for (String scope : List.of("day", "week", "month")) {
            boards.add(BoardSnapshot.builder()
                    .scope(scope)
                    .index(1)
                    .periodStart(date.atStartOfDay().atOffset(ZoneOffset.UTC))
                    .periodEnd(date.atTime(23, 59, 59).atOffset(ZoneOffset.UTC))
                    .label(date.toString())
                    .nobodyQualified(false)
                    .entries(List.of(LeaderboardEntry.builder()
                            .rank(1).userId("a").seconds(600).minutes(10)
                            .displayName("@ann").badge(BadgeTier.DONE).build()))
                    .build());
        }
        return LeaderboardSnapshot.builder()
                .postedAt(OffsetDateTime.of(date.atTime(22, 0), ZoneOffset.UTC))
                .referenceDate(date)
                .anchorDate(date)
                .dayIndex(1)
                .live(live)
                .boards(boards)
                .wordOfTheDay("Keep going.")
                .build();
    }
}
