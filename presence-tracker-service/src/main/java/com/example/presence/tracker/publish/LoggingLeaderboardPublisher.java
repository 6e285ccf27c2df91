package com.example.presence.tracker.publish;

import com.example.presence.tracker.dto.BoardSnapshot;
import com.example.presence.tracker.dto.LeaderboardEntry;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the board as plain text to the application log.
 */
@Component
@Slf4j
public class LoggingLeaderboardPublisher implements LeaderboardPublisher {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void publish(LeaderboardSnapshot snapshot) {
        log.info("\n{}", render(snapshot));
    }

    static String render(LeaderboardSnapshot snapshot) {
        StringBuilder text = new StringBuilder();
        text.append("LEADERBOARD - DAY ").append(snapshot.getDayIndex());
        if (!snapshot.isLive()) {
            text.append(" (rebuilt for ").append(snapshot.getReferenceDate()).append(')');
        }
        for (BoardSnapshot board : snapshot.getBoards()) {
            text.append("\n\n").append(board.getScope().toUpperCase()).append(" - ").append(board.getLabel());
            if (board.isNobodyQualified()) {
                text.append("\n  nobody qualified yet");
                continue;
            }
            for (LeaderboardEntry entry : board.getEntries()) {
                text.append("\n  ").append(entry.getRank()).append(". ")
                        .append(entry.getDisplayName()).append(" - ")
                        .append(entry.getMinutes()).append(" min [").append(entry.getBadge()).append(']');
                if (entry.getCompliment() != null) {
                    text.append(' ').append(entry.getCompliment());
                }
            }
        }
        if (snapshot.getWordOfTheDay() != null) {
            text.append("\n\nWORD OF THE DAY: ").append(snapshot.getWordOfTheDay());
        }
        return text.toString();
    }
}
