package com.example.presence.tracker.publish;

import com.example.presence.tracker.dto.LeaderboardSnapshot;

/**
 * Destination for a finished leaderboard. Implementations handle their own delivery failures.
 */
public interface LeaderboardPublisher {

    String name();

    void publish(LeaderboardSnapshot snapshot);
}
