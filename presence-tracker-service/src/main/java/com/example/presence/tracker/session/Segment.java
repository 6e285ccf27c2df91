package com.example.presence.tracker.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed interval {@code [start, end)} during which one raw user was continuously present.
 */
public record Segment(String userId, Instant start, Instant end) {

    public long seconds() {
        long seconds = Duration.between(start, end).getSeconds();
        return Math.max(0L, seconds);
    }
}
