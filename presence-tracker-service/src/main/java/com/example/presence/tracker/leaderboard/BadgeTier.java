package com.example.presence.tracker.leaderboard;

/**
 * Coarse tier shown next to an entry, derived from whole minutes.
 */
public enum BadgeTier {
    ROCKET(180),
    FIRE(120),
    STRONG(60),
    DONE(1),
    IDLE(0);

    private final long minMinutes;

    BadgeTier(long minMinutes) {
        this.minMinutes = minMinutes;
    }

    public static BadgeTier forMinutes(long minutes) {
        for (BadgeTier tier : values()) {
            if (tier != IDLE && minutes >= tier.minMinutes) {
                return tier;
            }
        }
        return IDLE;
    }
}
