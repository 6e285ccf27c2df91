package com.example.presence.shared.exception;

import lombok.Getter;

import java.time.LocalDate;

/**
 * A leaderboard could not be built. No partial board is ever published in its place.
 */
@Getter
public class LeaderboardAggregationException extends RuntimeException {

    private final LocalDate referenceDate;

    public LeaderboardAggregationException(String message, LocalDate referenceDate, Throwable cause) {
        super(message, cause);
        this.referenceDate = referenceDate;
    }
}
