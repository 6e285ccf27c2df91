package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.util.Constants.Scope;

import java.time.LocalDate;

/**
 * Inclusive date range of one board together with its 1-based index counted from the anchor.
 */
public record PeriodWindow(Scope scope, int index, LocalDate start, LocalDate end, String label) {

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /**
     * Key under which a compliment for this period is memoized, e.g. {@code week:2024-01-08}.
     */
    public String periodKey() {
        return scope.periodPrefix() + start;
    }
}
