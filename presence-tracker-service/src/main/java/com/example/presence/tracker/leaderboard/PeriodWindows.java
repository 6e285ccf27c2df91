package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.util.Constants.Scope;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Day, 7-day and 30-day windows anchored on the tracker's anchor date. Weeks and months are fixed
 * length blocks, not calendar weeks or months.
 */
public final class PeriodWindows {

    public static final int WEEK_LENGTH = 7;
    public static final int MONTH_LENGTH = 30;

    private static final DateTimeFormatter LABEL_DATE = DateTimeFormatter.ofPattern("dd.MM.yy");

    private PeriodWindows() {}

    public static List<PeriodWindow> all(LocalDate anchor, LocalDate date) {
        return List.of(day(anchor, date), week(anchor, date), month(anchor, date));
    }

    public static int dayIndex(LocalDate anchor, LocalDate date) {
        return Math.toIntExact(ChronoUnit.DAYS.between(anchor, date) + 1);
    }

    public static PeriodWindow day(LocalDate anchor, LocalDate date) {
        String label = LABEL_DATE.format(date) + " (" + date.getDayOfWeek().name() + ")";
        return new PeriodWindow(Scope.DAY, dayIndex(anchor, date), date, date, label);
    }

    public static PeriodWindow week(LocalDate anchor, LocalDate date) {
        return block(Scope.WEEK, anchor, date, WEEK_LENGTH, "WEEK");
    }

    public static PeriodWindow month(LocalDate anchor, LocalDate date) {
        return block(Scope.MONTH, anchor, date, MONTH_LENGTH, "MONTH");
    }

    private static PeriodWindow block(Scope scope, LocalDate anchor, LocalDate date, int length, String name) {
        long days = ChronoUnit.DAYS.between(anchor, date);
        long index = Math.floorDiv(days, length) + 1;
        LocalDate start = anchor.plusDays((index - 1) * length);
        LocalDate end = start.plusDays(length - 1L);
        String label = LABEL_DATE.format(start) + " - " + LABEL_DATE.format(end) + " (" + name + " " + index + ")";
        return new PeriodWindow(scope, Math.toIntExact(index), start, end, label);
    }
}
