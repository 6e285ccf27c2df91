package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.util.Constants.Scope;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodWindowsTest {

    private static final LocalDate ANCHOR = LocalDate.of(2024, 1, 1);

    @Test
    void anchorDayIsDayOneWeekOneMonthOne() {
        assertEquals(1, PeriodWindows.dayIndex(ANCHOR, ANCHOR));
        assertEquals(1, PeriodWindows.week(ANCHOR, ANCHOR).index());
        assertEquals(1, PeriodWindows.month(ANCHOR, ANCHOR).index());
    }

    @Test
    void weeksAreSevenDayBlocksFromTheAnchor() {
        PeriodWindow week = PeriodWindows.week(ANCHOR, LocalDate.of(2024, 1, 9));

        assertEquals(2, week.index());
        assertEquals(LocalDate.of(2024, 1, 8), week.start());
        assertEquals(LocalDate.of(2024, 1, 14), week.end());
        assertEquals("08.01.24 - 14.01.24 (WEEK 2)", week.label());
        assertEquals("week:2024-01-08", week.periodKey());
    }

    @Test
    void monthsAreThirtyDayBlocksNotCalendarMonths() {
        PeriodWindow month = PeriodWindows.month(ANCHOR, LocalDate.of(2024, 1, 31));

        assertEquals(2, month.index());
        assertEquals(LocalDate.of(2024, 1, 31), month.start());
        assertEquals(LocalDate.of(2024, 2, 29), month.end());
        assertEquals(Scope.MONTH, month.scope());
    }

    @Test
    void dayLabelCarriesTheWeekday() {
        PeriodWindow day = PeriodWindows.day(ANCHOR, LocalDate.of(2024, 1, 3));

        assertEquals(3, day.index());
        assertEquals("03.01.24 (WEDNESDAY)", day.label());
        assertTrue(day.contains(LocalDate.of(2024, 1, 3)));
        assertFalse(day.contains(LocalDate.of(2024, 1, 4)));
    }

    @Test
    void datesBeforeTheAnchorFallIntoEarlierBlocks() {
        PeriodWindow week = PeriodWindows.week(ANCHOR, LocalDate.of(2023, 12, 31));

        assertEquals(0, week.index());
        assertEquals(LocalDate.of(2023, 12, 25), week.start());
    }
}
