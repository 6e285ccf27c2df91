package com.example.presence.tracker.session;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DayBoundarySplitterTest {

    private static final ZoneId TASHKENT = ZoneId.of("Asia/Tashkent");

    private final DayBoundarySplitter splitter = new DayBoundarySplitter(TASHKENT);

    @Test
    void spanWithinOneDayIsOneSlice() {
        Instant start = LocalDate.of(2024, 5, 1).atTime(9, 0).atZone(TASHKENT).toInstant();

        List<DaySlice> slices = splitter.split(start, start.plusSeconds(3600));

        assertEquals(List.of(new DaySlice(LocalDate.of(2024, 5, 1), 3600)), slices);
    }

    @Test
    void spanOverTwoMidnightsIsCutAtEachLocalMidnight() {
        Instant start = LocalDate.of(2024, 5, 1).atTime(23, 0).atZone(TASHKENT).toInstant();
        Instant end = LocalDate.of(2024, 5, 3).atTime(0, 30).atZone(TASHKENT).toInstant();

        List<DaySlice> slices = splitter.split(start, end);

        assertEquals(List.of(
                new DaySlice(LocalDate.of(2024, 5, 1), 3600),
                new DaySlice(LocalDate.of(2024, 5, 2), 86400),
                new DaySlice(LocalDate.of(2024, 5, 3), 1800)), slices);
        assertEquals(end.getEpochSecond() - start.getEpochSecond(),
                slices.stream().mapToLong(DaySlice::seconds).sum());
    }

    @Test
    void emptyOrInvertedSpanHasNoSlices() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");

        assertTrue(splitter.split(now, now).isEmpty());
        assertTrue(splitter.split(now, now.minusSeconds(5)).isEmpty());
    }

    @Test
    void dateOfUsesTheConfiguredZone() {
        // 20:30 UTC is 01:30 the next day in UTC+5
        assertEquals(LocalDate.of(2024, 5, 2), splitter.dateOf(Instant.parse("2024-05-01T20:30:00Z")));
    }
}
