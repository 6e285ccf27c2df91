package com.example.presence.tracker.session;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a span at every local midnight so each slice belongs to exactly one calendar day.
 * The slices of a span always add up to the span's whole seconds.
 */
@Component
public class DayBoundarySplitter {

    private final ZoneId zone;

    public DayBoundarySplitter(ZoneId trackerZone) {
        this.zone = trackerZone;
    }

    public List<DaySlice> split(Instant start, Instant end) {
        List<DaySlice> slices = new ArrayList<>();
        if (start == null || end == null || !start.isBefore(end)) {
            return slices;
        }
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            LocalDate day = cursor.atZone(zone).toLocalDate();
            // atStartOfDay handles zones where midnight is skipped by a DST gap
            Instant nextMidnight = day.plusDays(1).atStartOfDay(zone).toInstant();
            Instant sliceEnd = nextMidnight.isBefore(end) ? nextMidnight : end;
            long seconds = Duration.between(cursor, sliceEnd).getSeconds();
            if (seconds > 0) {
                slices.add(new DaySlice(day, seconds));
            }
            cursor = sliceEnd;
        }
        return slices;
    }

    public LocalDate dateOf(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    public ZoneId getZone() {
        return zone;
    }
}
