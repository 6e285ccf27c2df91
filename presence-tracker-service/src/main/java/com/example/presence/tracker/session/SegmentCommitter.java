package com.example.presence.tracker.session;

import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.repository.DurationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a qualified segment into the day ledger, one row per local day it touches.
 * A {@link com.example.presence.shared.exception.DurationStoreException} propagates to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SegmentCommitter {

    private final DurationStore durationStore;
    private final DayBoundarySplitter dayBoundarySplitter;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    public void commit(Segment segment) {
        for (DaySlice slice : dayBoundarySplitter.split(segment.start(), segment.end())) {
            durationStore.addSeconds(slice.date(), segment.userId(), slice.seconds());
        }
        metricsCollector.incrementCounter("presence.segments.committed");
        log.debug("Committed {}s for user {} ({} -> {})", segment.seconds(), segment.userId(), segment.start(), segment.end());
    }
}
