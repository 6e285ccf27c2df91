package com.example.presence.tracker.session;

import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.tracker.support.InMemoryDurationStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTrackerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);
    private static final Instant T0 = DAY.atTime(10, 0).toInstant(ZoneOffset.UTC);

    private InMemoryDurationStore store;
    private MonitoringConfig.PresenceMetricsCollector metrics;
    private SessionTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryDurationStore();
        metrics = new MonitoringConfig.PresenceMetricsCollector(new SimpleMeterRegistry());
        SegmentCommitter committer = new SegmentCommitter(store, new DayBoundarySplitter(ZoneOffset.UTC), metrics);
        tracker = new SessionTracker(committer, metrics, 300, 600);
    }

    private static Instant at(long seconds) {
        return T0.plusSeconds(seconds);
    }

    @Test
    void twoShortStintsQualifyTogetherAndCommitInFull() {
        tracker.reconcile("call-1", List.of("a"), at(0));
        tracker.reconcile("call-1", List.of(), at(200));

        assertEquals(0, store.getDaySeconds("a", DAY));

        tracker.reconcile("call-1", List.of("a"), at(300));
        tracker.reconcile("call-1", List.of(), at(550));

        assertEquals(450, store.getDaySeconds("a", DAY));
        assertTrue(tracker.liveSnapshot().qualified().contains("a"));
    }

    @Test
    void stayBelowMinimumIsDiscardedWhenCallEnds() {
        tracker.reconcile("call-1", List.of("a", "b"), at(0));
        tracker.reconcile("call-1", List.of("b"), at(200));
        tracker.reconcile(null, List.of(), at(400));

        assertEquals(0, store.getDaySeconds("a", DAY));
        assertEquals(400, store.getDaySeconds("b", DAY));
        assertEquals(200, metrics.getCounterValue("presence.seconds.discarded"));
        assertFalse(tracker.isSessionActive());
    }

    @Test
    void segmentAcrossMidnightIsSplitByLocalDay() {
        Instant lateEvening = DAY.atTime(23, 50).toInstant(ZoneOffset.UTC);
        tracker.reconcile("call-1", List.of("a"), lateEvening);
        tracker.reconcile("call-1", List.of(), lateEvening.plusSeconds(1200));

        assertEquals(600, store.getDaySeconds("a", DAY));
        assertEquals(600, store.getDaySeconds("a", DAY.plusDays(1)));
    }

    @Test
    void qualificationIsStickyForTheRestOfTheSession() {
        tracker.reconcile("call-1", List.of("a"), at(0));
        tracker.reconcile("call-1", List.of(), at(400));
        tracker.reconcile("call-1", List.of("a"), at(500));
        tracker.reconcile("call-1", List.of(), at(530));

        assertEquals(430, store.getDaySeconds("a", DAY));
    }

    @Test
    void checkpointWritesLongStaysWithoutALeave() {
        tracker.reconcile("call-1", List.of("a"), at(0));

        tracker.checkpoint(at(599));
        assertEquals(0, store.getDaySeconds("a", DAY));

        tracker.checkpoint(at(600));
        assertEquals(600, store.getDaySeconds("a", DAY));

        LiveSessionView view = tracker.liveSnapshot();
        assertEquals(at(600), view.activeSince().get("a"));
        assertTrue(view.qualified().contains("a"));

        tracker.reconcile("call-1", List.of(), at(660));
        assertEquals(660, store.getDaySeconds("a", DAY));
    }

    @Test
    void newCallIdClosesThePreviousSessionFirst() {
        tracker.reconcile("call-1", List.of("a", "b"), at(0));
        tracker.reconcile("call-2", List.of("a"), at(400));

        assertEquals(400, store.getDaySeconds("a", DAY));
        assertEquals(400, store.getDaySeconds("b", DAY));

        LiveSessionView view = tracker.liveSnapshot();
        assertEquals("call-2", view.callId());
        assertEquals(at(400), view.activeSince().get("a"));
        assertFalse(view.qualified().contains("a"));
    }

    @Test
    void emptyRosterDuringLiveCallClosesEveryoneButKeepsTheSession() {
        tracker.reconcile("call-1", List.of("a"), at(0));
        tracker.reconcile("call-1", List.of(), at(100));

        LiveSessionView view = tracker.liveSnapshot();
        assertTrue(view.isActive());
        assertTrue(view.activeSince().isEmpty());
        assertEquals(100, view.accumulatedOf("a"));
        assertEquals(1, view.pendingOf("a").size());
    }

    @Test
    void blankAndNullIdsAreIgnored() {
        tracker.reconcile("call-1", Arrays.asList("a", null, " ", "a"), at(0));

        assertEquals(1, tracker.liveSnapshot().activeSince().size());
    }

    @Test
    void failedWriteOfQualifiedUserKeepsTheOpenSegment() {
        tracker.reconcile("call-1", List.of("a"), at(0));
        tracker.reconcile("call-1", List.of(), at(400));
        tracker.reconcile("call-1", List.of("a"), at(500));

        store.failWrites(true);
        assertThrows(DurationStoreException.class, () -> tracker.reconcile("call-1", List.of(), at(600)));
        assertEquals(at(500), tracker.liveSnapshot().activeSince().get("a"));

        store.failWrites(false);
        tracker.reconcile("call-1", List.of(), at(700));

        assertEquals(600, store.getDaySeconds("a", DAY));
    }

    @Test
    void failedQualificationIsRetriedOnTheNextObservation() {
        tracker.reconcile("call-1", List.of("a"), at(0));
        tracker.reconcile("call-1", List.of(), at(200));
        tracker.reconcile("call-1", List.of("a"), at(300));

        store.failWrites(true);
        assertThrows(DurationStoreException.class, () -> tracker.reconcile("call-1", List.of(), at(550)));
        assertFalse(tracker.liveSnapshot().qualified().contains("a"));

        store.failWrites(false);
        tracker.reconcile("call-1", List.of(), at(560));

        assertEquals(450, store.getDaySeconds("a", DAY));
        assertTrue(tracker.liveSnapshot().qualified().contains("a"));
    }

    @Test
    void flushAllClosesSegmentsYoungerThanTheCheckpointInterval() {
        tracker.reconcile("call-1", List.of("a"), at(0));
        tracker.checkpoint(at(400));
        assertEquals(0, store.getDaySeconds("a", DAY));

        tracker.flushAll(at(405));

        assertEquals(405, store.getDaySeconds("a", DAY));
        assertEquals(at(405), tracker.liveSnapshot().activeSince().get("a"));
    }
}
