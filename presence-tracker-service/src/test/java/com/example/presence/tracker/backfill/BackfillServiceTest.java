package com.example.presence.tracker.backfill;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.exception.LeaderboardAggregationException;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import com.example.presence.tracker.leaderboard.PeriodAggregator;
import com.example.presence.tracker.publish.LeaderboardPublishingService;
import com.example.presence.tracker.support.InMemoryDurationStore;
import com.example.presence.tracker.support.Snapshots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackfillServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);
    private static final LocalDate MAR_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate MAR_2 = LocalDate.of(2024, 3, 2);
    private static final LocalDate MAR_3 = LocalDate.of(2024, 3, 3);

    private InMemoryDurationStore store;
    private PeriodAggregator aggregator;
    private LeaderboardPublishingService publishingService;
    private BackfillService backfillService;

    @BeforeEach
    void setUp() {
        store = new InMemoryDurationStore();
        aggregator = mock(PeriodAggregator.class);
        publishingService = mock(LeaderboardPublishingService.class);
        AppProperties properties = new AppProperties();
        properties.getBackfill().setDefaultWindowDays(3);
        Clock clock = Clock.fixed(TODAY.atTime(9, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        backfillService = new BackfillService(aggregator, publishingService, store, clock, ZoneOffset.UTC, properties);

        for (LocalDate date : List.of(MAR_1, MAR_2, MAR_3)) {
            when(aggregator.buildBoard(any(), eq(date))).thenReturn(Snapshots.forDate(date, false));
        }
    }

    @Test
    void replaysOnlyDaysWithStoredTime() {
        store.addSeconds(MAR_1, "a", 600);
        store.addSeconds(MAR_3, "a", 600);

        BackfillReport report = backfillService.replay(MAR_1, MAR_3, false);

        assertEquals(List.of(MAR_1, MAR_3), report.getPublished());
        assertEquals(List.of(MAR_2), report.getSkippedNoData());
        verify(publishingService, times(2)).deliver(any());
    }

    @Test
    void boardsAreRebuiltAtThatDaysPostTime() {
        store.addSeconds(MAR_2, "a", 600);

        backfillService.replay(MAR_2, MAR_2, false);

        verify(aggregator).buildBoard(MAR_2.atTime(22, 0).toInstant(ZoneOffset.UTC), MAR_2);
    }

    @Test
    void inspectReturnsSnapshotsWithoutPublishing() {
        store.addSeconds(MAR_2, "a", 600);

        BackfillReport report = backfillService.replay(MAR_1, MAR_3, true);

        assertEquals(1, report.getSnapshots().size());
        assertTrue(report.getPublished().isEmpty());
        verify(publishingService, never()).deliver(any());
    }

    @Test
    void failingDayIsReportedAndTheRestContinues() {
        store.addSeconds(MAR_1, "a", 600);
        store.addSeconds(MAR_2, "a", 600);
        when(aggregator.buildBoard(any(), eq(MAR_1)))
                .thenThrow(new LeaderboardAggregationException("db down", MAR_1, new RuntimeException()));

        BackfillReport report = backfillService.replay(MAR_1, MAR_2, false);

        assertEquals(List.of(MAR_1), report.getFailed());
        assertEquals(List.of(MAR_2), report.getPublished());
    }

    @Test
    void malformedSnapshotIsNotPublished() {
        store.addSeconds(MAR_1, "a", 600);
        LeaderboardSnapshot broken = Snapshots.forDate(MAR_1, false);
        broken.getBoards().get(0).setNobodyQualified(true);
        when(aggregator.buildBoard(any(), eq(MAR_1))).thenReturn(broken);

        BackfillReport report = backfillService.replay(MAR_1, MAR_1, false);

        assertEquals(List.of(MAR_1), report.getSkippedInvalid());
        verify(publishingService, never()).deliver(any());
    }

    @Test
    void defaultRangeEndsYesterday() {
        BackfillReport report = backfillService.replay(null, null, true);

        assertEquals(TODAY.minusDays(1), report.getEnd());
        assertEquals(TODAY.minusDays(4), report.getStart());
    }

    @Test
    void startAfterEndIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> backfillService.replay(MAR_3, MAR_1, false));
    }
}
