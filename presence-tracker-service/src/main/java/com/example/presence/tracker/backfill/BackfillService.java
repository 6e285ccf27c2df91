package com.example.presence.tracker.backfill;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.exception.LeaderboardAggregationException;
import com.example.presence.shared.repository.DurationStore;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import com.example.presence.tracker.leaderboard.PeriodAggregator;
import com.example.presence.tracker.publish.LeaderboardPublishingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds historical day boards from stored totals, as they would have looked at that day's
 * post time. No live session time is ever included. Best effort: a bad day is reported and skipped.
 */
@Service
@Slf4j
public class BackfillService {

    private final PeriodAggregator periodAggregator;
    private final LeaderboardPublishingService publishingService;
    private final DurationStore durationStore;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime postTime;
    private final int defaultWindowDays;

    public BackfillService(PeriodAggregator periodAggregator,
                           LeaderboardPublishingService publishingService,
                           DurationStore durationStore,
                           Clock trackerClock,
                           ZoneId trackerZone,
                           AppProperties appProperties) {
        this.periodAggregator = periodAggregator;
        this.publishingService = publishingService;
        this.durationStore = durationStore;
        this.clock = trackerClock;
        this.zone = trackerZone;
        this.postTime = LocalTime.of(appProperties.getLeaderboard().getPostHour(), appProperties.getLeaderboard().getPostMinute());
        this.defaultWindowDays = appProperties.getBackfill().getDefaultWindowDays();
    }

    /**
     * @param start   first day, default {@code end} minus the configured window
     * @param end     last day, default yesterday
     * @param inspect return the rebuilt snapshots instead of publishing them
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public BackfillReport replay(LocalDate start, LocalDate end, boolean inspect) {
        LocalDate to = end != null ? end : LocalDate.now(clock.withZone(zone)).minusDays(1);
        LocalDate from = start != null ? start : to.minusDays(defaultWindowDays);
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Backfill start " + from + " is after end " + to);
        }

        log.info("Backfill {} to {} (inspect={})", from, to, inspect);
        Set<LocalDate> trackedDates = new HashSet<>(durationStore.findTrackedDates(from, to));
        BackfillReport report = BackfillReport.builder().start(from).end(to).inspect(inspect).build();

        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            if (!trackedDates.contains(date)) {
                log.warn("Backfill: no tracked time on {}, skipping.", date);
                report.getSkippedNoData().add(date);
                continue;
            }
            try {
                Instant postedAt = date.atTime(postTime).atZone(zone).toInstant();
                LeaderboardSnapshot snapshot = periodAggregator.buildBoard(postedAt, date);
                List<String> problems = SnapshotValidator.validate(snapshot);
                if (!problems.isEmpty()) {
                    log.warn("Backfill: snapshot for {} rejected: {}", date, problems);
                    report.getSkippedInvalid().add(date);
                    continue;
                }
                if (inspect) {
                    report.getSnapshots().add(snapshot);
                } else {
                    publishingService.deliver(snapshot);
                    report.getPublished().add(date);
                }
            } catch (LeaderboardAggregationException e) {
                log.error("Backfill: could not rebuild {}, continuing with the next day.", date, e);
                report.getFailed().add(date);
            }
        }

        log.info("Backfill done: {} published, {} inspected, {} without data, {} invalid, {} failed.",
                report.getPublished().size(), report.getSnapshots().size(), report.getSkippedNoData().size(),
                report.getSkippedInvalid().size(), report.getFailed().size());
        return report;
    }
}
