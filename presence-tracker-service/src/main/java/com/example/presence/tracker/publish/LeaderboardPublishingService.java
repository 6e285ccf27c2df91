package com.example.presence.tracker.publish;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.exception.LeaderboardAggregationException;
import com.example.presence.shared.repository.DurationStore;
import com.example.presence.shared.util.Constants.MetaKeys;
import com.example.presence.tracker.admin.TrackerReadiness;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import com.example.presence.tracker.leaderboard.PeriodAggregator;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Daily post at the configured local time, at most once per day, plus manual posts that
 * leave the daily marker alone.
 */
@Service
@Slf4j
public class LeaderboardPublishingService {

    private final PeriodAggregator periodAggregator;
    private final List<LeaderboardPublisher> publishers;
    private final DurationStore durationStore;
    private final TrackerReadiness readiness;
    private final Clock clock;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final LocalTime postTime;

    public LeaderboardPublishingService(PeriodAggregator periodAggregator,
                                        List<LeaderboardPublisher> publishers,
                                        DurationStore durationStore,
                                        TrackerReadiness readiness,
                                        Clock trackerClock,
                                        MonitoringConfig.PresenceMetricsCollector metricsCollector,
                                        AppProperties appProperties) {
        this.periodAggregator = periodAggregator;
        this.publishers = List.copyOf(publishers);
        this.durationStore = durationStore;
        this.readiness = readiness;
        this.clock = trackerClock;
        this.metricsCollector = metricsCollector;
        this.postTime = LocalTime.of(appProperties.getLeaderboard().getPostHour(), appProperties.getLeaderboard().getPostMinute());
    }

    @Scheduled(initialDelayString = "${presence.leaderboard.check-interval-ms:30000}",
            fixedDelayString = "${presence.leaderboard.check-interval-ms:30000}")
    @SchedulerLock(name = "leaderboardDailyPost", lockAtMostFor = "PT5M")
    public void checkDailyPost() {
        if (!readiness.isReady()) {
            return;
        }
        publishIfDue("scheduled");
    }

    /**
     * Posts today's board if the post time has passed and today was not posted yet.
     * Failures are logged; the next check retries.
     *
     * @return {@code true} if a board was posted
     */
    public boolean publishIfDue(String reason) {
        try {
            ZonedDateTime now = ZonedDateTime.now(clock);
            if (now.toLocalTime().isBefore(postTime)) {
                return false;
            }
            LocalDate today = now.toLocalDate();
            Optional<String> lastPost = durationStore.getMeta(MetaKeys.LAST_POST_DATE);
            if (lastPost.isPresent() && lastPost.get().trim().equals(today.toString())) {
                return false;
            }
            log.info("Daily leaderboard due for {} ({}).", today, reason);
            buildAndDeliver();
            durationStore.setMeta(MetaKeys.LAST_POST_DATE, today.toString());
            return true;
        } catch (LeaderboardAggregationException | DurationStoreException e) {
            metricsCollector.incrementCounter("presence.leaderboard.published", "status", "failed");
            log.error("Daily leaderboard ({}) not posted, will retry on the next check.", reason, e);
            return false;
        }
    }

    /**
     * Builds and posts the current board without marking the day as posted.
     */
    public LeaderboardSnapshot postNow() {
        log.info("Manual leaderboard post requested.");
        return buildAndDeliver();
    }

    public LeaderboardSnapshot preview() {
        return periodAggregator.buildBoard(clock.instant(), null);
    }

    /**
     * Hands a finished snapshot to every publisher. One publisher failing does not keep the
     * snapshot from the others.
     */
    public void deliver(LeaderboardSnapshot snapshot) {
        for (LeaderboardPublisher publisher : publishers) {
            try {
                publisher.publish(snapshot);
            } catch (RuntimeException e) {
                metricsCollector.incrementCounter("presence.errors", "type", "publish");
                log.warn("Publisher {} failed for leaderboard {}: {}", publisher.name(), snapshot.getReferenceDate(), e.getMessage(), e);
            }
        }
        metricsCollector.incrementCounter("presence.leaderboard.published", "status", "success");
    }

    private LeaderboardSnapshot buildAndDeliver() {
        LeaderboardSnapshot snapshot = periodAggregator.buildBoard(clock.instant(), null);
        deliver(snapshot);
        log.info("Posted leaderboard for {} to {} publisher(s).", snapshot.getReferenceDate(), publishers.size());
        return snapshot;
    }
}
