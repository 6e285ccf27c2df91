package com.example.presence.tracker.roster;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.model.UserProfile;
import com.example.presence.shared.repository.UserProfileRepository;
import com.example.presence.tracker.admin.TrackerReadiness;
import com.example.presence.tracker.alias.AliasMapping;
import com.example.presence.tracker.alias.AliasResolver;
import com.example.presence.tracker.session.SessionTracker;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Feeds roster observations into the {@link SessionTracker}.
 * <p>
 * Runs on a fixed poll and on every push. At most one refresh is in flight; a trigger that finds
 * one running is dropped.
 */
@Service
@Slf4j
public class RosterReconciliationService {

    private final RosterSource rosterSource;
    private final SessionTracker sessionTracker;
    private final UserProfileRepository userProfileRepository;
    private final AliasResolver aliasResolver;
    private final DisplayNameResolver displayNameResolver;
    private final TrackerReadiness readiness;
    private final AsyncTaskExecutor taskExecutor;
    private final Clock clock;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final Set<String> excludedUserIds;

    private final ReentrantLock refreshLock = new ReentrantLock();
    // Last stored name pair per user; avoids rewriting unchanged profiles every cycle
    private final Map<String, String> storedNames = new ConcurrentHashMap<>();

    public RosterReconciliationService(RosterSource rosterSource,
                                       SessionTracker sessionTracker,
                                       UserProfileRepository userProfileRepository,
                                       AliasResolver aliasResolver,
                                       DisplayNameResolver displayNameResolver,
                                       TrackerReadiness readiness,
                                       AsyncTaskExecutor taskExecutor,
                                       Clock trackerClock,
                                       MonitoringConfig.PresenceMetricsCollector metricsCollector,
                                       AppProperties appProperties) {
        this.rosterSource = rosterSource;
        this.sessionTracker = sessionTracker;
        this.userProfileRepository = userProfileRepository;
        this.aliasResolver = aliasResolver;
        this.displayNameResolver = displayNameResolver;
        this.readiness = readiness;
        this.taskExecutor = taskExecutor;
        this.clock = trackerClock;
        this.metricsCollector = metricsCollector;
        this.excludedUserIds = new HashSet<>(appProperties.getSession().getExcludedUserIds());
    }

    @Scheduled(initialDelayString = "${presence.session.poll-initial-delay-ms:5000}",
            fixedDelayString = "${presence.session.poll-interval-ms:30000}")
    @SchedulerLock(name = "rosterPoll", lockAtMostFor = "PT2M")
    public void pollRoster() {
        refresh("poll");
    }

    /**
     * Schedules a refresh off the caller's thread, used when a roster change is pushed.
     */
    public void triggerRefresh(String reason) {
        taskExecutor.execute(() -> refresh(reason));
    }

    /**
     * Runs one refresh unless another is in flight.
     *
     * @return {@code true} if this call performed the refresh
     */
    public boolean refresh(String reason) {
        if (!readiness.isReady()) {
            log.debug("Tracker not ready yet, ignoring {} refresh.", reason);
            return false;
        }
        if (!refreshLock.tryLock()) {
            metricsCollector.incrementCounter("presence.refresh.dropped");
            log.debug("Refresh already running, dropping {} trigger.", reason);
            return false;
        }
        try {
            reconcileOnce(reason);
            return true;
        } catch (DurationStoreException e) {
            metricsCollector.incrementCounter("presence.errors", "type", "database");
            log.error("Roster refresh ({}) could not persist presence time; state kept for the next cycle.", reason, e);
            return false;
        } finally {
            refreshLock.unlock();
        }
    }

    private void reconcileOnce(String reason) {
        Optional<RosterSnapshot> observed = rosterSource.currentRoster();
        if (observed.isEmpty()) {
            log.debug("Roster unknown on {} refresh, keeping current state.", reason);
            return;
        }
        RosterSnapshot snapshot = observed.get();
        Instant now = clock.instant();

        List<RosterParticipant> participants = tracked(snapshot);
        storeProfiles(participants, now);

        Set<String> present = participants.stream()
                .map(RosterParticipant::getUserId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        sessionTracker.checkpoint(now);
        sessionTracker.reconcile(snapshot.getCallId(), present, now);
        metricsCollector.setGauge("presence.participants.active", present.size());

        logRoster(snapshot.getCallId(), present);
    }

    private List<RosterParticipant> tracked(RosterSnapshot snapshot) {
        List<RosterParticipant> tracked = new ArrayList<>();
        if (snapshot.getCallId() == null || snapshot.getParticipants() == null) {
            return tracked;
        }
        for (RosterParticipant participant : snapshot.getParticipants()) {
            if (participant == null || participant.getUserId() == null || participant.getUserId().isBlank()) {
                continue;
            }
            if (!excludedUserIds.contains(participant.getUserId().trim())) {
                tracked.add(participant);
            }
        }
        return tracked;
    }

    private void storeProfiles(List<RosterParticipant> participants, Instant now) {
        boolean changed = false;
        for (RosterParticipant participant : participants) {
            String userId = participant.getUserId().trim();
            String names = participant.getDisplayName() + "|" + participant.getUsername();
            if (Objects.equals(storedNames.get(userId), names)) {
                continue;
            }
            userProfileRepository.upsert(UserProfile.builder()
                    .userId(userId)
                    .displayName(participant.getDisplayName())
                    .username(participant.getUsername())
                    .updatedAt(now.atOffset(ZoneOffset.UTC))
                    .build());
            storedNames.put(userId, names);
            displayNameResolver.invalidate(userId);
            changed = true;
        }
        if (changed) {
            aliasResolver.refresh();
        }
    }

    private void logRoster(String callId, Set<String> present) {
        if (callId == null) {
            log.debug("No call running.");
            return;
        }
        AliasMapping aliases = aliasResolver.current();
        String names = present.stream()
                .map(id -> displayNameResolver.displayNameOf(aliases.canonicalOf(id), aliases))
                .collect(Collectors.joining(", "));
        log.info("Call {} roster ({}): {}", callId, present.size(), names);
    }

    /**
     * Waits for an in-flight refresh, then writes every open segment.
     */
    @PreDestroy
    public void onShutdown() {
        log.info("Flushing open presence segments before shutdown...");
        refreshLock.lock();
        try {
            sessionTracker.flushAll(clock.instant());
            log.info("Open presence segments flushed.");
        } catch (DurationStoreException e) {
            log.error("Failed to flush open presence segments on shutdown.", e);
        } finally {
            refreshLock.unlock();
        }
    }
}
