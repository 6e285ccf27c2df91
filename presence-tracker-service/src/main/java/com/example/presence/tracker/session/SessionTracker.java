package com.example.presence.tracker.session;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owns the state of the live call: who is present since when, and how much each raw user
 * has accumulated in the current session.
 * <p>
 * Time only reaches the ledger once a user's session total crosses {@code minSeconds}; at that
 * point every segment held back for the user is committed, and later segments are committed
 * as they close. Users who never cross the threshold contribute nothing.
 * <p>
 * All public methods are serialized on this instance. A failed commit propagates as
 * {@link com.example.presence.shared.exception.DurationStoreException} and leaves the tracker in a
 * state the next call can resume from.
 */
@Component
@Slf4j
public class SessionTracker {

    private final SegmentCommitter committer;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final long minSeconds;
    private final long flushIntervalSeconds;

    private String callId;
    private Instant startedAt;
    private final Map<String, Instant> activeSince = new LinkedHashMap<>();
    private final Map<String, ParticipantAccumulator> accumulators = new HashMap<>();

    @Autowired
    public SessionTracker(SegmentCommitter committer,
                          AppProperties appProperties,
                          MonitoringConfig.PresenceMetricsCollector metricsCollector) {
        this(committer, metricsCollector,
                appProperties.getSession().getMinSeconds(),
                appProperties.getSession().getFlushIntervalSeconds());
    }

    public SessionTracker(SegmentCommitter committer,
                          MonitoringConfig.PresenceMetricsCollector metricsCollector,
                          long minSeconds,
                          long flushIntervalSeconds) {
        this.committer = committer;
        this.metricsCollector = metricsCollector;
        this.minSeconds = minSeconds;
        this.flushIntervalSeconds = flushIntervalSeconds;
    }

    /**
     * Applies one roster observation.
     *
     * @param observedCallId the live call, or {@code null} when the source reports that no call is running
     * @param roster         raw ids currently present; null and blank ids are ignored
     * @param now            observation time, truncated to whole seconds
     */
    public synchronized void reconcile(String observedCallId, Collection<String> roster, Instant now) {
        Instant at = truncate(now);

        if (observedCallId == null) {
            if (callId != null) {
                finalizeSession(at);
            }
            return;
        }

        if (!observedCallId.equals(callId)) {
            if (callId != null) {
                log.info("Call changed from {} to {}, closing the previous session first.", callId, observedCallId);
                finalizeSession(at);
            }
            startSession(observedCallId, at);
        }

        settlePendingQualifications();

        Set<String> present = sanitize(roster);
        List<String> left = new ArrayList<>();
        for (String userId : activeSince.keySet()) {
            if (!present.contains(userId)) {
                left.add(userId);
            }
        }
        for (String userId : left) {
            closeSegment(userId, at, false);
            log.info("User {} left call {} (session total {}s)", userId, callId, accumulators.get(userId).getAccumulatedSeconds());
        }

        for (String userId : present) {
            if (!activeSince.containsKey(userId)) {
                activeSince.put(userId, at);
                accumulators.computeIfAbsent(userId, id -> new ParticipantAccumulator());
                log.info("User {} joined call {}", userId, callId);
            }
        }
    }

    /**
     * Closes and reopens every open segment at least {@code flushIntervalSeconds} old, so long stays
     * reach the ledger without waiting for a leave.
     */
    public synchronized void checkpoint(Instant now) {
        flush(truncate(now), flushIntervalSeconds);
    }

    /**
     * Closes and reopens every open segment regardless of age. Used on shutdown.
     */
    public synchronized void flushAll(Instant now) {
        flush(truncate(now), 1L);
    }

    public synchronized LiveSessionView liveSnapshot() {
        if (callId == null) {
            return LiveSessionView.idle();
        }
        Map<String, Long> accumulated = new HashMap<>();
        Set<String> qualified = new HashSet<>();
        Map<String, List<Segment>> pending = new HashMap<>();
        accumulators.forEach((userId, accumulator) -> {
            accumulated.put(userId, accumulator.getAccumulatedSeconds());
            if (accumulator.isQualified()) {
                qualified.add(userId);
            } else if (accumulator.hasBufferedSegments()) {
                pending.put(userId, accumulator.bufferedSegments());
            }
        });
        return new LiveSessionView(callId, startedAt,
                Map.copyOf(activeSince), Map.copyOf(accumulated), Set.copyOf(qualified), Map.copyOf(pending));
    }

    public synchronized boolean isSessionActive() {
        return callId != null;
    }

    private void startSession(String newCallId, Instant at) {
        callId = newCallId;
        startedAt = at;
        activeSince.clear();
        accumulators.clear();
        log.info("Session started for call {} at {}", newCallId, at);
    }

    private void flush(Instant at, long minimumAgeSeconds) {
        if (callId == null) {
            return;
        }
        settlePendingQualifications();
        for (Map.Entry<String, Instant> entry : new ArrayList<>(activeSince.entrySet())) {
            long age = Duration.between(entry.getValue(), at).getSeconds();
            if (age >= minimumAgeSeconds) {
                closeSegment(entry.getKey(), at, true);
                log.debug("Checkpointed {}s for user {}", age, entry.getKey());
            }
        }
    }

    /**
     * The single path by which an open segment is closed, for leave, checkpoint and session end.
     * A qualified user's segment is committed before the open start moves, so a failed write keeps
     * the user open from the same instant for the next attempt. A pending user's segment is buffered
     * first; if that crosses the threshold the buffered segments are committed.
     */
    private void closeSegment(String userId, Instant end, boolean reopen) {
        Instant start = activeSince.get(userId);
        ParticipantAccumulator accumulator = accumulators.computeIfAbsent(userId, id -> new ParticipantAccumulator());
        Segment segment = new Segment(userId, start, end);

        if (accumulator.isQualified()) {
            committer.commit(segment);
            accumulator.recordCommitted(segment);
            advance(userId, end, reopen);
            return;
        }

        accumulator.buffer(segment);
        advance(userId, end, reopen);
        if (accumulator.reachedThreshold(minSeconds)) {
            log.info("User {} qualified in call {} with {}s", userId, callId, accumulator.getAccumulatedSeconds());
            accumulator.qualify(committer::commit);
        }
    }

    private void advance(String userId, Instant end, boolean reopen) {
        if (reopen) {
            activeSince.put(userId, end);
        } else {
            activeSince.remove(userId);
        }
    }

    /**
     * Retries qualification commits that failed on an earlier call.
     */
    private void settlePendingQualifications() {
        for (ParticipantAccumulator accumulator : accumulators.values()) {
            if (!accumulator.isQualified() && accumulator.reachedThreshold(minSeconds)) {
                accumulator.qualify(committer::commit);
            }
        }
    }

    /**
     * Session end: close everyone, commit users at or above the threshold, drop the rest.
     * State is cleared only after every commit succeeded.
     */
    private void finalizeSession(Instant at) {
        for (String userId : new ArrayList<>(activeSince.keySet())) {
            closeSegment(userId, at, false);
        }

        int qualifiedUsers = 0;
        long discardedSeconds = 0L;
        for (Map.Entry<String, ParticipantAccumulator> entry : accumulators.entrySet()) {
            ParticipantAccumulator accumulator = entry.getValue();
            if (!accumulator.isQualified() && accumulator.reachedThreshold(minSeconds)) {
                accumulator.qualify(committer::commit);
            }
            if (accumulator.isQualified()) {
                qualifiedUsers++;
            } else {
                long discarded = accumulator.discard();
                if (discarded > 0) {
                    log.info("User {} stayed {}s in call {}, below the {}s minimum; nothing recorded.",
                            entry.getKey(), discarded, callId, minSeconds);
                }
                discardedSeconds += discarded;
            }
        }

        if (discardedSeconds > 0) {
            metricsCollector.incrementCounter("presence.seconds.discarded", discardedSeconds);
        }
        log.info("Session for call {} ended at {}: {} of {} participants qualified.", callId, at, qualifiedUsers, accumulators.size());

        callId = null;
        startedAt = null;
        activeSince.clear();
        accumulators.clear();
    }

    private static Set<String> sanitize(Collection<String> roster) {
        Set<String> present = new LinkedHashSet<>();
        if (roster == null) {
            return present;
        }
        for (String userId : roster) {
            if (userId != null && !userId.isBlank()) {
                present.add(userId.trim());
            }
        }
        return present;
    }

    private static Instant truncate(Instant now) {
        return now.truncatedTo(ChronoUnit.SECONDS);
    }
}
