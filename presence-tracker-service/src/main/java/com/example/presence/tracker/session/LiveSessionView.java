package com.example.presence.tracker.session;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable copy of the in-flight session, safe to read while tracking continues.
 *
 * @param callId             call being tracked, or {@code null} when no session is live
 * @param startedAt          when the session was first observed
 * @param activeSince        open segment start per raw user currently present
 * @param accumulatedSeconds closed seconds per raw user in this session, pending or committed
 * @param qualified          raw users whose session time already counts
 * @param pendingSegments    closed segments held back per not yet qualified raw user
 */
public record LiveSessionView(String callId,
                              Instant startedAt,
                              Map<String, Instant> activeSince,
                              Map<String, Long> accumulatedSeconds,
                              Set<String> qualified,
                              Map<String, List<Segment>> pendingSegments) {

    public static LiveSessionView idle() {
        return new LiveSessionView(null, null, Map.of(), Map.of(), Set.of(), Map.of());
    }

    public boolean isActive() {
        return callId != null;
    }

    public long accumulatedOf(String userId) {
        return accumulatedSeconds.getOrDefault(userId, 0L);
    }

    public List<Segment> pendingOf(String userId) {
        return pendingSegments.getOrDefault(userId, List.of());
    }
}
