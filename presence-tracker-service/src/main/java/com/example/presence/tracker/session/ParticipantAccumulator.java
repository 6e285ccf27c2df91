package com.example.presence.tracker.session;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-session state of one raw user: either pending, with its segments held back,
 * or qualified, in which case every later segment is committed as soon as it closes.
 * Qualification is sticky for the rest of the session.
 */
final class ParticipantAccumulator {

    private long accumulatedSeconds;
    private boolean qualified;
    private final Deque<Segment> buffered = new ArrayDeque<>();

    long getAccumulatedSeconds() {
        return accumulatedSeconds;
    }

    boolean isQualified() {
        return qualified;
    }

    List<Segment> bufferedSegments() {
        return List.copyOf(buffered);
    }

    boolean hasBufferedSegments() {
        return !buffered.isEmpty();
    }

    /**
     * Counts a segment that has already been written to the ledger.
     */
    void recordCommitted(Segment segment) {
        accumulatedSeconds += segment.seconds();
    }

    void buffer(Segment segment) {
        buffered.addLast(segment);
        accumulatedSeconds += segment.seconds();
    }

    boolean reachedThreshold(long minSeconds) {
        return accumulatedSeconds >= minSeconds;
    }

    /**
     * Pending to qualified. Buffered segments are handed to {@code committer} oldest first and each is
     * dropped from the buffer only after it was accepted, so a failure leaves exactly the uncommitted ones.
     */
    void qualify(Consumer<Segment> committer) {
        while (!buffered.isEmpty()) {
            committer.accept(buffered.peekFirst());
            buffered.removeFirst();
        }
        qualified = true;
    }

    /**
     * Drops buffered segments of a user who never qualified. Returns the discarded seconds.
     */
    long discard() {
        long discarded = 0L;
        for (Segment segment : buffered) {
            discarded += segment.seconds();
        }
        buffered.clear();
        return discarded;
    }
}
