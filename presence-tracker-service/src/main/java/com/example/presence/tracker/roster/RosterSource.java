package com.example.presence.tracker.roster;

import java.util.Optional;

/**
 * Where roster observations come from.
 */
public interface RosterSource {

    /**
     * The latest known roster, or empty when the source cannot currently tell (transport error,
     * stale data). Callers keep their state on empty.
     */
    Optional<RosterSnapshot> currentRoster();
}
