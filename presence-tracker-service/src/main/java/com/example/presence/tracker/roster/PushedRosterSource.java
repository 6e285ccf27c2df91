package com.example.presence.tracker.roster;

import com.example.presence.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last roster pushed by the transport adapter. Once it is older than
 * {@code presence.roster.stale-after-ms} it is reported as unknown.
 */
@Component
@Slf4j
public class PushedRosterSource implements RosterSource {

    private final AtomicReference<RosterSnapshot> latest = new AtomicReference<>();
    private final Clock clock;
    private final Duration staleAfter;

    public PushedRosterSource(Clock trackerClock, AppProperties appProperties) {
        this.clock = trackerClock;
        this.staleAfter = Duration.ofMillis(appProperties.getRoster().getStaleAfterMs());
    }

    public void accept(RosterSnapshot snapshot) {
        if (snapshot.getObservedAt() == null) {
            snapshot.setObservedAt(clock.instant());
        }
        latest.set(snapshot);
        log.debug("Roster pushed: call={}, {} participants", snapshot.getCallId(), snapshot.getParticipants().size());
    }

    @Override
    public Optional<RosterSnapshot> currentRoster() {
        RosterSnapshot snapshot = latest.get();
        if (snapshot == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (Duration.between(snapshot.getObservedAt(), now).compareTo(staleAfter) > 0) {
            log.debug("Last pushed roster from {} is stale, treating roster as unknown.", snapshot.getObservedAt());
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }
}
