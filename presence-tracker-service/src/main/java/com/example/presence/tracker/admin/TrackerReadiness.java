package com.example.presence.tracker.admin;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set once startup checks (group identity, aliases) are done. Scheduled work waits for it.
 */
@Component
public class TrackerReadiness {

    private final AtomicBoolean ready = new AtomicBoolean(false);

    public boolean isReady() {
        return ready.get();
    }

    public void markReady() {
        ready.set(true);
    }
}
