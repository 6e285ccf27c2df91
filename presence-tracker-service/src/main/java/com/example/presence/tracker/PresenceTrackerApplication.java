package com.example.presence.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableAsync;
import reactor.core.publisher.Hooks;

/**
 * Presence tracker: turns roster observations of a recurring group call into qualified
 * per-day presence time and posts day, week and month leaderboards.
 */
@SpringBootApplication
@EnableAsync
@ComponentScan("com.example.presence")
public class PresenceTrackerApplication {

    static {
        // Carries the MDC correlation id across Reactor schedulers
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(PresenceTrackerApplication.class, args);
    }
}
