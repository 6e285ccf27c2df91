package com.example.presence.tracker.admin;

import com.example.presence.tracker.alias.AliasResolver;
import com.example.presence.tracker.publish.LeaderboardPublishingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Startup order: group identity check, alias mapping, then tracking and a catch-up post
 * if today's post time already passed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackerStartupRunner implements ApplicationRunner {

    private final TrackerResetService trackerResetService;
    private final AliasResolver aliasResolver;
    private final TrackerReadiness readiness;
    private final LeaderboardPublishingService publishingService;

    @Override
    public void run(ApplicationArguments args) {
        trackerResetService.ensureGroupIdentity();
        aliasResolver.refresh();
        readiness.markReady();
        log.info("Presence tracker ready.");
        publishingService.publishIfDue("catch-up");
    }
}
