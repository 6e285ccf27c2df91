package com.example.presence.tracker.controller;

import com.example.presence.tracker.admin.TrackerResetService;
import com.example.presence.tracker.admin.TrackerStateService;
import com.example.presence.tracker.alias.AliasMapping;
import com.example.presence.tracker.alias.AliasResolver;
import com.example.presence.tracker.backfill.BackfillReport;
import com.example.presence.tracker.backfill.BackfillService;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import com.example.presence.tracker.dto.TrackerStateResponse;
import com.example.presence.tracker.publish.LeaderboardPublishingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.LocalDate;
import java.util.Map;

/**
 * Operator endpoints. Every call touches the database, so work runs on the JDBC scheduler.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class TrackerAdminController {

    private final TrackerStateService trackerStateService;
    private final LeaderboardPublishingService publishingService;
    private final BackfillService backfillService;
    private final TrackerResetService trackerResetService;
    private final AliasResolver aliasResolver;
    private final Scheduler jdbcScheduler;

    @GetMapping("/state")
    public Mono<ResponseEntity<TrackerStateResponse>> getState() {
        return Mono.fromCallable(trackerStateService::currentState)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/leaderboard/preview")
    public Mono<ResponseEntity<LeaderboardSnapshot>> previewLeaderboard() {
        return Mono.fromCallable(publishingService::preview)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/leaderboard/post-now")
    public Mono<ResponseEntity<LeaderboardSnapshot>> postNow() {
        log.info("Admin requested an immediate leaderboard post.");
        return Mono.fromCallable(publishingService::postNow)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/backfill")
    public Mono<ResponseEntity<BackfillReport>> backfill(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "false") boolean inspect) {
        log.info("Admin requested backfill start={}, end={}, inspect={}", start, end, inspect);
        return Mono.fromCallable(() -> backfillService.replay(start, end, inspect))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<Map<String, String>>> hardReset() {
        log.warn("Admin requested a hard reset.");
        return Mono.fromCallable(trackerResetService::hardReset)
                .subscribeOn(jdbcScheduler)
                .map(anchor -> ResponseEntity.ok(Map.of("anchorDate", anchor.toString())));
    }

    @PostMapping("/aliases/refresh")
    public Mono<ResponseEntity<Map<String, Integer>>> refreshAliases() {
        return Mono.fromCallable(aliasResolver::refresh)
                .subscribeOn(jdbcScheduler)
                .map(AliasMapping::size)
                .map(size -> ResponseEntity.ok(Map.of("mappedIds", size)));
    }
}
