package com.example.presence.tracker.publish;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.util.Constants;
import com.example.presence.tracker.dto.ExportPayload;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * POSTs the board to the configured ingest endpoint. Delivery failures are logged and never
 * block other publishers.
 */
@Component
@ConditionalOnProperty(prefix = "presence.export", name = "enabled", havingValue = "true")
@Slf4j
public class WebhookLeaderboardPublisher implements LeaderboardPublisher {

    static final String SECRET_HEADER = "X-Leaderboard-Secret";

    private final WebClient webClient;
    private final AppProperties.Export export;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    public WebhookLeaderboardPublisher(WebClient.Builder webClientBuilder,
                                       AppProperties appProperties,
                                       MonitoringConfig.PresenceMetricsCollector metricsCollector) {
        this.webClient = webClientBuilder.build();
        this.export = appProperties.getExport();
        this.metricsCollector = metricsCollector;
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void publish(LeaderboardSnapshot snapshot) {
        if (isBlank(export.getIngestUrl()) || isBlank(export.getIngestSecret())) {
            log.warn("Leaderboard export enabled but ingest URL or secret is missing; skipping.");
            return;
        }
        ExportPayload payload = ExportPayload.builder()
                .postedAt(snapshot.getPostedAt())
                .source(Constants.EXPORT_SOURCE)
                .dayIndex(snapshot.getDayIndex())
                .boards(snapshot.getBoards())
                .wordOfTheDay(snapshot.getWordOfTheDay())
                .build();
        try {
            webClient.post()
                    .uri(export.getIngestUrl())
                    .header(SECRET_HEADER, export.getIngestSecret())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(Duration.ofMillis(export.getTimeoutMs()))
                    .block();
            log.info("Leaderboard for {} exported to {}", snapshot.getReferenceDate(), export.getIngestUrl());
        } catch (RuntimeException e) {
            metricsCollector.incrementCounter("presence.errors", "type", "export");
            log.warn("Leaderboard export to {} failed: {}", export.getIngestUrl(), e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
