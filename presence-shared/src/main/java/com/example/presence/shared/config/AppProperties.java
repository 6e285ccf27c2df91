package com.example.presence.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    /**
     * IANA zone used for day boundaries, post time and date labels.
     */
    @NotBlank
    private String zone = "Asia/Tashkent";

    /**
     * Identity of the tracked group. A change triggers a full reset of totals and anchor.
     */
    @NotBlank
    private String groupKey = "default-group";

    @Valid
    private final Session session = new Session();
    @Valid
    private final Roster roster = new Roster();
    @Valid
    private final Leaderboard leaderboard = new Leaderboard();
    @Valid
    private final Alias alias = new Alias();
    @Valid
    private final Export export = new Export();
    @Valid
    private final Backfill backfill = new Backfill();
    @Valid
    private final Cache cache = new Cache();

    @Data
    public static class Session {
        // Minimum time within one call before any of it counts
        @Positive
        private long minSeconds = 300L;
        @Positive
        private long flushIntervalSeconds = 600L;
        @Positive
        private long pollIntervalMs = 30000L;
        @PositiveOrZero
        private long pollInitialDelayMs = 5000L;
        private List<String> excludedUserIds = new ArrayList<>();
    }

    @Data
    public static class Roster {
        @Positive
        private long staleAfterMs = 120000L;
    }

    @Data
    public static class Leaderboard {
        @Min(0)
        @Max(23)
        private int postHour = 22;
        @Min(0)
        @Max(59)
        private int postMinute = 0;
        @Positive
        private long checkIntervalMs = 30000L;
        @Positive
        private int showMaxPerList = 10;
        private boolean useCompliments = true;
        private String complimentsLocation = "classpath:compliments.txt";
        private String quotesLocation = "classpath:quotes.txt";
    }

    @Data
    public static class Alias {
        private List<Group> groups = new ArrayList<>();

        @Data
        public static class Group {
            private String primary;
            private List<String> members = new ArrayList<>();
            private String label;
        }
    }

    @Data
    public static class Export {
        private boolean enabled = false;
        private String ingestUrl;
        private String ingestSecret;
        @PositiveOrZero
        private long timeoutMs = 1500L;
    }

    @Data
    public static class Backfill {
        @Positive
        private int defaultWindowDays = 60;
    }

    @Data
    public static class Cache {
        @Positive
        private int displayNamesMaximumSize = 10000;
        @Positive
        private long displayNamesExpireAfterWriteMinutes = 30L;
    }
}
