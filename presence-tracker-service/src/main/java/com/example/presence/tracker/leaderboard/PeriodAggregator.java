package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.exception.LeaderboardAggregationException;
import com.example.presence.shared.repository.DurationStore;
import com.example.presence.shared.util.Constants.Scope;
import com.example.presence.tracker.alias.AliasMapping;
import com.example.presence.tracker.alias.AliasResolver;
import com.example.presence.tracker.dto.BoardSnapshot;
import com.example.presence.tracker.dto.LeaderboardEntry;
import com.example.presence.tracker.dto.LeaderboardSnapshot;
import com.example.presence.tracker.roster.DisplayNameResolver;
import com.example.presence.tracker.session.DayBoundarySplitter;
import com.example.presence.tracker.session.DaySlice;
import com.example.presence.tracker.session.LiveSessionView;
import com.example.presence.tracker.session.Segment;
import com.example.presence.tracker.session.SessionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the day, week and month boards.
 * <p>
 * Stored totals are read per window and folded onto canonical ids. For the current moment
 * ({@code referenceDate == null}) the running session is blended in without being written:
 * a canonical identity counts once the union of its aliases is qualified or would qualify with the
 * time elapsed so far, and each alias then adds its own open time. Live time is split at local
 * midnight so it only lands in windows containing those dates.
 * <p>
 * Any store failure aborts the whole build.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodAggregator {

    private final DurationStore durationStore;
    private final SessionTracker sessionTracker;
    private final AliasResolver aliasResolver;
    private final AnchorService anchorService;
    private final ComplimentPicker complimentPicker;
    private final DisplayNameResolver displayNameResolver;
    private final QuoteOfTheDay quoteOfTheDay;
    private final DayBoundarySplitter dayBoundarySplitter;
    private final AppProperties appProperties;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    /**
     * @param now           the build instant; also the end of every live open segment
     * @param referenceDate the historical day to rebuild, or {@code null} for today with live blending
     */
    public LeaderboardSnapshot buildBoard(Instant now, LocalDate referenceDate) {
        long startTime = System.currentTimeMillis();
        ZoneId zone = dayBoundarySplitter.getZone();
        boolean live = referenceDate == null;
        LocalDate today = now.atZone(zone).toLocalDate();
        LocalDate date = live ? today : referenceDate;

        try {
            // Historical rebuilds never write meta; without an anchor the reference date starts day 1
            LocalDate anchor = live ? anchorService.ensureAnchor(today) : anchorService.currentAnchor().orElse(date);
            AliasMapping aliases = aliasResolver.current();
            List<PeriodWindow> windows = PeriodWindows.all(anchor, date);

            Map<Scope, Map<String, Long>> totals = new EnumMap<>(Scope.class);
            for (PeriodWindow window : windows) {
                totals.put(window.scope(), fold(durationStore.sumSecondsByUser(window.start(), window.end()), aliases));
            }

            if (live) {
                blendLive(totals, windows, aliases, now);
            }

            Map<Scope, List<Map.Entry<String, Long>>> ranked = new EnumMap<>(Scope.class);
            for (PeriodWindow window : windows) {
                ranked.put(window.scope(), rank(totals.get(window.scope())));
            }
            Map<Scope, Map<String, String>> compliments = pickCompliments(windows, ranked);

            List<BoardSnapshot> boards = new ArrayList<>();
            for (PeriodWindow window : windows) {
                boards.add(toBoard(window, ranked.get(window.scope()), compliments.get(window.scope()), aliases, zone));
            }

            LeaderboardSnapshot snapshot = LeaderboardSnapshot.builder()
                    .postedAt(now.atZone(zone).toOffsetDateTime())
                    .referenceDate(date)
                    .anchorDate(anchor)
                    .dayIndex(PeriodWindows.dayIndex(anchor, date))
                    .live(live)
                    .boards(boards)
                    .wordOfTheDay(quoteOfTheDay.forDay(anchor, date).orElse(null))
                    .build();
            log.debug("Built leaderboard for {} (live={}): day={}, week={}, month={}", date, live,
                    ranked.get(Scope.DAY).size(), ranked.get(Scope.WEEK).size(), ranked.get(Scope.MONTH).size());
            return snapshot;
        } catch (DurationStoreException e) {
            throw new LeaderboardAggregationException("Could not build leaderboard for " + date, date, e);
        } finally {
            metricsCollector.recordTimer("presence.aggregation.latency", System.currentTimeMillis() - startTime);
        }
    }

    private static Map<String, Long> fold(Map<String, Long> rawTotals, AliasMapping aliases) {
        Map<String, Long> folded = new HashMap<>();
        rawTotals.forEach((rawId, seconds) -> folded.merge(aliases.canonicalOf(rawId), seconds, Long::sum));
        return folded;
    }

    private void blendLive(Map<Scope, Map<String, Long>> totals, List<PeriodWindow> windows, AliasMapping aliases, Instant now) {
        LiveSessionView view = sessionTracker.liveSnapshot();
        if (!view.isActive() || view.activeSince().isEmpty()) {
            return;
        }
        Instant at = now.truncatedTo(ChronoUnit.SECONDS);
        long minSeconds = appProperties.getSession().getMinSeconds();

        Set<String> rawIds = new HashSet<>(view.activeSince().keySet());
        rawIds.addAll(view.accumulatedSeconds().keySet());
        Map<String, List<String>> rawIdsByCanonical = new TreeMap<>();
        for (String rawId : rawIds) {
            rawIdsByCanonical.computeIfAbsent(aliases.canonicalOf(rawId), id -> new ArrayList<>()).add(rawId);
        }

        Map<String, Long> storedToday = new HashMap<>(totals.get(Scope.DAY));

        for (Map.Entry<String, List<String>> group : rawIdsByCanonical.entrySet()) {
            String canonicalId = group.getKey();
            List<String> members = group.getValue();

            boolean anyActive = false;
            boolean sticky = false;
            long sessionSeconds = 0L;
            for (String rawId : members) {
                Instant since = view.activeSince().get(rawId);
                sessionSeconds += view.accumulatedOf(rawId);
                if (since != null) {
                    anyActive = true;
                    sessionSeconds += elapsed(since, at);
                }
                sticky |= view.qualified().contains(rawId);
            }
            if (!anyActive || (!sticky && sessionSeconds < minSeconds)) {
                continue;
            }

            List<DaySlice> contribution = new ArrayList<>();
            for (String rawId : members) {
                Instant since = view.activeSince().get(rawId);
                if (since == null) {
                    continue;
                }
                contribution.addAll(dayBoundarySplitter.split(since, at));
                // Held-back segments commit as soon as this alias closes its open segment
                if (!view.qualified().contains(rawId) && view.accumulatedOf(rawId) + elapsed(since, at) >= minSeconds) {
                    for (Segment segment : view.pendingOf(rawId)) {
                        contribution.addAll(dayBoundarySplitter.split(segment.start(), segment.end()));
                    }
                }
            }
            apply(canonicalId, contribution, totals, windows, storedToday.getOrDefault(canonicalId, 0L));
        }
    }

    private static void apply(String canonicalId, List<DaySlice> contribution, Map<Scope, Map<String, Long>> totals,
                              List<PeriodWindow> windows, long storedToday) {
        for (PeriodWindow window : windows) {
            long extra = 0L;
            for (DaySlice slice : contribution) {
                if (window.contains(slice.date())) {
                    extra += slice.seconds();
                }
            }
            if (extra <= 0) {
                continue;
            }
            Map<String, Long> scopeTotals = totals.get(window.scope());
            if (window.scope() == Scope.DAY) {
                scopeTotals.put(canonicalId, Math.max(scopeTotals.getOrDefault(canonicalId, 0L), storedToday) + extra);
            } else {
                scopeTotals.merge(canonicalId, extra, Long::sum);
            }
        }
    }

    private List<Map.Entry<String, Long>> rank(Map<String, Long> totals) {
        return totals.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(appProperties.getLeaderboard().getShowMaxPerList())
                .toList();
    }

    private Map<Scope, Map<String, String>> pickCompliments(List<PeriodWindow> windows,
                                                           Map<Scope, List<Map.Entry<String, Long>>> ranked) {
        Map<Scope, Map<String, String>> compliments = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            compliments.put(scope, new HashMap<>());
        }
        if (!appProperties.getLeaderboard().isUseCompliments()) {
            return compliments;
        }
        Map<Scope, PeriodWindow> byScope = new EnumMap<>(Scope.class);
        windows.forEach(w -> byScope.put(w.scope(), w));

        // Week and month first so the day pick can avoid them
        for (Map.Entry<String, Long> entry : ranked.get(Scope.WEEK)) {
            compliments.get(Scope.WEEK).put(entry.getKey(), complimentPicker.forWeek(entry.getKey(), byScope.get(Scope.WEEK)));
        }
        for (Map.Entry<String, Long> entry : ranked.get(Scope.MONTH)) {
            compliments.get(Scope.MONTH).put(entry.getKey(), complimentPicker.forMonth(entry.getKey(), byScope.get(Scope.MONTH)));
        }
        for (Map.Entry<String, Long> entry : ranked.get(Scope.DAY)) {
            String userId = entry.getKey();
            Set<String> avoid = new HashSet<>();
            String week = compliments.get(Scope.WEEK).get(userId);
            String month = compliments.get(Scope.MONTH).get(userId);
            if (week != null) {
                avoid.add(week);
            }
            if (month != null) {
                avoid.add(month);
            }
            compliments.get(Scope.DAY).put(userId, complimentPicker.forDay(userId, byScope.get(Scope.DAY), avoid));
        }
        return compliments;
    }

    private BoardSnapshot toBoard(PeriodWindow window, List<Map.Entry<String, Long>> ranked,
                                  Map<String, String> compliments, AliasMapping aliases, ZoneId zone) {
        List<LeaderboardEntry> entries = new ArrayList<>();
        int rank = 1;
        for (Map.Entry<String, Long> entry : ranked) {
            long seconds = entry.getValue();
            long minutes = seconds / 60;
            entries.add(LeaderboardEntry.builder()
                    .rank(rank++)
                    .userId(entry.getKey())
                    .seconds(seconds)
                    .minutes(minutes)
                    .displayName(displayNameResolver.displayNameOf(entry.getKey(), aliases))
                    .badge(BadgeTier.forMinutes(minutes))
                    .compliment(compliments.get(entry.getKey()))
                    .build());
        }
        return BoardSnapshot.builder()
                .scope(window.scope().key())
                .index(window.index())
                .periodStart(window.start().atStartOfDay(zone).toOffsetDateTime())
                .periodEnd(window.end().atTime(LocalTime.of(23, 59, 59)).atZone(zone).toOffsetDateTime())
                .label(window.label())
                .nobodyQualified(entries.isEmpty())
                .entries(entries)
                .build();
    }

    private static long elapsed(Instant since, Instant at) {
        return Math.max(0L, Duration.between(since, at).getSeconds());
    }
}
