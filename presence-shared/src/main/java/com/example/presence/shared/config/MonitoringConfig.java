package com.example.presence.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the presence tracker.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder presenceMetrics() {
        return registry -> {
            registry.counter("presence.segments.committed");
            registry.counter("presence.seconds.discarded");
            registry.counter("presence.refresh.dropped");
            registry.counter("presence.leaderboard.published", "status", "success");
            registry.counter("presence.leaderboard.published", "status", "failed");
            registry.counter("presence.errors", "type", "database");
            registry.counter("presence.errors", "type", "export");
            registry.counter("presence.errors", "type", "publish");

            Timer.builder("presence.aggregation.latency")
                    .description("Time taken to build a leaderboard snapshot")
                    .register(registry);
        };
    }

    @Bean
    public PresenceMetricsCollector presenceMetricsCollector(MeterRegistry registry) {
        return new PresenceMetricsCollector(registry);
    }

    /**
     * Caches the tracker's counters, timers and gauges by name and tags so hot paths such as
     * roster reconciliation and segment commits do not re-register meters on every call.
     */
    public static class PresenceMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public PresenceMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1.0, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).register(registry))
                  .record(durationMs, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set(value);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
