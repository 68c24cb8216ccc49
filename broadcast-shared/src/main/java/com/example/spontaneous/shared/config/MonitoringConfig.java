package com.example.spontaneous.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for broadcasts, join requests, expiry sweeps and creator notifications.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    public static final String BROADCASTS_CREATED = "broadcast.created";
    public static final String JOIN_REQUESTS = "broadcast.join.requests";
    public static final String JOIN_DECISIONS = "broadcast.join.decisions";
    public static final String BROADCASTS_EXPIRED = "broadcast.expiry.flipped";
    public static final String BROADCASTS_PURGED = "broadcast.expiry.purged";
    public static final String NOTIFICATIONS_PUBLISHED = "broadcast.notifications.published";
    public static final String NOTIFICATIONS_DISPATCHED = "broadcast.notifications.dispatched";

    /**
     * Registers the domain counters up front so they are exported at zero before the first event.
     */
    @Bean
    public MeterBinder broadcastMetrics() {
        return registry -> {
            registry.counter(BROADCASTS_CREATED);
            registry.counter(JOIN_REQUESTS, "outcome", "accepted");
            registry.counter(JOIN_REQUESTS, "outcome", "rejected");
            registry.counter(BROADCASTS_EXPIRED);
            registry.counter(BROADCASTS_PURGED);
            registry.counter(NOTIFICATIONS_PUBLISHED, "status", "success");
            registry.counter(NOTIFICATIONS_PUBLISHED, "status", "failed");
        };
    }

    @Bean
    public BroadcastMetricsCollector broadcastMetricsCollector(MeterRegistry registry) {
        return new BroadcastMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths do not go through the registry lookup.
     */
    public static class BroadcastMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public BroadcastMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).register(registry))
                  .record(duration, TimeUnit.MILLISECONDS);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
