package com.pageanalytics.config;

import com.pageanalytics.domain.model.DistinctMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Feature flags and tuning for aggregation and queries.
 *
 * Bound once at startup and passed into the engine and query service;
 * core code never reads ambient settings.
 */
@Data
@ConfigurationProperties(prefix = "app.analytics")
public class AnalyticsProperties {

    private DistinctMode distinctMode = DistinctMode.EXACT;

    // HyperLogLog keys expire after this many days
    private int sketchRetentionDays = 90;

    private Lock lock = new Lock();

    private Query query = new Query();

    private Performance performance = new Performance();

    private Schedule schedule = new Schedule();

    public enum LockBackend {
        AUTO,
        REDIS,
        ADVISORY,
        LOCAL,
        NONE
    }

    @Data
    public static class Lock {
        private LockBackend backend = LockBackend.AUTO;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration retryInterval = Duration.ofMillis(500);
        // Redis key TTL, so a crashed holder cannot block forever
        private Duration leaseTime = Duration.ofHours(1);
    }

    @Data
    public static class Query {
        private int defaultRangeDays = 30;
        private int topLimit = 10;
    }

    @Data
    public static class Performance {
        // "viewed" counts distinct blogs viewed per period, "created" counts blogs published
        private String blogMetric = "viewed";
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 1 * * *";
    }
}
