package com.pageanalytics.config;

import com.pageanalytics.infrastructure.lock.AdvisoryRecomputeLock;
import com.pageanalytics.infrastructure.lock.LocalRecomputeLock;
import com.pageanalytics.infrastructure.lock.OrderedRecomputeLock;
import com.pageanalytics.infrastructure.lock.PassThroughRecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLockTemplate;
import com.pageanalytics.infrastructure.lock.RedisRecomputeLock;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Chooses the recompute lock backend.
 *
 * AUTO holds the lock on every reachable backend in a fixed order: PostgreSQL
 * advisory lock (when the datasource is PostgreSQL), then Redis. Backends that
 * fail are skipped with a warning; when none is reachable the run proceeds
 * through the pass-through lock, also with a warning.
 *
 * REDIS, ADVISORY and LOCAL use that backend alone and fail the run when it
 * is unreachable. NONE is always pass-through.
 */
@Slf4j
@Configuration
public class RecomputeLockConfig {

    @Bean
    public RecomputeLock recomputeLock(AnalyticsProperties properties,
                                       ObjectProvider<RedisTemplate<String, String>> redisTemplate,
                                       ObjectProvider<DataSource> dataSource) {
        AnalyticsProperties.Lock lock = properties.getLock();
        RedisTemplate<String, String> redis = redisTemplate.getIfAvailable();
        DataSource database = dataSource.getIfAvailable();

        RecomputeLock selected = switch (lock.getBackend()) {
            case REDIS -> new RedisRecomputeLock(required(redis, "REDIS"), lock.getLeaseTime(), lock.getRetryInterval());
            case ADVISORY -> new AdvisoryRecomputeLock(required(database, "ADVISORY"), lock.getRetryInterval());
            case LOCAL -> new LocalRecomputeLock();
            case NONE -> new PassThroughRecomputeLock();
            case AUTO -> autoSelect(lock, redis, database);
        };

        log.info("Recompute lock backend: {} ({})", lock.getBackend(), selected.getClass().getSimpleName());
        if (!selected.enforcesMutualExclusion()) {
            log.warn("Recompute lock does not enforce mutual exclusion; run a single recompute process only");
        }
        return selected;
    }

    @Bean
    public RecomputeLockTemplate recomputeLockTemplate(RecomputeLock recomputeLock,
                                                       AnalyticsProperties properties,
                                                       MeterRegistry meterRegistry) {
        return new RecomputeLockTemplate(recomputeLock, properties.getLock().getAcquireTimeout(), meterRegistry);
    }

    private RecomputeLock autoSelect(AnalyticsProperties.Lock lock,
                                     RedisTemplate<String, String> redis,
                                     DataSource database) {
        List<RecomputeLock> backends = new ArrayList<>(2);
        if (database != null && isPostgres(database)) {
            backends.add(new AdvisoryRecomputeLock(database, lock.getRetryInterval()));
        }
        if (redis != null) {
            backends.add(new RedisRecomputeLock(redis, lock.getLeaseTime(), lock.getRetryInterval()));
        }
        log.info("AUTO lock order: {}", backends.stream().map(b -> b.getClass().getSimpleName()).collect(Collectors.toList()));
        return new OrderedRecomputeLock(backends, new PassThroughRecomputeLock());
    }

    private boolean isPostgres(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.getMetaData().getDatabaseProductName().toLowerCase().contains("postgresql");
        } catch (SQLException e) {
            log.warn("Cannot inspect datasource for advisory lock support: {}", e.getMessage());
            return false;
        }
    }

    private static <T> T required(T backend, String name) {
        if (backend == null) {
            throw new IllegalStateException("Lock backend " + name + " is configured but not available");
        }
        return backend;
    }
}
