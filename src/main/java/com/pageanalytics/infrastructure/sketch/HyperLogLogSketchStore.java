package com.pageanalytics.infrastructure.sketch;

import com.pageanalytics.domain.distinct.SketchCounter;
import com.pageanalytics.domain.model.GroupingDimension;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Per-day HyperLogLog sketches in Redis.
 * 
 * Key format: analytics:hll:{date}:{dimension}:{groupKey}
 * 
 * Write path (aggregation): DEL + PFADD + EXPIRE, so a re-run of a day
 * replaces the sketch instead of accumulating into it.
 * Read path (queries): PFCOUNT over all keys of a group, which returns the
 * estimated cardinality of their union.
 * 
 * Sketches are optional. A failed write leaves the summary row without a
 * sketch; a failed count makes the query fall back to the exact union.
 */
@Slf4j
@Service
public class HyperLogLogSketchStore implements SketchCounter {
    
    private static final String KEY_PREFIX = "analytics:hll";
    
    private final RedisTemplate<String, String> redisTemplate;
    private final int retentionDays;
    
    public HyperLogLogSketchStore(RedisTemplate<String, String> redisTemplate,
                                  @Value("${app.analytics.sketch-retention-days:90}") int retentionDays) {
        this.redisTemplate = redisTemplate;
        this.retentionDays = retentionDays;
    }
    
    public static String sketchKey(LocalDate day, GroupingDimension dimension, String groupKey) {
        return KEY_PREFIX + ":" + day + ":" + dimension.name().toLowerCase() + ":" + groupKey;
    }
    
    /**
     * Replaces the sketch under the key with one built from the item ids.
     * 
     * @return true if the sketch was written
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "replaceFallback")
    public boolean replace(String key, Collection<Long> itemIds) {
        try {
            redisTemplate.delete(key);
            if (itemIds.isEmpty()) {
                return true;
            }
            String[] values = itemIds.stream().map(String::valueOf).toArray(String[]::new);
            redisTemplate.opsForHyperLogLog().add(key, values);
            redisTemplate.expire(key, retentionDays, TimeUnit.DAYS);
            log.debug("Wrote sketch {} ({} items)", key, values.length);
            return true;
            
        } catch (Exception e) {
            log.error("Failed to write sketch {}: {}", key, e.getMessage());
            return false;
        }
    }
    
    /**
     * PFCOUNT over the keys. Failures propagate so callers can fall back.
     */
    @Override
    @CircuitBreaker(name = "redis")
    public long count(Collection<String> sketchKeys) {
        Long size = redisTemplate.opsForHyperLogLog().size(sketchKeys.toArray(new String[0]));
        if (size == null) {
            throw new IllegalStateException("PFCOUNT returned no value for " + sketchKeys.size() + " keys");
        }
        return size;
    }
    
    private boolean replaceFallback(String key, Collection<Long> itemIds, Exception e) {
        log.warn("Redis circuit breaker open, skipping sketch write for {}", key);
        return false;
    }
}
