package com.pageanalytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageanalytics.domain.model.AnalyticsFilterRequest;
import com.pageanalytics.domain.model.DateRange;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for analytics query results.
 * 
 * Keys are built from the query kind, its scope, the resolved day range and
 * the normalized filters, so requests that differ only in how they name the
 * same range or in the order of their country lists share one entry.
 * Entries expire after the configured TTL and are not invalidated by
 * aggregation runs: a cached answer may be stale by up to one TTL, never
 * wrong for the summaries it was computed from.
 * 
 * Failure Handling:
 * - Redis errors open the circuit breaker; while open the cache is bypassed
 * - An entry that no longer deserializes is deleted and treated as a miss
 * - A cache failure is a miss, never a query failure
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {
    
    private static final String KEY_PREFIX = "analytics:query";
    private static final String UNSET = "-";
    
    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        
        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            log.warn("Evicting unreadable cache entry {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }
    
    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize {} for cache: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }
    
    /**
     * Key for an analytics query. The range fields of the filters are left
     * out in favor of the resolved range; country lists are sorted and
     * de-duplicated. Unset filters are written as "-" so an empty list stays
     * distinct from no list.
     */
    public String analyticsKey(String kind, Object scope, DateRange range, AnalyticsFilterRequest filters) {
        return String.join(":",
                KEY_PREFIX,
                kind,
                scope != null ? scope.toString() : UNSET,
                range.getStart() + ".." + range.getEnd(),
                "c=" + normalized(filters.getCountryCodes()),
                "xc=" + normalized(filters.getExcludeCountryCodes()),
                "a=" + orUnset(filters.getAuthorUsername()),
                "b=" + orUnset(filters.getBlogId()),
                "t=" + orUnset(filters.getContentType()),
                "cmp=" + orUnset(filters.getCompare()),
                "s=" + filters.isStrictCompleteness());
    }
    
    private static String normalized(Collection<String> values) {
        return values == null ? UNSET : String.join(",", new TreeSet<>(values));
    }
    
    private static String orUnset(Object value) {
        return value == null ? UNSET : value.toString();
    }
    
    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis cache unavailable, computing {} without cache: {}", key, e.getMessage());
        return Optional.empty();
    }
    
    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis cache unavailable, skipping cache write for {}: {}", key, e.getMessage());
    }
}
