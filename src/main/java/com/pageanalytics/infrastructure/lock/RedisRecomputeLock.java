package com.pageanalytics.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Recompute lock on Redis SET NX with a lease.
 * 
 * The key holds a random token per acquisition. Release deletes the key only
 * if it still holds that token, so a holder whose lease expired cannot drop a
 * lock that someone else has since taken.
 * 
 * The lease bounds how long a crashed holder blocks others. Long runs keep
 * it alive through {@link #renew}, which also only touches the key while it
 * still holds this handle's token.
 */
@Slf4j
public class RedisRecomputeLock implements RecomputeLock {
    
    private static final String KEY_PREFIX = "analytics:lock:";
    
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);
    
    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);
    
    private final RedisTemplate<String, String> redisTemplate;
    private final Duration leaseTime;
    private final Duration retryInterval;
    
    public RedisRecomputeLock(RedisTemplate<String, String> redisTemplate, Duration leaseTime, Duration retryInterval) {
        this.redisTemplate = redisTemplate;
        this.leaseTime = leaseTime;
        this.retryInterval = retryInterval;
    }
    
    @Override
    public Optional<LockHandle> acquire(String scope, Duration timeout) {
        String key = KEY_PREFIX + scope;
        LockHandle handle = LockHandle.of(scope, this);
        long deadline = System.nanoTime() + timeout.toNanos();
        
        try {
            while (true) {
                Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, handle.getToken(), leaseTime);
                if (Boolean.TRUE.equals(acquired)) {
                    log.debug("Acquired Redis lock {}", key);
                    return Optional.of(handle);
                }
                if (System.nanoTime() >= deadline) {
                    return Optional.empty();
                }
                Thread.sleep(retryInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new LockBackendException("Redis lock backend failed for " + scope, e);
        }
    }
    
    @Override
    public void release(LockHandle handle) {
        String key = KEY_PREFIX + handle.getScope();
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), handle.getToken());
            if (deleted == null || deleted == 0) {
                log.warn("Redis lock {} was no longer held at release (lease expired?)", key);
            }
        } catch (DataAccessException e) {
            // The lease expires on its own
            log.error("Failed to release Redis lock {}: {}", key, e.getMessage());
        }
    }
    
    @Override
    public boolean renew(LockHandle handle) {
        String key = KEY_PREFIX + handle.getScope();
        try {
            Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(key), handle.getToken(),
                    String.valueOf(leaseTime.toMillis()));
            if (renewed == null || renewed == 0) {
                log.error("Redis lock {} lost before renewal (lease expired?)", key);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            // Still ours until the lease runs out
            log.warn("Failed to renew Redis lock {}: {}", key, e.getMessage());
            return true;
        }
    }
}
