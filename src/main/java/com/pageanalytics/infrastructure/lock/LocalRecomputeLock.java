package com.pageanalytics.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-process recompute lock for single-instance deployments.
 * 
 * One permit per scope. Semaphores are not owned by threads, so a lock may be
 * released from a different thread than the one that acquired it.
 */
@Slf4j
public class LocalRecomputeLock implements RecomputeLock {
    
    private final Map<String, Semaphore> permits = new ConcurrentHashMap<>();
    
    @Override
    public Optional<LockHandle> acquire(String scope, Duration timeout) {
        Semaphore permit = permits.computeIfAbsent(scope, s -> new Semaphore(1));
        try {
            if (permit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Optional.of(LockHandle.of(scope, this));
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
    
    @Override
    public void release(LockHandle handle) {
        Semaphore permit = permits.get(handle.getScope());
        if (permit == null || permit.availablePermits() > 0) {
            log.warn("Local lock {} was not held at release", handle.getScope());
            return;
        }
        permit.release();
    }
}
