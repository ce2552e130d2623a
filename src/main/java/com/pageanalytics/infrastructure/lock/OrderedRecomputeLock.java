package com.pageanalytics.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holds the lock on every reachable backend, always in the same order.
 * 
 * A backend that fails is skipped with a warning; a backend where the lock is
 * held ends the attempt, releasing whatever was already taken. Because every
 * process walks the backends in the same order, a process that cannot reach
 * one backend is still kept out by the others.
 * 
 * When no backend is reachable the degraded lock is used instead.
 */
@Slf4j
public class OrderedRecomputeLock implements RecomputeLock {
    
    private final List<RecomputeLock> backends;
    private final RecomputeLock degraded;
    
    public OrderedRecomputeLock(List<RecomputeLock> backends, RecomputeLock degraded) {
        this.backends = List.copyOf(backends);
        this.degraded = degraded;
    }
    
    @Override
    public Optional<LockHandle> acquire(String scope, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<LockHandle> held = new ArrayList<>(backends.size());
        
        for (RecomputeLock backend : backends) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            Optional<LockHandle> part;
            try {
                part = backend.acquire(scope, remaining);
            } catch (LockBackendException e) {
                log.warn("Lock backend {} unavailable for {} ({}); skipping it",
                        backend.getClass().getSimpleName(), scope, e.getMessage());
                continue;
            }
            if (part.isEmpty()) {
                releaseAll(held);
                return Optional.empty();
            }
            held.add(part.get());
        }
        
        if (held.isEmpty()) {
            log.warn("No lock backend reachable for {}; falling back to {}",
                    scope, degraded.getClass().getSimpleName());
            return degraded.acquire(scope, timeout);
        }
        return Optional.of(LockHandle.composite(scope, this, held));
    }
    
    @Override
    public void release(LockHandle handle) {
        if (handle.getIssuer() != this) {
            handle.getIssuer().release(handle);
            return;
        }
        releaseAll(handle.getParts());
    }
    
    @Override
    public boolean renew(LockHandle handle) {
        if (handle.getIssuer() != this) {
            return handle.getIssuer().renew(handle);
        }
        boolean held = true;
        for (LockHandle part : handle.getParts()) {
            held &= part.getIssuer().renew(part);
        }
        return held;
    }
    
    @Override
    public boolean enforcesMutualExclusion() {
        return !backends.isEmpty() && backends.stream().allMatch(RecomputeLock::enforcesMutualExclusion);
    }
    
    public List<RecomputeLock> getBackends() {
        return backends;
    }
    
    private void releaseAll(List<LockHandle> parts) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            LockHandle part = parts.get(i);
            part.getIssuer().release(part);
        }
    }
}
