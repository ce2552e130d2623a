package com.pageanalytics.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Degraded mode: every acquisition succeeds immediately.
 * 
 * Only safe when a single process runs recomputation. Each acquisition logs a
 * warning so the missing mutual exclusion shows up in the logs.
 */
@Slf4j
public class PassThroughRecomputeLock implements RecomputeLock {
    
    @Override
    public Optional<LockHandle> acquire(String scope, Duration timeout) {
        log.warn("No lock backend available for {}; proceeding without mutual exclusion. "
                + "Ensure only one recompute runs at a time.", scope);
        return Optional.of(LockHandle.of(scope, this));
    }
    
    @Override
    public void release(LockHandle handle) {
        // nothing held
    }
    
    @Override
    public boolean enforcesMutualExclusion() {
        return false;
    }
}
