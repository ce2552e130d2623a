package com.pageanalytics.infrastructure.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Named advisory lock guarding summary recomputation.
 * 
 * Implementations block for at most the given timeout. An empty result means
 * the lock is held by someone else; a {@link LockBackendException} means the
 * backend itself failed.
 */
public interface RecomputeLock {
    
    Optional<LockHandle> acquire(String scope, Duration timeout);
    
    void release(LockHandle handle);
    
    /**
     * Extends the hold for backends whose locks expire.
     * 
     * @return false if the lock is known to be lost
     */
    default boolean renew(LockHandle handle) {
        return true;
    }
    
    /**
     * False for implementations that never block anyone.
     */
    default boolean enforcesMutualExclusion() {
        return true;
    }
}
