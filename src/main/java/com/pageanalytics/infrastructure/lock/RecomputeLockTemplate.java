package com.pageanalytics.infrastructure.lock;

import com.pageanalytics.domain.exception.LockUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a body while holding the recompute lock for a scope.
 *
 * The lock is released on every exit path. If it cannot be acquired within
 * the timeout the body does not run and {@link LockUnavailableException} is
 * thrown; the skip is logged at WARN.
 */
@Slf4j
public class RecomputeLockTemplate {

    private final RecomputeLock recomputeLock;
    private final Duration acquireTimeout;
    private final MeterRegistry meterRegistry;

    public RecomputeLockTemplate(RecomputeLock recomputeLock, Duration acquireTimeout, MeterRegistry meterRegistry) {
        this.recomputeLock = recomputeLock;
        this.acquireTimeout = acquireTimeout;
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String scope, Supplier<T> body) {
        return executeHolding(scope, handle -> body.get());
    }

    /**
     * Like {@link #execute} but hands the body its lock handle, so long
     * bodies can {@link #renew} the hold as they go.
     */
    public <T> T executeHolding(String scope, Function<LockHandle, T> body) {
        Optional<LockHandle> handle = recomputeLock.acquire(scope, acquireTimeout);

        if (handle.isEmpty()) {
            log.warn("Skipping run for {}: lock held by another run (waited {})", scope, acquireTimeout);
            record("unavailable");
            throw new LockUnavailableException(scope);
        }

        record(handle.get().isExclusive() ? "acquired" : "unguarded");
        try {
            return body.apply(handle.get());
        } finally {
            recomputeLock.release(handle.get());
            log.debug("Released recompute lock {}", scope);
        }
    }

    /**
     * @return false if the hold is known to be lost; the caller should stop writing
     */
    public boolean renew(LockHandle handle) {
        boolean held = recomputeLock.renew(handle);
        if (!held) {
            record("lost");
        }
        return held;
    }

    /**
     * Same timeout and metrics, different lock. Used for forced runs.
     */
    public RecomputeLockTemplate withLock(RecomputeLock otherLock) {
        return new RecomputeLockTemplate(otherLock, acquireTimeout, meterRegistry);
    }

    public RecomputeLock getRecomputeLock() {
        return recomputeLock;
    }

    private void record(String result) {
        Counter.builder("aggregation.lock")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
