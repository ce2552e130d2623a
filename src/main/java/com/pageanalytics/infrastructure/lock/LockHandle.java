package com.pageanalytics.infrastructure.lock;

import lombok.Getter;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Proof of a successful acquisition. Must be handed back to the lock that
 * issued it.
 */
@Getter
public class LockHandle {
    
    private final String scope;
    private final String token;
    private final RecomputeLock issuer;
    private final Instant acquiredAt;
    
    // Only set for advisory locks, which live on one database session
    private final Connection connection;
    
    // Handles taken on each backend, in acquisition order, for ordered locks
    private final List<LockHandle> parts;
    
    private LockHandle(String scope, RecomputeLock issuer, Connection connection, List<LockHandle> parts) {
        this.scope = scope;
        this.token = UUID.randomUUID().toString();
        this.issuer = issuer;
        this.acquiredAt = Instant.now();
        this.connection = connection;
        this.parts = parts;
    }
    
    public static LockHandle of(String scope, RecomputeLock issuer) {
        return new LockHandle(scope, issuer, null, Collections.emptyList());
    }
    
    public static LockHandle onConnection(String scope, RecomputeLock issuer, Connection connection) {
        return new LockHandle(scope, issuer, connection, Collections.emptyList());
    }
    
    public static LockHandle composite(String scope, RecomputeLock issuer, List<LockHandle> parts) {
        return new LockHandle(scope, issuer, null, List.copyOf(parts));
    }
    
    /**
     * False when the lock that issued this handle does not keep anyone else out.
     */
    public boolean isExclusive() {
        return issuer.enforcesMutualExclusion();
    }
}
