package com.pageanalytics.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * Recompute lock on PostgreSQL session advisory locks.
 * 
 * The lock belongs to the database session, so the handle keeps its own
 * connection until release. The scope name is hashed with hashtext().
 */
@Slf4j
public class AdvisoryRecomputeLock implements RecomputeLock {
    
    private static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(hashtext(?))";
    private static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(hashtext(?))";
    
    private final DataSource dataSource;
    private final Duration retryInterval;
    
    public AdvisoryRecomputeLock(DataSource dataSource, Duration retryInterval) {
        this.dataSource = dataSource;
        this.retryInterval = retryInterval;
    }
    
    @Override
    public Optional<LockHandle> acquire(String scope, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Connection connection = null;
        boolean acquired = false;
        
        try {
            connection = dataSource.getConnection();
            while (true) {
                if (tryLock(connection, scope)) {
                    acquired = true;
                    log.debug("Acquired advisory lock {}", scope);
                    return Optional.of(LockHandle.onConnection(scope, this, connection));
                }
                if (System.nanoTime() >= deadline) {
                    return Optional.empty();
                }
                Thread.sleep(retryInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (SQLException e) {
            throw new LockBackendException("Advisory lock failed for " + scope, e);
        } finally {
            if (!acquired && connection != null) {
                closeQuietly(connection);
            }
        }
    }
    
    @Override
    public void release(LockHandle handle) {
        Connection connection = handle.getConnection();
        if (connection == null) {
            throw new IllegalArgumentException("Handle for " + handle.getScope() + " was not issued by an advisory lock");
        }
        try (PreparedStatement statement = connection.prepareStatement(UNLOCK_SQL)) {
            statement.setString(1, handle.getScope());
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next() || !rs.getBoolean(1)) {
                    log.warn("Advisory lock {} was not held at release", handle.getScope());
                }
            }
        } catch (SQLException e) {
            // Closing the session drops the lock anyway
            log.error("Failed to release advisory lock {}: {}", handle.getScope(), e.getMessage());
        } finally {
            closeQuietly(connection);
        }
    }
    
    private boolean tryLock(Connection connection, String scope) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(TRY_LOCK_SQL)) {
            statement.setString(1, scope);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
    
    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close advisory lock connection: {}", e.getMessage());
        }
    }
}
