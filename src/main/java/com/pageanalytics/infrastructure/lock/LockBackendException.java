package com.pageanalytics.infrastructure.lock;

/**
 * The lock backend failed (as opposed to the lock being held).
 */
public class LockBackendException extends RuntimeException {
    
    public LockBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
