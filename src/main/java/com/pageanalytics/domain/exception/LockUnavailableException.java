package com.pageanalytics.domain.exception;

/**
 * Another run holds the recompute lock for this scope.
 * 
 * Recoverable: the caller skips this run and retries later.
 */
public class LockUnavailableException extends RuntimeException {
    
    private final String scope;
    
    public LockUnavailableException(String scope) {
        super("Recompute lock is held by another run: " + scope);
        this.scope = scope;
    }
    
    public String getScope() {
        return scope;
    }
}
