package com.pageanalytics.domain.exception;

/**
 * The transactional store cannot be reached. Fatal for the current run.
 */
public class StoreUnavailableException extends RuntimeException {
    
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
