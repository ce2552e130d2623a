package com.pageanalytics.domain.exception;

/**
 * Raised when exact item sets and sketches meet in one union.
 */
public class InconsistentSketchStateException extends RuntimeException {
    
    public InconsistentSketchStateException(String message) {
        super(message);
    }
}
