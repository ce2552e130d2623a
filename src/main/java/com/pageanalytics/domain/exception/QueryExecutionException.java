package com.pageanalytics.domain.exception;

/**
 * An analytics query could not produce a correct answer.
 */
public class QueryExecutionException extends RuntimeException {
    
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
