package com.pageanalytics.domain.aggregation;

public enum AggregationStatus {
    
    // every day written
    COMPLETED,
    
    // some days failed, the others were written
    PARTIAL_FAILURE,
    
    // another run holds the scope lock, nothing was written
    LOCK_UNAVAILABLE,
    
    // stopped between days on request
    CANCELLED
}
