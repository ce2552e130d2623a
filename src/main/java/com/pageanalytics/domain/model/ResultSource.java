package com.pageanalytics.domain.model;

/**
 * Where a query answer was computed from.
 */
public enum ResultSource {
    SUMMARY,
    EVENT_SCAN
}
