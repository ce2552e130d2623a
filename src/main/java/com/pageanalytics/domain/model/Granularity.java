package com.pageanalytics.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket size for performance time series. Weeks start on Monday.
 */
public enum Granularity {
    
    DAY,
    WEEK,
    MONTH,
    YEAR;
    
    /**
     * Start of the bucket containing the given day.
     */
    public LocalDate truncate(LocalDate day) {
        return switch (this) {
            case DAY -> day;
            case WEEK -> day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> day.withDayOfMonth(1);
            case YEAR -> day.withDayOfYear(1);
        };
    }
    
    /**
     * Picks a granularity from the span of the data:
     * more than a year is monthly, more than a month is weekly, else daily.
     */
    public static Granularity forSpan(LocalDate first, LocalDate last) {
        long days = ChronoUnit.DAYS.between(first, last);
        if (days > 365) {
            return MONTH;
        }
        if (days > 30) {
            return WEEK;
        }
        return DAY;
    }
    
    public static Granularity fromName(String value) {
        for (Granularity granularity : values()) {
            if (granularity.name().equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("compare must be one of: day, week, month, year");
    }
}
