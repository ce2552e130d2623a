package com.pageanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of UTC calendar days.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateRange {
    
    private LocalDate start;
    private LocalDate end;
    
    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range needs both start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " is before start " + start);
        }
        return new DateRange(start, end);
    }
    
    public static DateRange singleDay(LocalDate day) {
        return of(day, day);
    }
    
    public List<LocalDate> days() {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }
    
    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }
    
    /** First instant of the range, inclusive. */
    public Instant startInstant() {
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    
    /** First instant after the range, exclusive. */
    public Instant endInstantExclusive() {
        return end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    
    @Override
    public String toString() {
        return start.equals(end) ? start.toString() : start + ".." + end;
    }
}
