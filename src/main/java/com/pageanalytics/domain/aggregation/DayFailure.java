package com.pageanalytics.domain.aggregation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A day whose aggregation failed. Retry by re-running just that day.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DayFailure {
    
    private LocalDate day;
    private String error;
}
