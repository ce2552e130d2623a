package com.pageanalytics.domain.aggregation;

import com.pageanalytics.domain.model.DateRange;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.function.BooleanSupplier;

/**
 * Days to (re)aggregate and how.
 * 
 * cancellation is polled between days; a day in progress always finishes.
 * force skips the recompute lock.
 */
@Data
@Builder
public class AggregationRequest {
    
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean dryRun;
    private boolean force;
    
    @Builder.Default
    private BooleanSupplier cancellation = () -> false;
    
    public static AggregationRequest forDay(LocalDate day) {
        return builder().startDate(day).endDate(day).build();
    }
    
    public DateRange getRange() {
        return DateRange.of(startDate, endDate);
    }
}
