package com.pageanalytics.domain.aggregation;

import com.pageanalytics.domain.model.DateRange;
import com.pageanalytics.domain.model.GroupingDimension;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one aggregation run over a range.
 */
@Data
@Builder
public class AggregationResult {
    
    private GroupingDimension dimension;
    private DateRange range;
    private AggregationStatus status;
    private boolean dryRun;
    private int daysSucceeded;
    
    @Builder.Default
    private List<DayFailure> failedDays = new ArrayList<>();
    
    private int rowsCreated;
    private int rowsUpdated;
    private int rowsRemoved;
    private long elapsedMs;
    
    public static AggregationResult lockUnavailable(GroupingDimension dimension, DateRange range, boolean dryRun) {
        return AggregationResult.builder()
                .dimension(dimension)
                .range(range)
                .dryRun(dryRun)
                .status(AggregationStatus.LOCK_UNAVAILABLE)
                .build();
    }
    
    public int getDaysFailed() {
        return failedDays.size();
    }
}
