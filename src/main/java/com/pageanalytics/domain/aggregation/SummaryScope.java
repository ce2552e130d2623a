package com.pageanalytics.domain.aggregation;

import com.pageanalytics.domain.model.DistinctMode;
import com.pageanalytics.domain.model.GroupingDimension;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * What one aggregation run covers: the grouping dimension and how distinct
 * items are recorded. One scope owns one partition of the summary table and
 * one recompute lock.
 */
@Data
@AllArgsConstructor(staticName = "of")
public class SummaryScope {
    
    private GroupingDimension dimension;
    private DistinctMode distinctMode;
    
    public String lockKey() {
        return "precalc:" + dimension.name().toLowerCase();
    }
}
