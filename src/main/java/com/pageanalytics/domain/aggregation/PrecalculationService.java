package com.pageanalytics.domain.aggregation;

import com.pageanalytics.config.AnalyticsProperties;
import com.pageanalytics.domain.model.GroupingDimension;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs the aggregation engine once per grouping dimension.
 * 
 * Each dimension is an independent scope with its own lock and rows; they run
 * one after the other and a skipped or failed scope does not stop the next.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrecalculationService {
    
    private final AggregationEngine aggregationEngine;
    private final AnalyticsProperties properties;
    
    public List<AggregationResult> precalculate(AggregationRequest request, Collection<GroupingDimension> dimensions) {
        List<AggregationResult> results = new ArrayList<>(dimensions.size());
        for (GroupingDimension dimension : dimensions) {
            SummaryScope scope = SummaryScope.of(dimension, properties.getDistinctMode());
            results.add(aggregationEngine.aggregate(request, scope));
        }
        return results;
    }
}
