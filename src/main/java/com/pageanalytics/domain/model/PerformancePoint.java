package com.pageanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One period of the performance time series.
 * 
 * x: "yyyy-MM-dd (N blogs)" for the period start
 * y: views in the period
 * z: growth in percent against the previous period
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformancePoint {
    
    private String x;
    private long y;
    private double z;
}
