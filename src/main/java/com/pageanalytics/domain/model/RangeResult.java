package com.pageanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a grouped or top-N answer.
 * 
 * x: group label (country code, author username, blog title)
 * y: distinct items over the whole range (a union, never a sum of days)
 * z: total views over the range
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RangeResult {
    
    private String x;
    private long y;
    private long z;
}
