package com.pageanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response for grouped and top-N queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RangeQueryResponse {
    
    private List<RangeResult> results;
    private ResultSource source;
    private Completeness completeness;
    private boolean cached;
    private long queryTimeMs;
}
