package com.pageanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceResponse {
    
    private List<PerformancePoint> points;
    private Granularity granularity;
    private ResultSource source;
    private boolean cached;
    private long queryTimeMs;
}
