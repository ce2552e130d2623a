package com.pageanalytics.domain.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ingestion request for one page view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageViewRequest {
    
    @NotNull
    @Positive
    private Long blogId;
    
    @Size(max = 5)
    private String countryCode;
    
    @Size(max = 45)
    private String viewerIp;
    
    // Defaults to now
    private Instant timestamp;
}
