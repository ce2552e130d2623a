package com.pageanalytics.api;

import com.pageanalytics.domain.model.AnalyticsFilterRequest;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.domain.model.PageViewRequest;
import com.pageanalytics.domain.model.PerformanceResponse;
import com.pageanalytics.domain.model.RangeQueryResponse;
import com.pageanalytics.domain.model.TopType;
import com.pageanalytics.domain.service.PageViewIngestService;
import com.pageanalytics.domain.service.QueryService;
import com.pageanalytics.infrastructure.persistence.entity.PageViewEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for blog view analytics.
 * 
 * Endpoints:
 * - POST /api/v1/analytics/blog-views/{objectType} - Group by country or user (pre-calculated)
 * - POST /api/v1/analytics/top/{topType} - Top 10 blogs, users or countries
 * - POST /api/v1/analytics/performance - Time series with growth
 * - POST /api/v1/analytics/views - Record a page view
 * 
 * All query endpoints take the same filter body and return {x, y, z} rows.
 * Grouped and top answers come from daily summaries; run the precalc
 * command to build them.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {
    
    private final QueryService queryService;
    private final PageViewIngestService pageViewIngestService;
    
    /**
     * Group views by country or user.
     * 
     * POST /api/v1/analytics/blog-views/country
     * {"countryCodes": ["US"], "startDate": "2024-01-01", "endDate": "2024-01-31"}
     * 
     * Response rows: x = country code or username, y = distinct blogs, z = views.
     * Set "strictCompleteness" to get the days that were never aggregated.
     */
    @PostMapping("/blog-views/{objectType}")
    public ResponseEntity<RangeQueryResponse> groupedAnalytics(
            @PathVariable String objectType,
            @Valid @RequestBody(required = false) AnalyticsFilterRequest filters) {
        
        GroupingDimension dimension = GroupingDimension.fromPathValue(objectType);
        log.info("Grouped analytics: objectType={}, filters={}", objectType, filters);
        
        return ResponseEntity.ok(queryService.getGroupedAnalytics(dimension, orEmpty(filters)));
    }
    
    /**
     * Top 10 by total views.
     * 
     * POST /api/v1/analytics/top/{blog|user|country}
     * 
     * For blogs: x = title, y = distinct countries, z = views.
     * Otherwise: x = group, y = distinct blogs, z = views.
     */
    @PostMapping("/top/{topType}")
    public ResponseEntity<RangeQueryResponse> topAnalytics(
            @PathVariable String topType,
            @Valid @RequestBody(required = false) AnalyticsFilterRequest filters) {
        
        TopType type = TopType.fromPathValue(topType);
        log.info("Top analytics: topType={}, filters={}", topType, filters);
        
        return ResponseEntity.ok(queryService.getTopAnalytics(type, orEmpty(filters)));
    }
    
    /**
     * Views over time.
     * 
     * POST /api/v1/analytics/performance
     * 
     * Points: x = "period start (N blogs)", y = views, z = growth % vs previous period.
     */
    @PostMapping("/performance")
    public ResponseEntity<PerformanceResponse> performance(
            @Valid @RequestBody(required = false) AnalyticsFilterRequest filters) {
        
        log.info("Performance analytics: filters={}", filters);
        
        return ResponseEntity.ok(queryService.getPerformance(orEmpty(filters)));
    }
    
    @PostMapping("/views")
    public ResponseEntity<Map<String, UUID>> recordView(@Valid @RequestBody PageViewRequest request) {
        PageViewEntity view = pageViewIngestService.recordView(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("viewId", view.getViewId()));
    }
    
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
    
    private static AnalyticsFilterRequest orEmpty(AnalyticsFilterRequest filters) {
        return filters != null ? filters : new AnalyticsFilterRequest();
    }
}
