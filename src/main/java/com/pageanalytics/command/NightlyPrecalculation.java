package com.pageanalytics.command;

import com.pageanalytics.domain.aggregation.AggregationRequest;
import com.pageanalytics.domain.aggregation.AggregationResult;
import com.pageanalytics.domain.aggregation.PrecalculationService;
import com.pageanalytics.domain.model.GroupingDimension;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;

/**
 * Recomputes yesterday and today for every dimension on a cron schedule.
 * 
 * Yesterday is included so late events of the previous day are picked up.
 * When several instances run this, the recompute lock lets one of them work
 * and the others skip.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.analytics.schedule", name = "enabled", havingValue = "true")
public class NightlyPrecalculation {
    
    private final PrecalculationService precalculationService;
    private final Clock clock;
    
    @Scheduled(cron = "${app.analytics.schedule.cron:0 0 1 * * *}", zone = "UTC")
    public void run() {
        LocalDate today = LocalDate.now(clock);
        AggregationRequest request = AggregationRequest.builder()
                .startDate(today.minusDays(1))
                .endDate(today)
                .build();
        
        try {
            for (AggregationResult result : precalculationService.precalculate(
                    request, Arrays.asList(GroupingDimension.values()))) {
                log.info("Scheduled precalc {}: {} ({} days, {} failed)",
                        result.getDimension(), result.getStatus(), result.getDaysSucceeded(), result.getDaysFailed());
            }
        } catch (Exception e) {
            log.error("Scheduled precalc failed: {}", e.getMessage(), e);
        }
    }
}
