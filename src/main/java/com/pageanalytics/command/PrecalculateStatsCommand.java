package com.pageanalytics.command;

import com.pageanalytics.domain.aggregation.AggregationRequest;
import com.pageanalytics.domain.aggregation.AggregationResult;
import com.pageanalytics.domain.aggregation.AggregationStatus;
import com.pageanalytics.domain.aggregation.DayFailure;
import com.pageanalytics.domain.aggregation.PrecalculationService;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.infrastructure.persistence.repository.PageViewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator command that builds daily summaries.
 * 
 * Usage:
 *   java -jar app.jar --precalc                      # earliest event to today
 *   java -jar app.jar --precalc --days=7             # last 7 days
 *   java -jar app.jar --precalc --date=2024-01-01    # one day
 *   java -jar app.jar --precalc --start=2024-01-01 --end=2024-01-31
 * 
 * Options:
 *   --dimension=country|user   only this scope (repeatable, default: all)
 *   --dry-run                  report what would change, write nothing
 *   --force                    skip the recompute lock
 * 
 * Exit codes:
 *   0  every day of every scope succeeded
 *   1  hard failure: lock held elsewhere, store or lock backend unreachable, bad arguments
 *   2  partial failure: some days failed or the run was cancelled; re-run those days
 * 
 * SIGTERM cancels between days: the day in progress finishes first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrecalculateStatsCommand implements ApplicationRunner, ExitCodeGenerator {
    
    public static final String OPTION = "precalc";
    
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_HARD_FAILURE = 1;
    static final int EXIT_PARTIAL_FAILURE = 2;
    
    private static final long SHUTDOWN_GRACE_SECONDS = 120;
    
    private final PrecalculationService precalculationService;
    private final PageViewRepository pageViewRepository;
    private final Clock clock;
    
    private int exitCode = EXIT_SUCCESS;
    
    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        
        AtomicBoolean cancelled = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            cancelled.set(true);
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "precalc-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        
        try {
            exitCode = execute(args, cancelled);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down");
            }
        }
    }
    
    int execute(ApplicationArguments args, AtomicBoolean cancelled) {
        log.info("Starting pre-calculation...");
        
        try {
            Optional<AggregationRequest.AggregationRequestBuilder> range = resolveRange(args);
            if (range.isEmpty()) {
                log.warn("No data found.");
                return EXIT_SUCCESS;
            }
            
            AggregationRequest request = range.get()
                    .dryRun(args.containsOption("dry-run"))
                    .force(args.containsOption("force"))
                    .cancellation(cancelled::get)
                    .build();
            
            if (request.isForce()) {
                log.warn("--force given: running without the recompute lock");
            }
            log.info("  Range: {}", request.getRange());
            
            List<AggregationResult> results = precalculationService.precalculate(request, dimensions(args));
            results.forEach(this::report);
            return exitCodeFor(results);
            
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_HARD_FAILURE;
        } catch (Exception e) {
            log.error("Pre-calculation aborted: {}", e.getMessage(), e);
            return EXIT_HARD_FAILURE;
        }
    }
    
    /**
     * Worst outcome across scopes: hard failure over partial failure over success.
     */
    static int exitCodeFor(List<AggregationResult> results) {
        int code = EXIT_SUCCESS;
        for (AggregationResult result : results) {
            AggregationStatus status = result.getStatus();
            if (status == AggregationStatus.LOCK_UNAVAILABLE) {
                return EXIT_HARD_FAILURE;
            }
            if (status == AggregationStatus.PARTIAL_FAILURE || status == AggregationStatus.CANCELLED) {
                code = EXIT_PARTIAL_FAILURE;
            }
        }
        return code;
    }
    
    @Override
    public int getExitCode() {
        return exitCode;
    }
    
    private Optional<AggregationRequest.AggregationRequestBuilder> resolveRange(ApplicationArguments args) {
        LocalDate today = LocalDate.now(clock);
        
        String date = single(args, "date");
        if (date != null) {
            LocalDate day = LocalDate.parse(date);
            return Optional.of(AggregationRequest.builder().startDate(day).endDate(day));
        }
        
        String days = single(args, "days");
        if (days != null) {
            int count = Integer.parseInt(days);
            if (count < 0) {
                throw new IllegalArgumentException("--days must not be negative");
            }
            return Optional.of(AggregationRequest.builder().startDate(today.minusDays(count)).endDate(today));
        }
        
        String start = single(args, "start");
        String end = single(args, "end");
        if (start != null) {
            return Optional.of(AggregationRequest.builder()
                    .startDate(LocalDate.parse(start))
                    .endDate(end != null ? LocalDate.parse(end) : today));
        }
        if (end != null) {
            throw new IllegalArgumentException("--end requires --start");
        }
        
        return pageViewRepository.findFirstByOrderByTimestampAsc()
                .map(first -> AggregationRequest.builder()
                        .startDate(first.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate())
                        .endDate(today));
    }
    
    private List<GroupingDimension> dimensions(ApplicationArguments args) {
        List<String> values = args.getOptionValues("dimension");
        if (values == null || values.isEmpty()) {
            return Arrays.asList(GroupingDimension.values());
        }
        List<GroupingDimension> dimensions = new ArrayList<>();
        for (String value : values) {
            GroupingDimension dimension = GroupingDimension.fromPathValue(value);
            if (!dimensions.contains(dimension)) {
                dimensions.add(dimension);
            }
        }
        return dimensions;
    }
    
    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.get(0);
    }
    
    private void report(AggregationResult result) {
        String prefix = result.isDryRun() ? "DRY-RUN: Would create" : "Created";
        switch (result.getStatus()) {
            case LOCK_UNAVAILABLE -> log.warn("{}: another pre-calculation holds the lock; nothing done",
                    result.getDimension());
            case COMPLETED -> log.info("{}: {} {} new summaries, updated {}, removed {} ({} days)",
                    result.getDimension(), prefix, result.getRowsCreated(), result.getRowsUpdated(),
                    result.getRowsRemoved(), result.getDaysSucceeded());
            default -> {
                log.warn("{}: {} after {} days; {} new summaries, updated {}, removed {}",
                        result.getDimension(), result.getStatus(), result.getDaysSucceeded(), prefix,
                        result.getRowsCreated(), result.getRowsUpdated(), result.getRowsRemoved());
                for (DayFailure failure : result.getFailedDays()) {
                    log.warn("  failed {}: {}", failure.getDay(), failure.getError());
                }
            }
        }
    }
}
