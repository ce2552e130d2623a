package com.pageanalytics.domain.aggregation;

import com.pageanalytics.domain.exception.LockUnavailableException;
import com.pageanalytics.domain.exception.StoreUnavailableException;
import com.pageanalytics.domain.model.DateRange;
import com.pageanalytics.domain.model.DistinctMode;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.infrastructure.lock.LockHandle;
import com.pageanalytics.infrastructure.lock.PassThroughRecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLockTemplate;
import com.pageanalytics.infrastructure.persistence.entity.DailySummaryEntity;
import com.pageanalytics.infrastructure.persistence.repository.PageViewRepository;
import com.pageanalytics.infrastructure.sketch.HyperLogLogSketchStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds daily summaries from page views.
 *
 * Run Flow:
 * 1. Acquire the recompute lock for the scope (skip the run if held)
 * 2. For each day in the range, oldest first:
 *    a. Check for cancellation and renew the lock
 *    b. Load (group, blog, views) tuples for that UTC day
 *    c. Fold into one summary per group: total views + sorted distinct blog ids
 *    d. Replace the day's rows in one transaction
 *    e. Approximate mode: rewrite the day's HyperLogLog sketches, then flag
 *       the rows whose sketch was written
 * 3. Release the lock, report per-day outcome
 *
 * A day is the unit of work: it either commits completely or not at all, so
 * a crash or a failed day leaves every other day intact and re-runnable.
 * Only one day of tuples is held in memory at a time.
 *
 * Failure Handling:
 * - A failing day is logged and recorded; the remaining days still run
 * - Store connectivity failures abort the run (StoreUnavailableException)
 * - Sketch write failures only leave the row without a sketch
 * - A lost lock lease stops the run like a cancellation
 *
 * Sketches are written only after the day's rows committed, and rows are
 * committed without the sketch flag. A rolled back day therefore never
 * leaves rows pointing at sketches of a different computation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationEngine {

    private final PageViewRepository pageViewRepository;
    private final DailySummaryWriter dailySummaryWriter;
    private final HyperLogLogSketchStore sketchStore;
    private final RecomputeLockTemplate lockTemplate;
    private final MeterRegistry meterRegistry;

    public AggregationResult aggregate(AggregationRequest request, SummaryScope scope) {
        DateRange range = request.getRange();
        RecomputeLockTemplate template = request.isForce()
                ? lockTemplate.withLock(new PassThroughRecomputeLock())
                : lockTemplate;

        try {
            return template.executeHolding(scope.lockKey(),
                    handle -> aggregateLocked(request, scope, range, template, handle));
        } catch (LockUnavailableException e) {
            return AggregationResult.lockUnavailable(scope.getDimension(), range, request.isDryRun());
        }
    }

    private AggregationResult aggregateLocked(AggregationRequest request, SummaryScope scope, DateRange range,
                                              RecomputeLockTemplate template, LockHandle handle) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        GroupingDimension dimension = scope.getDimension();

        log.info("Aggregating {} summaries for {} (mode: {}{})",
                dimension, range, scope.getDistinctMode(), request.isDryRun() ? ", dry run" : "");

        List<DayFailure> failures = new ArrayList<>();
        int succeeded = 0;
        int created = 0;
        int updated = 0;
        int removed = 0;
        boolean cancelled = false;

        for (LocalDate day : range.days()) {
            if (request.getCancellation().getAsBoolean()) {
                log.warn("Aggregation of {} cancelled before {}", dimension, day);
                cancelled = true;
                break;
            }
            if (!template.renew(handle)) {
                log.error("Lost the recompute lock for {} before {}; stopping", dimension, day);
                cancelled = true;
                break;
            }

            try {
                DayWriteResult written = aggregateDay(day, scope, request.isDryRun());
                succeeded++;
                created += written.getCreated();
                updated += written.getUpdated();
                removed += written.getRemoved();
                recordDay(dimension, "success");

            } catch (RuntimeException e) {
                if (isStoreFailure(e)) {
                    log.error("Store unavailable while aggregating {} {}: {}", dimension, day, e.getMessage());
                    throw new StoreUnavailableException("Store unavailable while aggregating " + day, e);
                }
                log.error("Aggregation failed for {} {}: {}", dimension, day, e.getMessage(), e);
                failures.add(new DayFailure(day, e.getMessage()));
                recordDay(dimension, "failure");
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        sample.stop(Timer.builder("aggregation.duration")
                .tag("dimension", dimension.name())
                .register(meterRegistry));
        if (!request.isDryRun()) {
            recordRows("created", created);
            recordRows("updated", updated);
            recordRows("removed", removed);
        }

        AggregationStatus status = cancelled
                ? AggregationStatus.CANCELLED
                : failures.isEmpty() ? AggregationStatus.COMPLETED : AggregationStatus.PARTIAL_FAILURE;

        log.info("{}Aggregation of {} finished: status={} days={} failed={} created={} updated={} removed={} ({} ms)",
                request.isDryRun() ? "DRY-RUN: " : "", dimension, status, succeeded, failures.size(),
                created, updated, removed, elapsed);

        return AggregationResult.builder()
                .dimension(dimension)
                .range(range)
                .status(status)
                .dryRun(request.isDryRun())
                .daysSucceeded(succeeded)
                .failedDays(failures)
                .rowsCreated(created)
                .rowsUpdated(updated)
                .rowsRemoved(removed)
                .elapsedMs(elapsed)
                .build();
    }

    private DayWriteResult aggregateDay(LocalDate day, SummaryScope scope, boolean dryRun) {
        List<DailySummaryEntity> rows = computeDay(day, scope.getDimension());

        if (dryRun) {
            return dailySummaryWriter.planDay(day, scope, rows);
        }

        DayWriteResult written = dailySummaryWriter.replaceDay(day, scope, rows);
        if (scope.getDistinctMode() == DistinctMode.APPROXIMATE) {
            writeSketches(day, scope.getDimension(), rows);
        }
        return written;
    }

    private void writeSketches(LocalDate day, GroupingDimension dimension, List<DailySummaryEntity> rows) {
        List<String> stored = new ArrayList<>(rows.size());
        List<String> failed = new ArrayList<>();
        for (DailySummaryEntity row : rows) {
            String key = HyperLogLogSketchStore.sketchKey(day, dimension, row.getGroupKey());
            (sketchStore.replace(key, row.getItemIds()) ? stored : failed).add(row.getGroupKey());
        }
        dailySummaryWriter.markSketches(day, dimension, stored, true);
        dailySummaryWriter.markSketches(day, dimension, failed, false);
        if (!failed.isEmpty()) {
            log.warn("{} {}: {} sketches not written, those groups use exact counts", dimension, day, failed.size());
        }
    }

    /**
     * One summary per group seen on the day, ordered by group key.
     * Groups without views get no row.
     */
    public List<DailySummaryEntity> computeDay(LocalDate day, GroupingDimension dimension) {
        DateRange window = DateRange.singleDay(day);
        Instant from = window.startInstant();
        Instant to = window.endInstantExclusive();

        List<Object[]> tuples = dimension == GroupingDimension.COUNTRY
                ? pageViewRepository.countViewsByCountryAndBlog(from, to)
                : pageViewRepository.countViewsByAuthorAndBlog(from, to);

        Map<String, GroupTotals> groups = new TreeMap<>();
        for (Object[] tuple : tuples) {
            String groupKey = (String) tuple[0];
            if (groupKey == null) {
                continue;
            }
            long blogId = ((Number) tuple[1]).longValue();
            long views = ((Number) tuple[2]).longValue();
            groups.computeIfAbsent(groupKey, k -> new GroupTotals()).add(blogId, views);
        }

        List<DailySummaryEntity> rows = new ArrayList<>(groups.size());
        groups.forEach((groupKey, totals) -> {
            if (totals.views > 0) {
                rows.add(DailySummaryEntity.builder()
                        .summaryDate(day)
                        .dimension(dimension)
                        .groupKey(groupKey)
                        .totalViews(totals.views)
                        .uniqueItems(totals.itemIds.size())
                        .itemIds(new ArrayList<>(totals.itemIds))
                        .build());
            }
        });
        return rows;
    }

    private boolean isStoreFailure(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof DataAccessResourceFailureException
                    || cause instanceof CannotCreateTransactionException) {
                return true;
            }
        }
        return false;
    }

    private void recordDay(GroupingDimension dimension, String result) {
        Counter.builder("aggregation.days")
                .tag("dimension", dimension.name())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void recordRows(String op, int count) {
        Counter.builder("aggregation.rows")
                .tag("op", op)
                .register(meterRegistry)
                .increment(count);
    }

    private static class GroupTotals {
        private long views;
        private final TreeSet<Long> itemIds = new TreeSet<>();

        void add(long blogId, long blogViews) {
            views += blogViews;
            itemIds.add(blogId);
        }
    }
}
