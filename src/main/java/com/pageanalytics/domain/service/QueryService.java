package com.pageanalytics.domain.service;

import com.pageanalytics.config.AnalyticsProperties;
import com.pageanalytics.domain.distinct.DistinctItems;
import com.pageanalytics.domain.distinct.ExactItemSet;
import com.pageanalytics.domain.distinct.SketchItemSet;
import com.pageanalytics.domain.exception.InconsistentSketchStateException;
import com.pageanalytics.domain.exception.QueryExecutionException;
import com.pageanalytics.domain.model.AnalyticsFilterRequest;
import com.pageanalytics.domain.model.Completeness;
import com.pageanalytics.domain.model.DateRange;
import com.pageanalytics.domain.model.DistinctMode;
import com.pageanalytics.domain.model.Granularity;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.domain.model.PerformancePoint;
import com.pageanalytics.domain.model.PerformanceResponse;
import com.pageanalytics.domain.model.RangeQueryResponse;
import com.pageanalytics.domain.model.RangeResult;
import com.pageanalytics.domain.model.ResultSource;
import com.pageanalytics.domain.model.TopType;
import com.pageanalytics.infrastructure.cache.QueryCacheService;
import com.pageanalytics.infrastructure.persistence.entity.DailySummaryEntity;
import com.pageanalytics.infrastructure.persistence.entity.SummaryCoverageEntity;
import com.pageanalytics.infrastructure.persistence.repository.BlogRepository;
import com.pageanalytics.infrastructure.persistence.repository.DailySummaryRepository;
import com.pageanalytics.infrastructure.persistence.repository.SummaryCoverageRepository;
import com.pageanalytics.infrastructure.sketch.HyperLogLogSketchStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Analytics queries over pre-calculated daily summaries.
 *
 * Query Flow:
 * 1. Resolve the day range and build the cache key
 * 2. Check cache (Redis)
 * 3. On a miss, read summary rows for the range and scope
 * 4. Per group: sum total views, union the per-day distinct blog sets
 * 5. Fall back to an event scan when no day of the range was aggregated, or
 *    when filters cannot be evaluated on the scope's group key
 * 6. Store the result in cache
 *
 * Why union instead of sum?
 * - A blog viewed on three days is one distinct blog, not three
 * - Summing per-day unique counts overstates y whenever blogs repeat
 *
 * Distinct counting:
 * - Exact mode: union of stored blog id sets
 * - Approximate mode: PFCOUNT over the group's HyperLogLog keys when every row
 *   of the group has a sketch; exact union otherwise or when PFCOUNT fails
 * - One representation per group, never mixed
 *
 * Tradeoff: Freshness vs Performance
 * - Summaries lag events until the next aggregation run
 * - Cached answers may be stale for up to the cache TTL
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryService {

    private final DailySummaryRepository dailySummaryRepository;
    private final SummaryCoverageRepository summaryCoverageRepository;
    private final BlogRepository blogRepository;
    private final EventScanService eventScanService;
    private final HyperLogLogSketchStore sketchStore;
    private final QueryCacheService cacheService;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private long queryCacheTtl = 900;

    @Value("${app.cache.ttl.analytics-query:900}")
    public void setQueryCacheTtl(long queryCacheTtl) {
        this.queryCacheTtl = queryCacheTtl;
    }

    /**
     * Views and distinct blogs per country or author, ordered by group key.
     */
    @Transactional(readOnly = true, timeout = 30)
    public RangeQueryResponse getGroupedAnalytics(GroupingDimension dimension, AnalyticsFilterRequest filters) {
        DateRange range = resolveRange(filters);
        String cacheKey = cacheService.analyticsKey("grouped", dimension, range, filters);

        return cachedRange(cacheKey, "grouped", () -> computeGrouped(dimension, range, filters));
    }

    /**
     * Top groups by total views: descending z, ties by ascending x.
     */
    @Transactional(readOnly = true, timeout = 30)
    public RangeQueryResponse getTopAnalytics(TopType topType, AnalyticsFilterRequest filters) {
        DateRange range = resolveRange(filters);
        int limit = properties.getQuery().getTopLimit();
        String cacheKey = cacheService.analyticsKey("top", topType, range, filters);

        return cachedRange(cacheKey, "top", () -> {
            if (topType == TopType.BLOG) {
                return RangeQueryResponse.builder()
                        .results(eventScanService.topBlogs(range, filters, limit))
                        .source(ResultSource.EVENT_SCAN)
                        .completeness(filters.isStrictCompleteness() ? scannedCompleteness() : null)
                        .build();
            }

            RangeQueryResponse grouped = computeGrouped(topType.getDimension(), range, filters);
            grouped.setResults(grouped.getResults().stream()
                    .sorted(Comparator.comparingLong(RangeResult::getZ).reversed()
                            .thenComparing(RangeResult::getX))
                    .limit(limit)
                    .collect(Collectors.toList()));
            return grouped;
        });
    }

    /**
     * Time series of views with growth against the previous period.
     *
     * Granularity is forced by "compare" or chosen from the span of the data:
     * more than a year monthly, more than 30 days weekly, else daily.
     */
    @Transactional(readOnly = true, timeout = 30)
    public PerformanceResponse getPerformance(AnalyticsFilterRequest filters) {
        Timer.Sample sample = Timer.start(meterRegistry);
        DateRange range = resolveRange(filters);
        String cacheKey = cacheService.analyticsKey("performance", null, range, filters);

        Optional<PerformanceResponse> cached = cacheService.get(cacheKey, PerformanceResponse.class);
        if (cached.isPresent()) {
            recordCache("performance", "hit");
            PerformanceResponse response = cached.get();
            response.setCached(true);
            return response;
        }
        recordCache("performance", "miss");

        try {
            long startTime = System.currentTimeMillis();

            ResultSource source;
            Map<LocalDate, DayActivity> days;
            if (filters.isAnswerableFromSummaries(GroupingDimension.AUTHOR)
                    && !coverage(GroupingDimension.AUTHOR, range).isEmpty()) {
                days = dailyFromSummaries(range, filters);
                source = ResultSource.SUMMARY;
            } else {
                days = eventScanService.daily(range, filters);
                source = ResultSource.EVENT_SCAN;
            }

            if (days.isEmpty()) {
                log.info("No views found for performance analytics over {}", range);
                return PerformanceResponse.builder()
                        .points(new ArrayList<>())
                        .source(source)
                        .queryTimeMs(System.currentTimeMillis() - startTime)
                        .build();
            }

            TreeMap<LocalDate, DayActivity> sorted = new TreeMap<>(days);
            Granularity granularity = filters.getCompare() != null
                    ? Granularity.fromName(filters.getCompare())
                    : Granularity.forSpan(sorted.firstKey(), sorted.lastKey());

            Map<LocalDate, DayActivity> periods = PerformanceSeries.bucket(sorted, granularity);
            Map<LocalDate, Long> views = periods.entrySet().stream()
                    .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().getViews()));
            Map<LocalDate, Long> blogs = "created".equalsIgnoreCase(properties.getPerformance().getBlogMetric())
                    ? blogsCreated(range, filters, granularity)
                    : periods.entrySet().stream()
                            .collect(Collectors.toMap(Map.Entry::getKey, e -> (long) e.getValue().getBlogIds().size()));

            List<PerformancePoint> points = PerformanceSeries.toPoints(views, blogs);
            long queryTime = System.currentTimeMillis() - startTime;

            PerformanceResponse response = PerformanceResponse.builder()
                    .points(points)
                    .granularity(granularity)
                    .source(source)
                    .cached(false)
                    .queryTimeMs(queryTime)
                    .build();

            cacheService.set(cacheKey, response, queryCacheTtl);

            sample.stop(Timer.builder("query.latency")
                    .tag("type", "performance")
                    .tag("source", source.name())
                    .register(meterRegistry));

            log.info("Performance query executed: {} points ({}), {} ms", points.size(), granularity, queryTime);
            return response;

        } catch (IllegalArgumentException | InconsistentSketchStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error executing performance query: {}", e.getMessage(), e);
            recordExecuted("performance", "error");
            throw new QueryExecutionException("Performance query failed", e);
        }
    }

    private RangeQueryResponse cachedRange(String cacheKey, String type, Supplier<RangeQueryResponse> query) {
        Timer.Sample sample = Timer.start(meterRegistry);

        Optional<RangeQueryResponse> cached = cacheService.get(cacheKey, RangeQueryResponse.class);
        if (cached.isPresent()) {
            log.debug("Cache hit for query: {}", cacheKey);
            recordCache(type, "hit");
            RangeQueryResponse response = cached.get();
            response.setCached(true);
            return response;
        }

        log.debug("Cache miss for query: {}", cacheKey);
        recordCache(type, "miss");

        try {
            long startTime = System.currentTimeMillis();
            RangeQueryResponse response = query.get();
            long queryTime = System.currentTimeMillis() - startTime;
            response.setCached(false);
            response.setQueryTimeMs(queryTime);

            cacheService.set(cacheKey, response, queryCacheTtl);

            sample.stop(Timer.builder("query.latency")
                    .tag("type", type)
                    .tag("source", response.getSource().name())
                    .register(meterRegistry));
            recordExecuted(type, "success");

            log.info("{} query executed: {} results from {}, {} ms",
                    type, response.getResults().size(), response.getSource(), queryTime);
            return response;

        } catch (IllegalArgumentException | InconsistentSketchStateException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error executing {} query: {}", type, e.getMessage(), e);
            recordExecuted(type, "error");
            throw new QueryExecutionException("Query execution failed", e);
        }
    }

    RangeQueryResponse computeGrouped(GroupingDimension dimension, DateRange range, AnalyticsFilterRequest filters) {
        if (!filters.isAnswerableFromSummaries(dimension)) {
            log.debug("Filters not expressible on {} summaries, scanning events", dimension);
            return scanned(dimension, range, filters);
        }

        List<SummaryCoverageEntity> coverage = coverage(dimension, range);
        if (coverage.isEmpty()) {
            log.warn("No {} summaries for {}; falling back to event scan. "
                    + "Run the precalc command to aggregate this range.", dimension, range);
            return scanned(dimension, range, filters);
        }

        Map<String, List<DailySummaryEntity>> rowsByGroup = dailySummaryRepository
                .findByDimensionAndSummaryDateBetween(dimension, range.getStart(), range.getEnd()).stream()
                .filter(row -> filters.acceptsGroupKey(dimension, row.getGroupKey()))
                .collect(Collectors.groupingBy(DailySummaryEntity::getGroupKey, TreeMap::new, Collectors.toList()));

        List<RangeResult> results = new ArrayList<>(rowsByGroup.size());
        rowsByGroup.forEach((groupKey, rows) -> results.add(RangeResult.builder()
                .x(groupKey)
                .y(distinctItems(dimension, groupKey, rows))
                .z(rows.stream().mapToLong(DailySummaryEntity::getTotalViews).sum())
                .build()));

        return RangeQueryResponse.builder()
                .results(results)
                .source(ResultSource.SUMMARY)
                .completeness(filters.isStrictCompleteness()
                        ? completeness(range, coverage, groupDays(rowsByGroup, filters.requestedGroupKeys(dimension)))
                        : null)
                .build();
    }

    // Days with a row, per returned group and per group named by the filters
    private static Map<String, Set<LocalDate>> groupDays(Map<String, List<DailySummaryEntity>> rowsByGroup,
                                                         Set<String> requested) {
        Map<String, Set<LocalDate>> days = new TreeMap<>();
        requested.forEach(key -> days.put(key, new HashSet<>()));
        rowsByGroup.forEach((key, rows) -> days.put(key, rows.stream()
                .map(DailySummaryEntity::getSummaryDate)
                .collect(Collectors.toSet())));
        return days;
    }

    /**
     * Cardinality of the union of the rows' distinct blog sets.
     */
    long distinctItems(GroupingDimension dimension, String groupKey, List<DailySummaryEntity> rows) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            if (properties.getDistinctMode() == DistinctMode.APPROXIMATE
                    && rows.stream().allMatch(DailySummaryEntity::isSketchStored)) {
                try {
                    return DistinctItems.unionAll(rows.stream()
                            .map(row -> SketchItemSet.of(
                                    List.of(HyperLogLogSketchStore.sketchKey(row.getSummaryDate(), dimension, groupKey)),
                                    sketchStore))
                            .collect(Collectors.toList()))
                            .cardinality();
                } catch (InconsistentSketchStateException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Sketch count failed for {} {}; falling back to exact union: {}",
                            dimension, groupKey, e.getMessage());
                }
            }

            return DistinctItems.unionAll(rows.stream()
                    .map(row -> ExactItemSet.of(row.getItemIds()))
                    .collect(Collectors.toList()))
                    .cardinality();

        } finally {
            sample.stop(Timer.builder("query.union.latency")
                    .tag("dimension", dimension.name())
                    .register(meterRegistry));
        }
    }

    private RangeQueryResponse scanned(GroupingDimension dimension, DateRange range, AnalyticsFilterRequest filters) {
        return RangeQueryResponse.builder()
                .results(eventScanService.grouped(dimension, range, filters))
                .source(ResultSource.EVENT_SCAN)
                .completeness(filters.isStrictCompleteness() ? scannedCompleteness() : null)
                .build();
    }

    private Map<LocalDate, DayActivity> dailyFromSummaries(DateRange range, AnalyticsFilterRequest filters) {
        Map<LocalDate, DayActivity> days = new TreeMap<>();
        for (DailySummaryEntity row : dailySummaryRepository.findByDimensionAndSummaryDateBetween(
                GroupingDimension.AUTHOR, range.getStart(), range.getEnd())) {
            if (filters.acceptsGroupKey(GroupingDimension.AUTHOR, row.getGroupKey())) {
                days.computeIfAbsent(row.getSummaryDate(), d -> new DayActivity())
                        .addAll(row.getTotalViews(), row.getItemIds());
            }
        }
        return days;
    }

    private Map<LocalDate, Long> blogsCreated(DateRange range, AnalyticsFilterRequest filters, Granularity granularity) {
        List<Instant> created = blogRepository.findCreationTimes(
                range.startInstant(), range.endInstantExclusive(), filters.getAuthorUsername());
        return created.stream()
                .map(instant -> granularity.truncate(instant.atZone(ZoneOffset.UTC).toLocalDate()))
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
    }

    private List<SummaryCoverageEntity> coverage(GroupingDimension dimension, DateRange range) {
        return summaryCoverageRepository.findByDimensionAndSummaryDateBetween(
                dimension, range.getStart(), range.getEnd());
    }

    /**
     * Days of the range never aggregated (missing) or aggregated without events
     * (empty), and per group the aggregated days without a row for it (absent).
     */
    static Completeness completeness(DateRange range, List<SummaryCoverageEntity> coverage,
                                     Map<String, Set<LocalDate>> groupDays) {
        Map<LocalDate, SummaryCoverageEntity> byDay = coverage.stream()
                .collect(Collectors.toMap(SummaryCoverageEntity::getSummaryDate, Function.identity(), (a, b) -> a));

        List<LocalDate> missing = new ArrayList<>();
        List<LocalDate> empty = new ArrayList<>();
        List<LocalDate> covered = new ArrayList<>();
        for (LocalDate day : range.days()) {
            SummaryCoverageEntity dayCoverage = byDay.get(day);
            if (dayCoverage == null) {
                missing.add(day);
                continue;
            }
            covered.add(day);
            if (dayCoverage.getGroupCount() == 0) {
                empty.add(day);
            }
        }

        Map<String, List<LocalDate>> absent = new TreeMap<>();
        groupDays.forEach((groupKey, days) -> {
            List<LocalDate> without = covered.stream()
                    .filter(day -> !days.contains(day))
                    .collect(Collectors.toList());
            if (!without.isEmpty()) {
                absent.put(groupKey, without);
            }
        });

        return Completeness.builder()
                .missingDays(missing)
                .emptyDays(empty)
                .absentDays(absent)
                .complete(missing.isEmpty())
                .build();
    }

    // Raw events are the source of truth, so a scan has no missing days
    private static Completeness scannedCompleteness() {
        return Completeness.builder().complete(true).build();
    }

    private DateRange resolveRange(AnalyticsFilterRequest filters) {
        return filters.resolveRange(LocalDate.now(clock), properties.getQuery().getDefaultRangeDays());
    }

    private void recordCache(String type, String result) {
        Counter.builder("query.cache")
                .tag("type", type)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void recordExecuted(String type, String result) {
        Counter.builder("query.executed")
                .tag("type", type)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
