package com.pageanalytics.domain.service;

import com.pageanalytics.domain.model.Granularity;
import com.pageanalytics.domain.model.PerformancePoint;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Buckets daily activity into periods and computes period-over-period growth.
 */
public final class PerformanceSeries {

    private PerformanceSeries() {
    }

    /**
     * Merges days into periods of the given granularity. Distinct blogs are
     * unioned across the days of a period, views are summed.
     */
    public static Map<LocalDate, DayActivity> bucket(Map<LocalDate, DayActivity> days, Granularity granularity) {
        Map<LocalDate, DayActivity> periods = new TreeMap<>();
        days.forEach((day, activity) ->
                periods.computeIfAbsent(granularity.truncate(day), p -> new DayActivity()).merge(activity));
        return periods;
    }

    /**
     * One point per period, ascending.
     *
     * @param views views per period start
     * @param blogs blog count per period start; periods that only appear here get zero views
     */
    public static List<PerformancePoint> toPoints(Map<LocalDate, Long> views, Map<LocalDate, Long> blogs) {
        TreeSet<LocalDate> periods = new TreeSet<>(views.keySet());
        periods.addAll(blogs.keySet());

        List<PerformancePoint> points = new ArrayList<>(periods.size());
        long previousViews = 0;

        for (LocalDate period : periods) {
            long periodViews = views.getOrDefault(period, 0L);
            long periodBlogs = blogs.getOrDefault(period, 0L);

            points.add(PerformancePoint.builder()
                    .x(period + " (" + periodBlogs + " blogs)")
                    .y(periodViews)
                    .z(growthPercent(previousViews, periodViews))
                    .build());
            previousViews = periodViews;
        }
        return points;
    }

    /**
     * ((current - previous) / previous) * 100, rounded to two decimals.
     * Zero when there is no previous value to compare against.
     */
    static double growthPercent(long previous, long current) {
        if (previous <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(current - previous)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(previous), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
