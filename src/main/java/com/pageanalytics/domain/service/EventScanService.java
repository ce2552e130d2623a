package com.pageanalytics.domain.service;

import com.pageanalytics.domain.model.AnalyticsFilterRequest;
import com.pageanalytics.domain.model.DateRange;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.domain.model.RangeResult;
import com.pageanalytics.infrastructure.persistence.entity.BlogEntity;
import com.pageanalytics.infrastructure.persistence.repository.BlogRepository;
import com.pageanalytics.infrastructure.persistence.repository.PageViewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Answers queries straight from page views.
 * 
 * Used when summaries are missing for a range or when filters cannot be
 * evaluated on summary group keys (blog, content type, cross-dimension
 * filters). Slow, but exact. Errors propagate to the caller; a failed scan is
 * never turned into an empty answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventScanService {
    
    private static final int COUNTRY = 0;
    private static final int AUTHOR = 1;
    private static final int BLOG = 2;
    private static final int VIEWS = 3;
    
    private final PageViewRepository pageViewRepository;
    private final BlogRepository blogRepository;
    
    /**
     * Grouped views and distinct blogs over the range, ordered by group key.
     */
    public List<RangeResult> grouped(GroupingDimension dimension, DateRange range, AnalyticsFilterRequest filters) {
        Map<String, DayActivity> groups = new TreeMap<>();
        
        for (Object[] tuple : scan(range, filters)) {
            String groupKey = (String) (dimension == GroupingDimension.COUNTRY ? tuple[COUNTRY] : tuple[AUTHOR]);
            if (groupKey == null) {
                continue;
            }
            groups.computeIfAbsent(groupKey, k -> new DayActivity()).add(views(tuple), blogId(tuple));
        }
        
        log.info("Event scan for {} over {}: {} groups", dimension, range, groups.size());
        
        List<RangeResult> results = new ArrayList<>(groups.size());
        groups.forEach((groupKey, activity) -> results.add(RangeResult.builder()
                .x(groupKey)
                .y(activity.getBlogIds().size())
                .z(activity.getViews())
                .build()));
        return results;
    }
    
    /**
     * Most viewed blogs: x = title, y = distinct countries reached, z = views.
     */
    public List<RangeResult> topBlogs(DateRange range, AnalyticsFilterRequest filters, int limit) {
        Map<Long, Long> viewsByBlog = new HashMap<>();
        Map<Long, Set<String>> countriesByBlog = new HashMap<>();
        
        for (Object[] tuple : scan(range, filters)) {
            Long blogId = blogId(tuple);
            viewsByBlog.merge(blogId, views(tuple), Long::sum);
            Set<String> countries = countriesByBlog.computeIfAbsent(blogId, k -> new HashSet<>());
            if (tuple[COUNTRY] != null) {
                countries.add((String) tuple[COUNTRY]);
            }
        }
        
        Map<Long, String> titles = blogRepository.findAllById(viewsByBlog.keySet()).stream()
                .collect(Collectors.toMap(BlogEntity::getBlogId, BlogEntity::getTitle));
        
        return viewsByBlog.entrySet().stream()
                .map(entry -> RangeResult.builder()
                        .x(titles.getOrDefault(entry.getKey(), "blog " + entry.getKey()))
                        .y(countriesByBlog.get(entry.getKey()).size())
                        .z(entry.getValue())
                        .build())
                .sorted(Comparator.comparingLong(RangeResult::getZ).reversed()
                        .thenComparing(RangeResult::getX))
                .limit(limit)
                .collect(Collectors.toList());
    }
    
    /**
     * Views and distinct blogs per day, scanning one day at a time.
     * Days without views are left out.
     */
    public Map<LocalDate, DayActivity> daily(DateRange range, AnalyticsFilterRequest filters) {
        Map<LocalDate, DayActivity> days = new TreeMap<>();
        
        for (LocalDate day : range.days()) {
            DayActivity activity = new DayActivity();
            for (Object[] tuple : scan(DateRange.singleDay(day), filters)) {
                activity.add(views(tuple), blogId(tuple));
            }
            if (activity.getViews() > 0) {
                days.put(day, activity);
            }
        }
        return days;
    }
    
    private List<Object[]> scan(DateRange range, AnalyticsFilterRequest filters) {
        List<Object[]> tuples = pageViewRepository.scanViews(
                range.startInstant(),
                range.endInstantExclusive(),
                filters.getAuthorUsername(),
                filters.getBlogId(),
                filters.getContentType()
        );
        if (!filters.hasCountryFilter()) {
            return tuples;
        }
        return tuples.stream()
                .filter(tuple -> acceptsCountry(filters, (String) tuple[COUNTRY]))
                .collect(Collectors.toList());
    }
    
    private boolean acceptsCountry(AnalyticsFilterRequest filters, String countryCode) {
        if (filters.getCountryCodes() != null
                && (countryCode == null || !filters.getCountryCodes().contains(countryCode))) {
            return false;
        }
        return filters.getExcludeCountryCodes() == null
                || countryCode == null
                || !filters.getExcludeCountryCodes().contains(countryCode);
    }
    
    private static Long blogId(Object[] tuple) {
        return ((Number) tuple[BLOG]).longValue();
    }
    
    private static long views(Object[] tuple) {
        return ((Number) tuple[VIEWS]).longValue();
    }
}
