package com.pageanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filters shared by all analytics queries.
 *
 * Date selection, in order of precedence:
 * - year: the whole calendar year
 * - range: "day", "week", "month" or "year" back from today (1, 7, 30, 365 days)
 * - startDate / endDate: explicit inclusive days
 * - nothing: the configured default window ending today
 *
 * Country filters:
 * - countryCodes: include, matches ANY (OR)
 * - excludeCountryCodes: exclude ALL listed (NOT)
 *
 * Snake-case aliases are accepted for older clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsFilterRequest {

    private static final Map<String, Integer> RANGE_DAYS = Map.of(
            "day", 1,
            "week", 7,
            "month", 30,
            "year", 365
    );

    @Pattern(regexp = "day|week|month|year", message = "range must be one of: day, week, month, year")
    private String range;

    @JsonAlias("start_date")
    private LocalDate startDate;

    @JsonAlias("end_date")
    private LocalDate endDate;

    @Min(2000)
    @Max(2100)
    private Integer year;

    @JsonAlias("country_codes")
    @Size(min = 1, message = "Cannot be an empty list. Omit the field or provide at least one country code.")
    private List<@Size(max = 5) String> countryCodes;

    @JsonAlias("exclude_country_codes")
    @Size(min = 1, message = "Cannot be an empty list. Omit the field or provide at least one country code.")
    private List<@Size(max = 5) String> excludeCountryCodes;

    @JsonAlias("author_username")
    private String authorUsername;

    @JsonAlias("blog_id")
    @Positive
    private Long blogId;

    @JsonAlias("content_type")
    private String contentType;

    // Forces performance granularity
    @Pattern(regexp = "day|week|month|year", message = "compare must be one of: day, week, month, year")
    private String compare;

    @JsonAlias("strict_completeness")
    private boolean strictCompleteness;

    /**
     * Resolves the inclusive day range this request selects.
     */
    public DateRange resolveRange(LocalDate today, int defaultRangeDays) {
        if (year != null) {
            return DateRange.of(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
        }
        if (range != null) {
            Integer days = RANGE_DAYS.get(range);
            if (days == null) {
                throw new IllegalArgumentException("Invalid range. Must be one of: day, week, month, year");
            }
            return DateRange.of(today.minusDays(days), today);
        }
        LocalDate end = endDate != null ? endDate : today;
        LocalDate start = startDate != null ? startDate : end.minusDays(defaultRangeDays);
        return DateRange.of(start, end);
    }

    public boolean hasCountryFilter() {
        return countryCodes != null || excludeCountryCodes != null;
    }

    /**
     * True when every filter can be evaluated on the group key of the given
     * dimension, so pre-calculated summaries can answer the query.
     */
    public boolean isAnswerableFromSummaries(GroupingDimension dimension) {
        if (blogId != null || contentType != null) {
            return false;
        }
        return switch (dimension) {
            case COUNTRY -> authorUsername == null;
            case AUTHOR -> !hasCountryFilter();
        };
    }

    /**
     * Applies the filters that target the group key of the given dimension.
     */
    public boolean acceptsGroupKey(GroupingDimension dimension, String groupKey) {
        if (dimension == GroupingDimension.COUNTRY) {
            if (countryCodes != null && !countryCodes.contains(groupKey)) {
                return false;
            }
            return excludeCountryCodes == null || !excludeCountryCodes.contains(groupKey);
        }
        return authorUsername == null || authorUsername.equals(groupKey);
    }

    /**
     * Group keys the caller asked for by name on the given dimension, minus
     * excluded ones. Empty when the filters name no group.
     */
    public Set<String> requestedGroupKeys(GroupingDimension dimension) {
        Set<String> keys = new TreeSet<>();
        if (dimension == GroupingDimension.COUNTRY) {
            if (countryCodes != null) {
                countryCodes.stream().filter(code -> acceptsGroupKey(dimension, code)).forEach(keys::add);
            }
        } else if (authorUsername != null) {
            keys.add(authorUsername);
        }
        return keys;
    }
}
