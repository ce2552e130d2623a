package com.pageanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary coverage of a queried range, returned only when the caller asks
 * for strict completeness.
 * 
 * missingDays were never aggregated; emptyDays were aggregated and had no
 * events. Both contribute zero to the result.
 *
 * absentDays lists, per reported or requested group, the aggregated days that
 * hold no row for it. Such a day means the group had no views that day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Completeness {
    
    @Builder.Default
    private List<LocalDate> missingDays = new ArrayList<>();
    
    @Builder.Default
    private List<LocalDate> emptyDays = new ArrayList<>();
    
    @Builder.Default
    private Map<String, List<LocalDate>> absentDays = new TreeMap<>();
    
    private boolean complete;
}
