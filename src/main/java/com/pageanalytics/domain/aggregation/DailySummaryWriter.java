package com.pageanalytics.domain.aggregation;

import com.pageanalytics.domain.model.DistinctMode;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.infrastructure.persistence.entity.DailySummaryEntity;
import com.pageanalytics.infrastructure.persistence.entity.SummaryCoverageEntity;
import com.pageanalytics.infrastructure.persistence.repository.DailySummaryRepository;
import com.pageanalytics.infrastructure.persistence.repository.SummaryCoverageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Replaces one day of summaries for a scope in a single transaction.
 *
 * Existing rows for groups still present are updated in place, new groups are
 * inserted, and groups with no events that day are deleted, so after commit
 * the day holds exactly the computed rows. The coverage row for the day is
 * written in the same transaction.
 *
 * Rows and coverage whose content is unchanged are not written, so re-running
 * an unchanged day keeps its updatedAt and aggregatedAt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailySummaryWriter {

    private final DailySummaryRepository dailySummaryRepository;
    private final SummaryCoverageRepository summaryCoverageRepository;

    @Transactional
    public DayWriteResult replaceDay(LocalDate day, SummaryScope scope, List<DailySummaryEntity> computed) {
        List<DailySummaryEntity> existing =
                dailySummaryRepository.findByDimensionAndSummaryDate(scope.getDimension(), day);
        Map<String, DailySummaryEntity> existingByGroup = existing.stream()
                .collect(Collectors.toMap(DailySummaryEntity::getGroupKey, Function.identity()));

        List<DailySummaryEntity> toSave = new ArrayList<>(computed.size());
        Set<String> computedGroups = new HashSet<>();
        int created = 0;
        int updated = 0;

        boolean keepSketchFlag = scope.getDistinctMode() == DistinctMode.APPROXIMATE;
        for (DailySummaryEntity row : computed) {
            computedGroups.add(row.getGroupKey());
            DailySummaryEntity current = existingByGroup.get(row.getGroupKey());
            if (current != null) {
                if (current.replaceWith(row, keepSketchFlag)) {
                    toSave.add(current);
                    updated++;
                }
            } else {
                toSave.add(row);
                created++;
            }
        }

        List<DailySummaryEntity> stale = existing.stream()
                .filter(row -> !computedGroups.contains(row.getGroupKey()))
                .collect(Collectors.toList());

        if (!stale.isEmpty()) {
            dailySummaryRepository.deleteAllInBatch(stale);
        }
        if (!toSave.isEmpty()) {
            dailySummaryRepository.saveAll(toSave);
        }
        writeCoverage(day, scope, computed);

        log.debug("Replaced {} {}: created={} updated={} removed={}",
                scope.getDimension(), day, created, updated, stale.size());

        return new DayWriteResult(created, updated, stale.size());
    }

    /**
     * Sets the sketch flag on the given groups of a committed day.
     */
    @Transactional
    public void markSketches(LocalDate day, GroupingDimension dimension, Collection<String> groupKeys, boolean stored) {
        if (groupKeys.isEmpty()) {
            return;
        }
        int changed = dailySummaryRepository.updateSketchStored(dimension, day, groupKeys, stored);
        log.debug("Sketch flag {} on {} {} rows of {}", stored, changed, dimension, day);
    }

    /**
     * Computes what {@link #replaceDay} would change without writing.
     */
    @Transactional(readOnly = true)
    public DayWriteResult planDay(LocalDate day, SummaryScope scope, List<DailySummaryEntity> computed) {
        Map<String, DailySummaryEntity> existingByGroup = dailySummaryRepository
                .findByDimensionAndSummaryDate(scope.getDimension(), day).stream()
                .collect(Collectors.toMap(DailySummaryEntity::getGroupKey, Function.identity()));

        int created = 0;
        int updated = 0;
        Set<String> computedGroups = new HashSet<>();
        for (DailySummaryEntity row : computed) {
            computedGroups.add(row.getGroupKey());
            DailySummaryEntity current = existingByGroup.get(row.getGroupKey());
            if (current == null) {
                created++;
            } else if (!current.sameAggregates(row)) {
                updated++;
            }
        }
        int removed = (int) existingByGroup.keySet().stream().filter(group -> !computedGroups.contains(group)).count();

        return new DayWriteResult(created, updated, removed);
    }

    private void writeCoverage(LocalDate day, SummaryScope scope, List<DailySummaryEntity> computed) {
        Optional<SummaryCoverageEntity> existing = summaryCoverageRepository
                .findByDimensionAndSummaryDate(scope.getDimension(), day);
        int groupCount = computed.size();
        long totalViews = computed.stream().mapToLong(DailySummaryEntity::getTotalViews).sum();

        if (existing.isPresent()
                && existing.get().getGroupCount() == groupCount
                && existing.get().getTotalViews() == totalViews
                && existing.get().getDistinctMode() == scope.getDistinctMode()) {
            return;
        }

        SummaryCoverageEntity coverage = existing.orElseGet(() -> SummaryCoverageEntity.builder()
                .summaryDate(day)
                .dimension(scope.getDimension())
                .build());
        coverage.setGroupCount(groupCount);
        coverage.setTotalViews(totalViews);
        coverage.setDistinctMode(scope.getDistinctMode());
        coverage.setAggregatedAt(Instant.now());
        summaryCoverageRepository.save(coverage);
    }
}
