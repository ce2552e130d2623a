package com.pageanalytics.infrastructure.persistence.repository;

import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.infrastructure.persistence.entity.DailySummaryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface DailySummaryRepository extends JpaRepository<DailySummaryEntity, Long> {
    
    List<DailySummaryEntity> findByDimensionAndSummaryDate(GroupingDimension dimension, LocalDate summaryDate);
    
    List<DailySummaryEntity> findByDimensionAndSummaryDateBetween(
            GroupingDimension dimension, LocalDate start, LocalDate end);
    
    @Modifying
    @Query("UPDATE DailySummaryEntity s SET s.sketchStored = :stored " +
           "WHERE s.dimension = :dimension AND s.summaryDate = :day " +
           "AND s.groupKey IN :groupKeys AND s.sketchStored <> :stored")
    int updateSketchStored(@Param("dimension") GroupingDimension dimension,
                           @Param("day") LocalDate day,
                           @Param("groupKeys") Collection<String> groupKeys,
                           @Param("stored") boolean stored);
}
