package com.pageanalytics.infrastructure.persistence.repository;

import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.infrastructure.persistence.entity.SummaryCoverageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface SummaryCoverageRepository extends JpaRepository<SummaryCoverageEntity, Long> {
    
    Optional<SummaryCoverageEntity> findByDimensionAndSummaryDate(GroupingDimension dimension, LocalDate summaryDate);
    
    List<SummaryCoverageEntity> findByDimensionAndSummaryDateBetween(
            GroupingDimension dimension, LocalDate start, LocalDate end);
}
