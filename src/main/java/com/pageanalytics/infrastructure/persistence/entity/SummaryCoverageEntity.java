package com.pageanalytics.infrastructure.persistence.entity;

import com.pageanalytics.domain.model.DistinctMode;
import com.pageanalytics.domain.model.GroupingDimension;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Records that aggregation completed for a (day, dimension).
 * 
 * A day with a coverage row and groupCount == 0 had no events. A day without
 * a coverage row was never aggregated. Summary rows alone cannot tell these
 * apart because empty groups are never written.
 */
@Entity
@Table(name = "summary_coverage",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_coverage_day_dimension",
        columnNames = {"summaryDate", "dimension"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryCoverageEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private LocalDate summaryDate;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GroupingDimension dimension;
    
    @Column(nullable = false)
    private int groupCount;
    
    @Column(nullable = false)
    private long totalViews;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DistinctMode distinctMode;
    
    @Column(nullable = false)
    private Instant aggregatedAt;
}
