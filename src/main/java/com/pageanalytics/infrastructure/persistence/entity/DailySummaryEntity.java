package com.pageanalytics.infrastructure.persistence.entity;

import com.pageanalytics.domain.model.GroupingDimension;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-calculated summary for one (day, dimension, group key).
 * 
 * Instead of scanning page views on every query we read one row per day and
 * group, so a year of data is at most 365 rows per group.
 * 
 * itemIds holds the sorted, distinct blog ids viewed that day for the group.
 * It is what lets a range query return distinct blogs over the whole range
 * (a union) instead of blog-days (a sum). Storage grows with cardinality;
 * approximate mode adds a HyperLogLog sketch per row for large ranges.
 * 
 * A row is fully replaced on every re-run of its day and is never written
 * with zero views.
 */
@Entity
@Table(name = "daily_summaries",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_summary_day_dimension_group",
        columnNames = {"summaryDate", "dimension", "groupKey"}),
    indexes = {
        @Index(name = "idx_summary_dimension_date", columnList = "dimension,summaryDate"),
        @Index(name = "idx_summary_dimension_group", columnList = "dimension,groupKey")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummaryEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false)
    private LocalDate summaryDate;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GroupingDimension dimension;
    
    @Column(nullable = false, length = 150)
    private String groupKey;
    
    @Column(nullable = false)
    private long totalViews;
    
    @Column(nullable = false)
    private int uniqueItems;
    
    @Convert(converter = ItemIdsConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private List<Long> itemIds = new ArrayList<>();
    
    @Column(nullable = false)
    private boolean sketchStored;
    
    @Column(nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
    
    /**
     * Copies the aggregate columns of another row onto this one.
     * Identity columns (id, day, dimension, group) are left alone.
     *
     * With keepSketchFlag the sketch flag survives when the aggregates did not
     * change; otherwise it is taken from the computed row.
     *
     * @return true if any column changed
     */
    public boolean replaceWith(DailySummaryEntity computed, boolean keepSketchFlag) {
        boolean aggregatesChanged = !sameAggregates(computed);
        boolean sketchFlag = keepSketchFlag && !aggregatesChanged ? sketchStored : computed.isSketchStored();
        boolean changed = aggregatesChanged || sketchFlag != sketchStored;

        this.totalViews = computed.getTotalViews();
        this.uniqueItems = computed.getUniqueItems();
        this.itemIds = new ArrayList<>(computed.getItemIds());
        this.sketchStored = sketchFlag;
        return changed;
    }

    public boolean sameAggregates(DailySummaryEntity other) {
        return totalViews == other.getTotalViews()
            && uniqueItems == other.getUniqueItems()
            && itemIds.equals(other.getItemIds());
    }
}
