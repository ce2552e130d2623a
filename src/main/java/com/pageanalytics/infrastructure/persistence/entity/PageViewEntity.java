package com.pageanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A single view of a blog post. This is the fact table.
 * 
 * Rows are append-only: written by ingestion, read by the aggregation engine
 * (one UTC day at a time) and by the event-scan fallback of the query service.
 * 
 * Author and content type are copied from the blog at ingestion time so that
 * daily aggregation never has to join.
 * 
 * Indexing Strategy:
 * - (timestamp, countryCode) for day-bounded aggregation by country
 * - (blogId, timestamp) for per-blog scans
 * - (authorUsername, timestamp) for day-bounded aggregation by author
 */
@Entity
@Table(name = "page_views", indexes = {
    @Index(name = "idx_timestamp_country", columnList = "timestamp,countryCode"),
    @Index(name = "idx_blog_timestamp", columnList = "blogId,timestamp"),
    @Index(name = "idx_author_timestamp", columnList = "authorUsername,timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageViewEntity {
    
    @Id
    @Column(columnDefinition = "UUID")
    private UUID viewId;
    
    @Column(nullable = false)
    private Long blogId;
    
    @Column(nullable = false, length = 150)
    private String authorUsername;
    
    @Column(length = 5)
    private String countryCode;
    
    @Column(length = 50)
    private String contentType;
    
    @Column(length = 45)
    private String viewerIp;
    
    @Column(nullable = false)
    private Instant timestamp;
    
    @PrePersist
    protected void onCreate() {
        if (viewId == null) {
            viewId = UUID.randomUUID();
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
