package com.pageanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Blog post. Source of titles for top-N rankings and of creation dates for
 * the "created" performance metric.
 */
@Entity
@Table(name = "blogs", indexes = {
    @Index(name = "idx_blog_author_created", columnList = "authorUsername,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlogEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long blogId;
    
    @Column(nullable = false)
    private String title;
    
    @Column(nullable = false, length = 150)
    private String authorUsername;
    
    @Column(length = 50)
    private String contentType;
    
    @Column(nullable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
