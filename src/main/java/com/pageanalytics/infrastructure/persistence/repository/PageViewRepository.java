package com.pageanalytics.infrastructure.persistence.repository;

import com.pageanalytics.infrastructure.persistence.entity.PageViewEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for page view events.
 * 
 * All time bounds are half-open: from inclusive, to exclusive.
 * Grouped queries return (group, blogId, views) tuples, so a day is folded
 * into summaries without materializing individual events.
 */
@Repository
public interface PageViewRepository extends JpaRepository<PageViewEntity, UUID> {
    
    /**
     * Views per (country, blog) in a window. Views without a country are skipped.
     */
    @Query("SELECT v.countryCode, v.blogId, COUNT(v) FROM PageViewEntity v WHERE " +
           "v.timestamp >= :from AND v.timestamp < :to AND " +
           "v.countryCode IS NOT NULL " +
           "GROUP BY v.countryCode, v.blogId")
    List<Object[]> countViewsByCountryAndBlog(
            @Param("from") Instant from,
            @Param("to") Instant to
    );
    
    /**
     * Views per (author, blog) in a window.
     */
    @Query("SELECT v.authorUsername, v.blogId, COUNT(v) FROM PageViewEntity v WHERE " +
           "v.timestamp >= :from AND v.timestamp < :to " +
           "GROUP BY v.authorUsername, v.blogId")
    List<Object[]> countViewsByAuthorAndBlog(
            @Param("from") Instant from,
            @Param("to") Instant to
    );
    
    /**
     * Raw scan used when summaries cannot answer a query.
     * 
     * Returns (countryCode, authorUsername, blogId, views). Country
     * include/exclude lists are applied by the caller.
     */
    @Query("SELECT v.countryCode, v.authorUsername, v.blogId, COUNT(v) FROM PageViewEntity v WHERE " +
           "v.timestamp >= :from AND v.timestamp < :to AND " +
           "(:authorUsername IS NULL OR v.authorUsername = :authorUsername) AND " +
           "(:blogId IS NULL OR v.blogId = :blogId) AND " +
           "(:contentType IS NULL OR v.contentType = :contentType) " +
           "GROUP BY v.countryCode, v.authorUsername, v.blogId")
    List<Object[]> scanViews(
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("authorUsername") String authorUsername,
            @Param("blogId") Long blogId,
            @Param("contentType") String contentType
    );
    
    Optional<PageViewEntity> findFirstByOrderByTimestampAsc();
}
