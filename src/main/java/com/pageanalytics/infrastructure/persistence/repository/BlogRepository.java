package com.pageanalytics.infrastructure.persistence.repository;

import com.pageanalytics.infrastructure.persistence.entity.BlogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface BlogRepository extends JpaRepository<BlogEntity, Long> {
    
    /**
     * Creation times of blogs published in a window, optionally for one author.
     */
    @Query("SELECT b.createdAt FROM BlogEntity b WHERE " +
           "b.createdAt >= :from AND b.createdAt < :to AND " +
           "(:authorUsername IS NULL OR b.authorUsername = :authorUsername)")
    List<Instant> findCreationTimes(
            @Param("from") Instant from,
            @Param("to") Instant to,
            @Param("authorUsername") String authorUsername
    );
}
