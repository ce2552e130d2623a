package com.pageanalytics.domain.service;

import com.pageanalytics.domain.model.PageViewRequest;
import com.pageanalytics.infrastructure.persistence.entity.BlogEntity;
import com.pageanalytics.infrastructure.persistence.entity.PageViewEntity;
import com.pageanalytics.infrastructure.persistence.repository.BlogRepository;
import com.pageanalytics.infrastructure.persistence.repository.PageViewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Appends page views to the event store.
 * 
 * Author and content type are copied from the blog so aggregation can group
 * by them without a join.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PageViewIngestService {
    
    private final BlogRepository blogRepository;
    private final PageViewRepository pageViewRepository;
    private final Clock clock;
    
    @Transactional
    public PageViewEntity recordView(PageViewRequest request) {
        BlogEntity blog = blogRepository.findById(request.getBlogId())
                .orElseThrow(() -> new IllegalArgumentException("Blog not found: " + request.getBlogId()));
        
        PageViewEntity view = PageViewEntity.builder()
                .blogId(blog.getBlogId())
                .authorUsername(blog.getAuthorUsername())
                .contentType(blog.getContentType())
                .countryCode(request.getCountryCode() != null ? request.getCountryCode().toUpperCase() : null)
                .viewerIp(request.getViewerIp())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : Instant.now(clock))
                .build();
        
        view = pageViewRepository.save(view);
        log.debug("Recorded view {} of blog {}", view.getViewId(), blog.getBlogId());
        return view;
    }
}
