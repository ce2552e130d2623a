package com.pageanalytics.domain.service;

import com.pageanalytics.domain.model.PageViewRequest;
import com.pageanalytics.infrastructure.persistence.entity.BlogEntity;
import com.pageanalytics.infrastructure.persistence.entity.PageViewEntity;
import com.pageanalytics.infrastructure.persistence.repository.BlogRepository;
import com.pageanalytics.infrastructure.persistence.repository.PageViewRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PageViewIngestServiceTest {
    
    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    
    @Mock
    private BlogRepository blogRepository;
    
    @Mock
    private PageViewRepository pageViewRepository;
    
    private PageViewIngestService ingestService;
    
    @BeforeEach
    void setUp() {
        ingestService = new PageViewIngestService(blogRepository, pageViewRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
    
    @Test
    void testRecordView_CopiesBlogAttributes() {
        // Given
        when(blogRepository.findById(7L)).thenReturn(Optional.of(BlogEntity.builder()
                .blogId(7L).title("Hello").authorUsername("alice").contentType("article").build()));
        when(pageViewRepository.save(any(PageViewEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        
        // When
        PageViewEntity view = ingestService.recordView(PageViewRequest.builder()
                .blogId(7L).countryCode("us").viewerIp("10.0.0.1").build());
        
        // Then
        assertEquals(7L, view.getBlogId());
        assertEquals("alice", view.getAuthorUsername());
        assertEquals("article", view.getContentType());
        assertEquals("US", view.getCountryCode());
        assertEquals(NOW, view.getTimestamp());
    }
    
    @Test
    void testRecordView_UnknownBlog() {
        // Given
        when(blogRepository.findById(99L)).thenReturn(Optional.empty());
        
        // When / Then
        assertThrows(IllegalArgumentException.class,
                () -> ingestService.recordView(PageViewRequest.builder().blogId(99L).build()));
        verifyNoInteractions(pageViewRepository);
    }
}
