package com.pageanalytics.domain.aggregation;

import com.pageanalytics.domain.exception.StoreUnavailableException;
import com.pageanalytics.domain.model.DistinctMode;
import com.pageanalytics.domain.model.GroupingDimension;
import com.pageanalytics.infrastructure.lock.LocalRecomputeLock;
import com.pageanalytics.infrastructure.lock.LockHandle;
import com.pageanalytics.infrastructure.lock.PassThroughRecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLockTemplate;
import com.pageanalytics.infrastructure.persistence.entity.DailySummaryEntity;
import com.pageanalytics.infrastructure.persistence.repository.PageViewRepository;
import com.pageanalytics.infrastructure.sketch.HyperLogLogSketchStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AggregationEngine.
 * 
 * Uses a real in-process lock so lock handling is exercised end to end;
 * the event store and summary writer are mocked.
 */
@ExtendWith(MockitoExtension.class)
class AggregationEngineTest {
    
    private static final LocalDate DAY = LocalDate.of(2024, 1, 1);
    private static final SummaryScope COUNTRY_EXACT = SummaryScope.of(GroupingDimension.COUNTRY, DistinctMode.EXACT);
    
    @Mock
    private PageViewRepository pageViewRepository;
    
    @Mock
    private DailySummaryWriter dailySummaryWriter;
    
    @Mock
    private HyperLogLogSketchStore sketchStore;
    
    @Captor
    private ArgumentCaptor<List<DailySummaryEntity>> rowsCaptor;
    
    private LocalRecomputeLock recomputeLock;
    private MeterRegistry meterRegistry;
    private AggregationEngine aggregationEngine;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recomputeLock = new LocalRecomputeLock();
        RecomputeLockTemplate lockTemplate =
                new RecomputeLockTemplate(recomputeLock, Duration.ofMillis(100), meterRegistry);
        aggregationEngine = new AggregationEngine(
                pageViewRepository, dailySummaryWriter, sketchStore, lockTemplate, meterRegistry);
    }
    
    @Test
    void testComputeDay_GroupsViewsAndDistinctBlogs() {
        // Given: blog 1 viewed twice and blog 2 once from US, blog 3 once from DE
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(
                        new Object[]{"US", 2L, 1L},
                        new Object[]{"US", 1L, 2L},
                        new Object[]{"DE", 3L, 1L}));
        
        // When
        List<DailySummaryEntity> summaries = aggregationEngine.computeDay(DAY, GroupingDimension.COUNTRY);
        
        // Then: ordered by group key, item ids sorted
        assertEquals(2, summaries.size());
        
        DailySummaryEntity de = summaries.get(0);
        assertEquals("DE", de.getGroupKey());
        assertEquals(1, de.getTotalViews());
        assertEquals(List.of(3L), de.getItemIds());
        
        DailySummaryEntity us = summaries.get(1);
        assertEquals("US", us.getGroupKey());
        assertEquals(DAY, us.getSummaryDate());
        assertEquals(GroupingDimension.COUNTRY, us.getDimension());
        assertEquals(3, us.getTotalViews());
        assertEquals(2, us.getUniqueItems());
        assertEquals(List.of(1L, 2L), us.getItemIds());
    }
    
    @Test
    void testComputeDay_SkipsViewsWithoutGroupKey() {
        // Given
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{null, 1L, 4L}, new Object[]{"FR", 2L, 1L}));
        
        // When
        List<DailySummaryEntity> summaries = aggregationEngine.computeDay(DAY, GroupingDimension.COUNTRY);
        
        // Then
        assertEquals(1, summaries.size());
        assertEquals("FR", summaries.get(0).getGroupKey());
    }
    
    @Test
    void testComputeDay_AuthorDimension() {
        // Given
        when(pageViewRepository.countViewsByAuthorAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"alice", 7L, 2L}, new Object[]{"alice", 8L, 1L}));
        
        // When
        List<DailySummaryEntity> summaries = aggregationEngine.computeDay(DAY, GroupingDimension.AUTHOR);
        
        // Then
        assertEquals(1, summaries.size());
        assertEquals(GroupingDimension.AUTHOR, summaries.get(0).getDimension());
        assertEquals(3, summaries.get(0).getTotalViews());
        assertEquals(List.of(7L, 8L), summaries.get(0).getItemIds());
        verify(pageViewRepository, never()).countViewsByCountryAndBlog(any(), any());
    }
    
    @Test
    void testAggregate_WritesComputedRows() {
        // Given
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"US", 1L, 2L}, new Object[]{"US", 2L, 1L}));
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(1, 0, 0));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.forDay(DAY), COUNTRY_EXACT);
        
        // Then
        assertEquals(AggregationStatus.COMPLETED, result.getStatus());
        assertEquals(1, result.getDaysSucceeded());
        assertEquals(1, result.getRowsCreated());
        
        verify(dailySummaryWriter).replaceDay(eq(DAY), eq(COUNTRY_EXACT), rowsCaptor.capture());
        DailySummaryEntity us = rowsCaptor.getValue().get(0);
        assertEquals(3, us.getTotalViews());
        assertEquals(2, us.getUniqueItems());
        assertFalse(us.isSketchStored());
        
        verifyNoInteractions(sketchStore);
        assertEquals(1.0, meterRegistry.counter("aggregation.days",
                "dimension", "COUNTRY", "result", "success").count());
    }
    
    @Test
    void testAggregate_DayWithoutEventsStillWritten() {
        // Given
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any())).thenReturn(new ArrayList<>());
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(0, 0, 2));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.forDay(DAY), COUNTRY_EXACT);
        
        // Then: the empty day is replaced so stale rows go away and coverage records it
        assertEquals(AggregationStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getRowsRemoved());
        verify(dailySummaryWriter).replaceDay(DAY, COUNTRY_EXACT, List.of());
    }
    
    @Test
    void testAggregate_FailedDayDoesNotStopOthers() {
        // Given
        AggregationRequest request = AggregationRequest.builder()
                .startDate(DAY)
                .endDate(DAY.plusDays(2))
                .build();
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"US", 1L, 1L}))
                .thenThrow(new IllegalStateException("bad row"))
                .thenReturn(rows(new Object[]{"US", 1L, 1L}));
        when(dailySummaryWriter.replaceDay(any(), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(1, 0, 0));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(request, COUNTRY_EXACT);
        
        // Then
        assertEquals(AggregationStatus.PARTIAL_FAILURE, result.getStatus());
        assertEquals(2, result.getDaysSucceeded());
        assertEquals(1, result.getDaysFailed());
        assertEquals(DAY.plusDays(1), result.getFailedDays().get(0).getDay());
        assertEquals("bad row", result.getFailedDays().get(0).getError());
        
        verify(dailySummaryWriter).replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList());
        verify(dailySummaryWriter, never()).replaceDay(eq(DAY.plusDays(1)), any(), anyList());
        verify(dailySummaryWriter).replaceDay(eq(DAY.plusDays(2)), eq(COUNTRY_EXACT), anyList());
    }
    
    @Test
    void testAggregate_StoreUnavailableAbortsAndReleasesLock() {
        // Given
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        
        // When / Then
        assertThrows(StoreUnavailableException.class,
                () -> aggregationEngine.aggregate(AggregationRequest.forDay(DAY), COUNTRY_EXACT));
        
        verifyNoInteractions(dailySummaryWriter);
        Optional<LockHandle> handle = recomputeLock.acquire(COUNTRY_EXACT.lockKey(), Duration.ZERO);
        assertTrue(handle.isPresent());
    }
    
    @Test
    void testAggregate_LockHeldSkipsRun() {
        // Given: another run holds the country lock
        Optional<LockHandle> held = recomputeLock.acquire(COUNTRY_EXACT.lockKey(), Duration.ZERO);
        assertTrue(held.isPresent());
        
        // When
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.forDay(DAY), COUNTRY_EXACT);
        
        // Then
        assertEquals(AggregationStatus.LOCK_UNAVAILABLE, result.getStatus());
        assertEquals(0, result.getDaysSucceeded());
        verifyNoInteractions(pageViewRepository, dailySummaryWriter, sketchStore);
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "unavailable").count());
    }
    
    @Test
    void testAggregate_LockIsPerScope() {
        // Given: the country lock is held
        recomputeLock.acquire(COUNTRY_EXACT.lockKey(), Duration.ZERO);
        SummaryScope authorScope = SummaryScope.of(GroupingDimension.AUTHOR, DistinctMode.EXACT);
        when(pageViewRepository.countViewsByAuthorAndBlog(any(), any())).thenReturn(new ArrayList<>());
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(authorScope), anyList()))
                .thenReturn(new DayWriteResult(0, 0, 0));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.forDay(DAY), authorScope);
        
        // Then
        assertEquals(AggregationStatus.COMPLETED, result.getStatus());
    }
    
    @Test
    void testAggregate_ForceIgnoresHeldLock() {
        // Given
        recomputeLock.acquire(COUNTRY_EXACT.lockKey(), Duration.ZERO);
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any())).thenReturn(new ArrayList<>());
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(0, 0, 0));
        AggregationRequest request = AggregationRequest.builder().startDate(DAY).endDate(DAY).force(true).build();
        
        // When
        AggregationResult result = aggregationEngine.aggregate(request, COUNTRY_EXACT);
        
        // Then
        assertEquals(AggregationStatus.COMPLETED, result.getStatus());
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "unguarded").count());
    }
    
    @Test
    void testAggregate_DryRunWritesNothing() {
        // Given
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"US", 1L, 2L}));
        when(dailySummaryWriter.planDay(eq(DAY), any(), anyList())).thenReturn(new DayWriteResult(1, 0, 0));
        AggregationRequest request = AggregationRequest.builder().startDate(DAY).endDate(DAY).dryRun(true).build();
        
        // When
        AggregationResult result = aggregationEngine.aggregate(
                request, SummaryScope.of(GroupingDimension.COUNTRY, DistinctMode.APPROXIMATE));
        
        // Then
        assertTrue(result.isDryRun());
        assertEquals(1, result.getRowsCreated());
        verify(dailySummaryWriter, never()).replaceDay(any(), any(), anyList());
        verifyNoInteractions(sketchStore);
    }
    
    @Test
    void testAggregate_CancelledBetweenDays() {
        // Given: cancellation arrives after the first day
        AtomicInteger polls = new AtomicInteger();
        AggregationRequest request = AggregationRequest.builder()
                .startDate(DAY)
                .endDate(DAY.plusDays(4))
                .cancellation(() -> polls.incrementAndGet() > 1)
                .build();
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any())).thenReturn(new ArrayList<>());
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(0, 0, 0));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(request, COUNTRY_EXACT);
        
        // Then
        assertEquals(AggregationStatus.CANCELLED, result.getStatus());
        assertEquals(1, result.getDaysSucceeded());
        verify(dailySummaryWriter, times(1)).replaceDay(any(), any(), anyList());
    }
    
    @Test
    void testAggregate_ApproximateModeWritesSketchesAfterCommit() {
        // Given
        SummaryScope scope = SummaryScope.of(GroupingDimension.COUNTRY, DistinctMode.APPROXIMATE);
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"US", 1L, 2L}, new Object[]{"US", 2L, 1L}, new Object[]{"FR", 3L, 1L}));
        when(sketchStore.replace("analytics:hll:2024-01-01:country:US", List.of(1L, 2L))).thenReturn(true);
        when(sketchStore.replace("analytics:hll:2024-01-01:country:FR", List.of(3L))).thenReturn(false);
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(scope), anyList())).thenReturn(new DayWriteResult(2, 0, 0));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.forDay(DAY), scope);
        
        // Then: rows commit unflagged, sketches follow, then only US is flagged
        assertEquals(AggregationStatus.COMPLETED, result.getStatus());
        InOrder order = inOrder(dailySummaryWriter, sketchStore);
        order.verify(dailySummaryWriter).replaceDay(eq(DAY), eq(scope), rowsCaptor.capture());
        order.verify(sketchStore, times(2)).replace(anyString(), anyList());
        order.verify(dailySummaryWriter).markSketches(DAY, GroupingDimension.COUNTRY, List.of("US"), true);
        order.verify(dailySummaryWriter).markSketches(DAY, GroupingDimension.COUNTRY, List.of("FR"), false);
        
        assertTrue(rowsCaptor.getValue().stream().noneMatch(DailySummaryEntity::isSketchStored));
        assertEquals(List.of(1L, 2L), rowsCaptor.getValue().get(1).getItemIds());
    }
    
    @Test
    void testAggregate_RolledBackDayLeavesSketchesAlone() {
        // Given: the day's transaction fails
        SummaryScope scope = SummaryScope.of(GroupingDimension.COUNTRY, DistinctMode.APPROXIMATE);
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"US", 1L, 2L}));
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(scope), anyList()))
                .thenThrow(new IllegalStateException("unique constraint violated"));
        
        // When
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.forDay(DAY), scope);
        
        // Then
        assertEquals(AggregationStatus.PARTIAL_FAILURE, result.getStatus());
        verifyNoInteractions(sketchStore);
        verify(dailySummaryWriter, never()).markSketches(any(), any(), anyCollection(), anyBoolean());
    }
    
    @Test
    void testAggregate_LostLeaseStopsBeforeNextDay() {
        // Given: the lock is held for the first day and lost before the second
        RecomputeLock lock = mock(RecomputeLock.class);
        when(lock.acquire(eq(COUNTRY_EXACT.lockKey()), any()))
                .thenAnswer(invocation -> Optional.of(LockHandle.of(COUNTRY_EXACT.lockKey(), lock)));
        when(lock.enforcesMutualExclusion()).thenReturn(true);
        when(lock.renew(any())).thenReturn(true, false);
        AggregationEngine engine = new AggregationEngine(pageViewRepository, dailySummaryWriter, sketchStore,
                new RecomputeLockTemplate(lock, Duration.ofMillis(100), meterRegistry), meterRegistry);
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any())).thenReturn(new ArrayList<>());
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(0, 0, 0));
        AggregationRequest request = AggregationRequest.builder().startDate(DAY).endDate(DAY.plusDays(2)).build();
        
        // When
        AggregationResult result = engine.aggregate(request, COUNTRY_EXACT);
        
        // Then
        assertEquals(AggregationStatus.CANCELLED, result.getStatus());
        assertEquals(1, result.getDaysSucceeded());
        verify(dailySummaryWriter, times(1)).replaceDay(any(), any(), anyList());
        verify(lock).release(any());
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "lost").count());
    }
    
    @Test
    void testAggregate_UnguardedRunsOverwriteInTurn() {
        // Given: no lock backend, two runs see different events for the same day
        AggregationEngine engine = new AggregationEngine(pageViewRepository, dailySummaryWriter, sketchStore,
                new RecomputeLockTemplate(new PassThroughRecomputeLock(), Duration.ZERO, meterRegistry),
                meterRegistry);
        when(pageViewRepository.countViewsByCountryAndBlog(any(), any()))
                .thenReturn(rows(new Object[]{"US", 1L, 2L}))
                .thenReturn(rows(new Object[]{"DE", 7L, 1L}));
        when(dailySummaryWriter.replaceDay(eq(DAY), eq(COUNTRY_EXACT), anyList()))
                .thenReturn(new DayWriteResult(1, 0, 0))
                .thenReturn(new DayWriteResult(1, 0, 1));
        
        // When
        AggregationResult first = engine.aggregate(AggregationRequest.forDay(DAY), COUNTRY_EXACT);
        AggregationResult second = engine.aggregate(AggregationRequest.forDay(DAY), COUNTRY_EXACT);
        
        // Then: the later run replaces the day with only its own rows
        assertEquals(AggregationStatus.COMPLETED, first.getStatus());
        assertEquals(AggregationStatus.COMPLETED, second.getStatus());
        assertEquals(1, second.getRowsRemoved());
        verify(dailySummaryWriter, times(2)).replaceDay(eq(DAY), eq(COUNTRY_EXACT), rowsCaptor.capture());
        
        List<DailySummaryEntity> secondRows = rowsCaptor.getAllValues().get(1);
        assertEquals(1, secondRows.size());
        assertEquals("DE", secondRows.get(0).getGroupKey());
        assertEquals(List.of(7L), secondRows.get(0).getItemIds());
        assertEquals(2.0, meterRegistry.counter("aggregation.lock", "result", "unguarded").count());
    }
    
    private static List<Object[]> rows(Object[]... rows) {
        return new ArrayList<>(Arrays.asList(rows));
    }
}
