package com.pageanalytics.infrastructure.lock;

import com.pageanalytics.domain.exception.LockUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecomputeLockTemplateTest {
    
    @Mock
    private RecomputeLock recomputeLock;
    
    private MeterRegistry meterRegistry;
    private ExecutorService executor;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(2);
    }
    
    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }
    
    @Test
    void testExecute_ReleasesLockWhenBodyThrows() {
        // Given
        LockHandle handle = LockHandle.of("precalc:country", recomputeLock);
        when(recomputeLock.acquire(eq("precalc:country"), any())).thenReturn(Optional.of(handle));
        when(recomputeLock.enforcesMutualExclusion()).thenReturn(true);
        RecomputeLockTemplate template = new RecomputeLockTemplate(recomputeLock, Duration.ofSeconds(1), meterRegistry);
        
        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> template.execute("precalc:country", () -> {
                    throw new IllegalStateException("boom");
                }));
        
        // Then
        assertEquals("boom", thrown.getMessage());
        verify(recomputeLock).release(handle);
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "acquired").count());
    }
    
    @Test
    void testExecute_NotAcquiredSkipsBody() {
        // Given
        when(recomputeLock.acquire(eq("precalc:user"), any())).thenReturn(Optional.empty());
        RecomputeLockTemplate template = new RecomputeLockTemplate(recomputeLock, Duration.ofMillis(10), meterRegistry);
        AtomicBoolean ran = new AtomicBoolean(false);
        
        // When
        LockUnavailableException thrown = assertThrows(LockUnavailableException.class,
                () -> template.execute("precalc:user", () -> {
                    ran.set(true);
                    return null;
                }));
        
        // Then
        assertEquals("precalc:user", thrown.getScope());
        assertFalse(ran.get());
        verify(recomputeLock, never()).release(any());
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "unavailable").count());
    }
    
    @Test
    void testExecute_ConcurrentRunsAreMutuallyExclusive() throws Exception {
        // Given
        RecomputeLockTemplate template =
                new RecomputeLockTemplate(new LocalRecomputeLock(), Duration.ofMillis(50), meterRegistry);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        
        // When: the first run holds the lock until told to finish
        Future<Integer> first = executor.submit(() -> template.execute("precalc:country", () -> {
            entered.countDown();
            awaitQuietly(finish);
            return 1;
        }));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        
        // Then: a second run for the same scope is skipped
        assertThrows(LockUnavailableException.class, () -> template.execute("precalc:country", () -> 2));
        
        // but another scope is not blocked
        int otherScope = template.execute("precalc:user", () -> 3);
        assertEquals(3, otherScope);
        
        finish.countDown();
        int firstResult = first.get(5, TimeUnit.SECONDS);
        assertEquals(1, firstResult);
        
        // and once released the scope is free again
        int again = template.execute("precalc:country", () -> 4);
        assertEquals(4, again);
    }
    
    @Test
    void testWithLock_PassThroughNeverBlocks() {
        // Given
        LocalRecomputeLock local = new LocalRecomputeLock();
        local.acquire("precalc:country", Duration.ZERO);
        RecomputeLockTemplate template = new RecomputeLockTemplate(local, Duration.ofMillis(10), meterRegistry);
        
        // When
        int result = template.withLock(new PassThroughRecomputeLock()).execute("precalc:country", () -> 7);
        
        // Then
        assertEquals(7, result);
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "unguarded").count());
    }
    
    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
