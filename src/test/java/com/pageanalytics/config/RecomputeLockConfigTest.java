package com.pageanalytics.config;

import com.pageanalytics.infrastructure.lock.OrderedRecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLock;
import com.pageanalytics.infrastructure.lock.RecomputeLockTemplate;
import com.pageanalytics.infrastructure.lock.RedisRecomputeLock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import javax.sql.DataSource;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecomputeLockConfigTest {
    
    @Mock
    private ObjectProvider<RedisTemplate<String, String>> redisProvider;
    
    @Mock
    private ObjectProvider<DataSource> dataSourceProvider;
    
    @Mock
    private RedisTemplate<String, String> redisTemplate;
    
    @Mock
    private ValueOperations<String, String> valueOperations;
    
    private final RecomputeLockConfig config = new RecomputeLockConfig();
    
    @Test
    void testAuto_RedisDownAndNoDatabaseStillRunsBody() {
        // Given: Redis refuses connections and no datasource is configured
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(dataSourceProvider.getIfAvailable()).thenReturn(null);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getLock().setAcquireTimeout(Duration.ofMillis(50));
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        
        RecomputeLock lock = config.recomputeLock(properties, redisProvider, dataSourceProvider);
        RecomputeLockTemplate template = config.recomputeLockTemplate(lock, properties, meterRegistry);
        
        // When
        String result = template.execute("precalc:country", () -> "aggregated");
        
        // Then
        assertEquals("aggregated", result);
        assertEquals(1.0, meterRegistry.counter("aggregation.lock", "result", "unguarded").count());
    }
    
    @Test
    void testAuto_UsesRedisWhenItIsTheOnlyBackend() {
        // Given
        when(redisProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(dataSourceProvider.getIfAvailable()).thenReturn(null);
        
        // When
        RecomputeLock lock = config.recomputeLock(new AnalyticsProperties(), redisProvider, dataSourceProvider);
        
        // Then
        OrderedRecomputeLock ordered = assertInstanceOf(OrderedRecomputeLock.class, lock);
        assertEquals(1, ordered.getBackends().size());
        assertInstanceOf(RedisRecomputeLock.class, ordered.getBackends().get(0));
        assertTrue(lock.enforcesMutualExclusion());
    }
    
    @Test
    void testNone_IsPassThrough() {
        // Given
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getLock().setBackend(AnalyticsProperties.LockBackend.NONE);
        
        // When
        RecomputeLock lock = config.recomputeLock(properties, redisProvider, dataSourceProvider);
        
        // Then
        assertFalse(lock.enforcesMutualExclusion());
    }
}
