package com.loci.server.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.constant.RedisConstants;
import com.loci.common.properties.ChatProperties;
import com.loci.pojo.enums.ChatDomain;
import com.loci.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * GenerationCache 单元测试：Mockito 模拟 Redis，不依赖真实实例。
 */
@ExtendWith(MockitoExtension.class)
class GenerationCacheTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private MetricsRecorder metricsRecorder;

    private ObjectMapper objectMapper;
    private GenerationCache generationCache;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        ChatProperties properties = new ChatProperties();
        properties.setCacheTtlHours(48);
        generationCache = new GenerationCache(stringRedisTemplate, objectMapper, properties, metricsRecorder);
    }

    @Test
    void cacheKey_shouldIgnoreCaseAndSurroundingSpaces() {
        String a = GenerationCache.cacheKey(ChatDomain.DINING, "Lisbon", "Best seafood?", null);
        String b = GenerationCache.cacheKey(ChatDomain.DINING, " lisbon ", "best SEAFOOD?", "");

        assertEquals(a, b);
        assertTrue(a.startsWith(RedisConstants.CACHE_GENERATION_KEY));
        assertNotEquals(a, GenerationCache.cacheKey(ChatDomain.ACTIVITIES, "Lisbon", "Best seafood?", null));
    }

    @Test
    void get_shouldReturnReply_whenCacheHit() throws Exception {
        CachedChatReply reply = new CachedChatReply();
        reply.setDomain(ChatDomain.DINING);
        reply.setCityName("Lisbon");
        reply.setResponseText("{\"restaurants\": []}");
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn(objectMapper.writeValueAsString(reply));

        CachedChatReply cached = generationCache.get("k");

        assertEquals("Lisbon", cached.getCityName());
        assertEquals(ChatDomain.DINING, cached.getDomain());
        verify(metricsRecorder).recordGenerationCacheHit(true);
    }

    @Test
    void get_shouldTreatRedisFailureAsMiss() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertNull(generationCache.get("k"));
        verify(metricsRecorder).recordGenerationCacheHit(false);
    }

    @Test
    void get_shouldIgnoreCorruptEntries() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn("{not json");

        assertNull(generationCache.get("k"));
    }

    @Test
    void put_shouldWriteWithConfiguredTtl() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        CachedChatReply reply = new CachedChatReply();
        reply.setCityName("Lisbon");

        generationCache.put("k", reply);

        verify(valueOperations).set(eq("k"), contains("Lisbon"), eq(48L), eq(TimeUnit.HOURS));
    }

    @Test
    void put_shouldSwallowRedisFailure() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), anyLong(), any(TimeUnit.class));

        assertDoesNotThrow(() -> generationCache.put("k", new CachedChatReply()));
    }
}
