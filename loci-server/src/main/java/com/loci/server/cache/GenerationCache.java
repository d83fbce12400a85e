package com.loci.server.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loci.common.constant.RedisConstants;
import com.loci.common.properties.ChatProperties;
import com.loci.pojo.enums.ChatDomain;
import com.loci.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 生成结果缓存：key = cache:gen:{md5(domain|city|message|preferences)}，TTL 默认 48 小时。
 *
 * Redis 异常一律按未命中处理，不影响生成流程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationCache {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final ChatProperties chatProperties;
    private final MetricsRecorder metricsRecorder;

    public static String cacheKey(ChatDomain domain, String cityName, String message, String preferences) {
        String raw = (domain == null ? "" : domain.getCode()) + "|"
                + normalize(cityName) + "|"
                + normalize(message) + "|"
                + normalize(preferences);
        return RedisConstants.CACHE_GENERATION_KEY
                + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }

    public CachedChatReply get(String key) {
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            log.warn("读取生成缓存失败，按未命中处理: key={}, error={}", key, e.getMessage());
            metricsRecorder.recordGenerationCacheHit(false);
            return null;
        }
        if (!StringUtils.hasText(json)) {
            metricsRecorder.recordGenerationCacheHit(false);
            return null;
        }
        try {
            CachedChatReply reply = objectMapper.readValue(json, CachedChatReply.class);
            metricsRecorder.recordGenerationCacheHit(true);
            return reply;
        } catch (JsonProcessingException e) {
            log.warn("生成缓存内容损坏，忽略: key={}, error={}", key, e.getOriginalMessage());
            metricsRecorder.recordGenerationCacheHit(false);
            return null;
        }
    }

    public void put(String key, CachedChatReply reply) {
        if (reply == null) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(reply);
            stringRedisTemplate.opsForValue().set(key, json, chatProperties.getCacheTtlHours(), TimeUnit.HOURS);
        } catch (JsonProcessingException e) {
            log.error("序列化生成缓存失败: key={}", key, e);
        } catch (DataAccessException e) {
            log.warn("写入生成缓存失败: key={}, error={}", key, e.getMessage());
        }
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
