package com.loci.server.limit;

import com.loci.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的固定窗口限流器：窗口内 INCR 计数，首次计数时设置过期时间。
 *
 * 说明：
 * - 限流维度由调用方决定（当前为 userId）；
 * - Redis 不可用时放行，只记日志。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimpleRateLimiter {

    private static final String PREFIX = "rl:";

    private final StringRedisTemplate stringRedisTemplate;
    private final MetricsRecorder metricsRecorder;

    /**
     * @param bizKey       业务前缀，例如 chat:generate:user
     * @param identify     限流维度标识
     * @param windowSecond 时间窗口（秒）
     * @param maxCount     窗口内允许的最大次数
     * @return true 表示允许本次请求
     */
    public boolean tryAcquire(String bizKey, String identify, long windowSecond, long maxCount) {
        if (identify == null) {
            identify = "unknown";
        }
        String key = PREFIX + bizKey + ":" + identify;
        Long count;
        try {
            count = stringRedisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                stringRedisTemplate.expire(key, windowSecond, TimeUnit.SECONDS);
            }
        } catch (DataAccessException e) {
            log.warn("限流计数失败，放行: bizKey={}, identify={}, error={}", bizKey, identify, e.getMessage());
            return true;
        }
        if (count == null) {
            return true;
        }
        boolean allowed = count <= maxCount;
        if (!allowed) {
            metricsRecorder.recordRateLimited(bizKey);
            log.warn("限流触发: bizKey={}, identify={}, windowSecond={}, maxCount={}, current={}",
                    bizKey, identify, windowSecond, maxCount, count);
        }
        return allowed;
    }
}
