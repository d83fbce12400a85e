package com.loci.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 基于 Micrometer 的 MeterRegistry，记录 Counter / Timer；
 * - 所有方法吞掉指标本身的异常，只打 debug 日志，不影响业务流程；
 * - 命名规则「loci.模块.动作」。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录一次模型调用结果（success / fail / skipped）。
     */
    public void recordGenerationCall(String outcome, String reason, String model) {
        try {
            meterRegistry.counter("loci.ai.generate.call",
                    "outcome", safe(outcome),
                    "reason", safe(reason),
                    "model", safe(model)).increment();
        } catch (Exception e) {
            log.debug("记录 AI 调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录模型调用耗时。
     */
    public void recordGenerationLatencyMs(long latencyMs, String outcome, String model) {
        try {
            meterRegistry.timer("loci.ai.generate.latency",
                    "outcome", safe(outcome),
                    "model", safe(model))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录 AI 耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录单个生成任务（city_data / general_pois / personalized_pois ...）的结果。
     */
    public void recordWorkerResult(String task, boolean success) {
        try {
            meterRegistry.counter("loci.orchestrator.worker",
                    "task", safe(task),
                    "outcome", success ? "success" : "fail").increment();
        } catch (Exception e) {
            log.debug("记录生成任务指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录流式事件投递超时进入死信。
     */
    public void recordStreamDeadLetter(String eventType) {
        try {
            meterRegistry.counter("loci.stream.dead_letter", "type", safe(eventType)).increment();
        } catch (Exception e) {
            log.debug("记录死信指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录持久化步骤结果。
     */
    public void recordPersistence(String operation, String outcome) {
        try {
            meterRegistry.counter("loci.persistence",
                    "operation", safe(operation),
                    "outcome", safe(outcome)).increment();
        } catch (Exception e) {
            log.debug("记录持久化指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录生成结果缓存命中情况。
     */
    public void recordGenerationCacheHit(boolean hit) {
        try {
            meterRegistry.counter("loci.generation.cache", "outcome", hit ? "hit" : "miss").increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    public void recordRateLimited(String bizKey) {
        try {
            meterRegistry.counter("loci.rate_limit.rejected", "biz", safe(bizKey)).increment();
        } catch (Exception e) {
            log.debug("记录限流指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
