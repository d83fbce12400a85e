package com.loci.server.stream;

import com.loci.common.exception.BaseException;
import com.loci.common.properties.ChatProperties;
import com.loci.pojo.dto.UnifiedChatRequestDTO;
import com.loci.pojo.vo.StreamEventVO;
import com.loci.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 把统一对话流水线接到 SseEmitter 上：
 * 一个线程跑流水线往 sink 写事件，另一个线程从 sink 取事件推给客户端。
 * 客户端断开、超时或推送失败时取消流水线。
 */
@Component
@Slf4j
public class SseStreamBridge {

    private static final long POLL_INTERVAL_MS = 200L;

    private final UnifiedChatStreamService unifiedChatStreamService;
    private final ExecutorService streamExecutor;
    private final ChatProperties chatProperties;
    private final MetricsRecorder metricsRecorder;

    public SseStreamBridge(UnifiedChatStreamService unifiedChatStreamService,
                           @Qualifier("streamExecutor") ExecutorService streamExecutor,
                           ChatProperties chatProperties,
                           MetricsRecorder metricsRecorder) {
        this.unifiedChatStreamService = unifiedChatStreamService;
        this.streamExecutor = streamExecutor;
        this.chatProperties = chatProperties;
        this.metricsRecorder = metricsRecorder;
    }

    public SseEmitter open(UnifiedChatRequestDTO request, Long userId) {
        SseEmitter emitter = new SseEmitter(chatProperties.getSseTimeoutMs());
        StreamEventSink sink = StreamEventSink.create(chatProperties, metricsRecorder);

        Future<?> pipeline = streamExecutor.submit(() -> runPipeline(request, userId, sink));
        Runnable cancel = () -> {
            if (!pipeline.isDone()) {
                log.info("SSE 连接结束，取消对话流水线: userId={}", userId);
                pipeline.cancel(true);
            }
            sink.close();
        };
        emitter.onTimeout(cancel);
        emitter.onError(e -> cancel.run());
        emitter.onCompletion(cancel);

        streamExecutor.submit(() -> pump(sink, emitter, pipeline));
        return emitter;
    }

    /**
     * 请求被拒绝（如限流）时返回只含一个 error 事件的流。
     */
    public SseEmitter rejected(String part, String message) {
        SseEmitter emitter = new SseEmitter(chatProperties.getSseTimeoutMs());
        StreamEventVO event = StreamEventVO.error(part, message);
        try {
            emitter.send(SseEmitter.event().id(event.getEventId()).name(event.getType()).data(event));
            emitter.complete();
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
        return emitter;
    }

    private void runPipeline(UnifiedChatRequestDTO request, Long userId, StreamEventSink sink) {
        try {
            unifiedChatStreamService.process(request, userId, sink);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("对话流水线被取消: userId={}", userId);
        } catch (BaseException e) {
            log.warn("对话流水线业务异常: code={}, msg={}", e.getCode(), e.getMessage());
            sink.send(StreamEventVO.error(UnifiedChatStreamService.PART_PIPELINE, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("对话流水线异常", e);
            sink.send(StreamEventVO.error(UnifiedChatStreamService.PART_PIPELINE, "internal error"));
        } finally {
            sink.close();
        }
    }

    private void pump(StreamEventSink sink, SseEmitter emitter, Future<?> pipeline) {
        try {
            while (!sink.isDrained()) {
                StreamEventVO event = sink.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                emitter.send(SseEmitter.event()
                        .id(event.getEventId())
                        .name(event.getType())
                        .data(event));
            }
            int dead = sink.drainDeadLetters().size();
            if (dead > 0) {
                log.warn("对话流结束，存在未投递事件: deadLetters={}", dead);
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.info("客户端已断开，停止推送: {}", e.getMessage());
            pipeline.cancel(true);
            sink.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipeline.cancel(true);
            sink.close();
            emitter.complete();
        }
    }
}
