package com.loci.server.stream;

import com.loci.common.properties.ChatProperties;
import com.loci.pojo.vo.StreamEventVO;
import com.loci.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 生成流水线与 SSE 推送之间的有界缓冲。
 *
 * send 带超时投递，失败按固定间隔重试；仍然失败的事件进入死信列表并计数，
 * 不会无限阻塞生成流水线。
 */
@Slf4j
public class StreamEventSink {

    static final long RETRY_BACKOFF_MS = 100L;

    private final BlockingQueue<StreamEventVO> queue;
    private final long sendTimeoutMs;
    private final int sendRetries;
    private final MetricsRecorder metricsRecorder;
    private final List<StreamEventVO> deadLetters = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StreamEventSink(int capacity, long sendTimeoutMs, int sendRetries, MetricsRecorder metricsRecorder) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.sendTimeoutMs = Math.max(0, sendTimeoutMs);
        this.sendRetries = Math.max(0, sendRetries);
        this.metricsRecorder = metricsRecorder;
    }

    public static StreamEventSink create(ChatProperties chatProperties, MetricsRecorder metricsRecorder) {
        return new StreamEventSink(chatProperties.getStreamQueueCapacity(), chatProperties.getStreamSendTimeoutMs(),
                chatProperties.getStreamSendRetries(), metricsRecorder);
    }

    /**
     * @return 是否投递成功；失败的事件已进入死信
     */
    public boolean send(StreamEventVO event) {
        if (event == null) {
            return false;
        }
        if (closed.get()) {
            deadLetter(event, "sink closed");
            return false;
        }
        int attempts = 1 + sendRetries;
        try {
            for (int attempt = 1; attempt <= attempts; attempt++) {
                if (queue.offer(event, sendTimeoutMs, TimeUnit.MILLISECONDS)) {
                    return true;
                }
                if (attempt < attempts) {
                    log.debug("事件投递超时，重试: type={}, attempt={}", event.getType(), attempt);
                    Thread.sleep(RETRY_BACKOFF_MS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadLetter(event, "interrupted");
            return false;
        }
        deadLetter(event, "timeout after " + attempts + " attempts");
        return false;
    }

    /**
     * 取下一个事件，超时返回 null。
     */
    public StreamEventVO poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * 不再接收新事件，已入队的事件仍可被取走。
     */
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 已关闭且队列已清空。
     */
    public boolean isDrained() {
        return closed.get() && queue.isEmpty();
    }

    public List<StreamEventVO> drainDeadLetters() {
        synchronized (deadLetters) {
            List<StreamEventVO> copy = new ArrayList<>(deadLetters);
            deadLetters.clear();
            return copy;
        }
    }

    public int deadLetterCount() {
        synchronized (deadLetters) {
            return deadLetters.size();
        }
    }

    private void deadLetter(StreamEventVO event, String reason) {
        synchronized (deadLetters) {
            deadLetters.add(event);
        }
        metricsRecorder.recordStreamDeadLetter(event.getType());
        log.warn("事件进入死信: eventId={}, type={}, part={}, reason={}",
                event.getEventId(), event.getType(), event.getPart(), reason);
    }
}
