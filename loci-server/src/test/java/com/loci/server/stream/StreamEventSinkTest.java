package com.loci.server.stream;

import com.loci.pojo.vo.StreamEventVO;
import com.loci.server.metrics.MetricsRecorder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 消费端停滞时 send 必须在有限时间内返回，事件进入死信。
 */
@ExtendWith(MockitoExtension.class)
class StreamEventSinkTest {

    @Mock
    private MetricsRecorder metricsRecorder;

    @Test
    void send_shouldDeliverInOrder() throws Exception {
        StreamEventSink sink = new StreamEventSink(4, 50, 0, metricsRecorder);

        assertTrue(sink.send(StreamEventVO.of(StreamEventVO.TYPE_START, "session", null)));
        assertTrue(sink.send(StreamEventVO.of(StreamEventVO.TYPE_COMPLETE, "session", null)));

        assertEquals(StreamEventVO.TYPE_START, sink.poll(100, TimeUnit.MILLISECONDS).getType());
        assertEquals(StreamEventVO.TYPE_COMPLETE, sink.poll(100, TimeUnit.MILLISECONDS).getType());
        assertNull(sink.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void send_shouldDeadLetter_whenConsumerStalls() {
        StreamEventSink sink = new StreamEventSink(1, 20, 2, metricsRecorder);
        assertTrue(sink.send(StreamEventVO.of(StreamEventVO.TYPE_START, "session", null)));

        long start = System.nanoTime();
        boolean delivered = sink.send(StreamEventVO.of(StreamEventVO.TYPE_CHUNK, "dining", "x"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(delivered);
        // 3 次尝试 * 20ms + 2 次退避 * 100ms
        assertTrue(elapsedMs < 2000, "send blocked for " + elapsedMs + "ms");
        List<StreamEventVO> deadLetters = sink.drainDeadLetters();
        assertEquals(1, deadLetters.size());
        assertEquals(StreamEventVO.TYPE_CHUNK, deadLetters.get(0).getType());
        assertEquals(0, sink.deadLetterCount());
        verify(metricsRecorder).recordStreamDeadLetter(StreamEventVO.TYPE_CHUNK);
    }

    @Test
    void send_shouldRejectAfterClose_butKeepQueuedEvents() throws Exception {
        StreamEventSink sink = new StreamEventSink(4, 20, 0, metricsRecorder);
        sink.send(StreamEventVO.of(StreamEventVO.TYPE_START, "session", null));
        sink.close();

        assertFalse(sink.send(StreamEventVO.of(StreamEventVO.TYPE_COMPLETE, "session", null)));
        assertEquals(1, sink.deadLetterCount());
        assertFalse(sink.isDrained());
        assertNotNull(sink.poll(10, TimeUnit.MILLISECONDS));
        assertTrue(sink.isDrained());
    }

    @Test
    void send_shouldDeadLetter_whenInterrupted() {
        StreamEventSink sink = new StreamEventSink(1, 1000, 0, metricsRecorder);
        sink.send(StreamEventVO.of(StreamEventVO.TYPE_START, "session", null));

        Thread.currentThread().interrupt();
        try {
            assertFalse(sink.send(StreamEventVO.of(StreamEventVO.TYPE_CHUNK, "dining", "x")));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(1, sink.deadLetterCount());
    }
}
