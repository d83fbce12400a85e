package com.loci.server.config;

import com.loci.common.properties.ChatProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置：
 * - generationExecutor：固定大小，线程名 gen-worker-N，执行模型调用；
 * - streamExecutor：按需扩容，线程名 stream-N，执行流式对话的编排与 SSE 推送，不占用生成线程；
 * - 两者提交任务时都复制调用方 MDC（traceId 等），保证工作线程日志可串联。
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GenerationExecutorConfig {

    private final ChatProperties chatProperties;

    @Bean(name = "generationExecutor", destroyMethod = "shutdown")
    public ExecutorService generationExecutor() {
        int size = Math.max(3, chatProperties.getWorkerPoolSize());
        log.info("创建生成任务线程池: size={}", size);
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "gen-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(size, factory));
    }

    @Bean(name = "streamExecutor", destroyMethod = "shutdown")
    public ExecutorService streamExecutor() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "stream-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new MdcPropagatingExecutorService(Executors.newCachedThreadPool(factory));
    }

    /**
     * 包装一个 ExecutorService，在 execute 时把父线程 MDC 带入子线程，结束后清理。
     */
    static class MdcPropagatingExecutorService extends AbstractExecutorService {

        private final ExecutorService delegate;

        MdcPropagatingExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            Map<String, String> parentMdc = MDC.getCopyOfContextMap();
            delegate.execute(() -> {
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    command.run();
                } finally {
                    MDC.clear();
                }
            });
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
