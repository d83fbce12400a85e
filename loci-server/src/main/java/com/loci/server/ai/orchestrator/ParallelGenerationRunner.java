package com.loci.server.ai.orchestrator;

import com.loci.common.properties.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 并行执行一组生成任务，用 CountDownLatch 等齐 N 个结果。
 *
 * - 单个任务失败不影响其它任务；
 * - 超时未完成的任务被取消，并记为失败；
 * - 调用线程被中断时取消所有在途任务，并继续抛出 InterruptedException。
 */
@Component
@Slf4j
public class ParallelGenerationRunner {

    private final ExecutorService generationExecutor;
    private final ChatProperties chatProperties;

    public ParallelGenerationRunner(@Qualifier("generationExecutor") ExecutorService generationExecutor,
                                    ChatProperties chatProperties) {
        this.generationExecutor = generationExecutor;
        this.chatProperties = chatProperties;
    }

    public Map<GenerationTask, GenerationResult> runAll(Map<GenerationTask, Callable<GenerationResult>> tasks)
            throws InterruptedException {
        return runAll(tasks, null);
    }

    /**
     * @param listener 每个任务结束时在工作线程上回调，可为 null
     * @return 与入参顺序一致的结果
     */
    public Map<GenerationTask, GenerationResult> runAll(Map<GenerationTask, Callable<GenerationResult>> tasks,
                                                        Consumer<GenerationResult> listener)
            throws InterruptedException {
        Map<GenerationTask, GenerationResult> done = new ConcurrentHashMap<>();
        Map<GenerationTask, Future<?>> futures = new LinkedHashMap<>();
        CountDownLatch latch = new CountDownLatch(tasks.size());

        for (Map.Entry<GenerationTask, Callable<GenerationResult>> entry : tasks.entrySet()) {
            GenerationTask task = entry.getKey();
            Callable<GenerationResult> work = entry.getValue();
            futures.put(task, generationExecutor.submit(() -> {
                try {
                    GenerationResult result = invoke(task, work);
                    done.put(task, result);
                    notifyListener(listener, result);
                } finally {
                    latch.countDown();
                }
            }));
        }

        boolean completed;
        try {
            completed = latch.await(chatProperties.getWorkerTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            log.warn("等待生成任务时被中断，取消在途任务: tasks={}", tasks.keySet());
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        }

        Map<GenerationTask, GenerationResult> results = new LinkedHashMap<>();
        for (Map.Entry<GenerationTask, Future<?>> entry : futures.entrySet()) {
            GenerationTask task = entry.getKey();
            GenerationResult result = done.get(task);
            if (result == null) {
                entry.getValue().cancel(true);
                result = GenerationResult.failure(task, task.getCode() + " timed out after "
                        + chatProperties.getWorkerTimeoutSeconds() + "s");
                log.warn("生成任务超时: task={}", task.getCode());
            }
            results.put(task, result);
        }
        if (!completed) {
            log.warn("部分生成任务未在时限内完成: finished={}/{}", done.size(), tasks.size());
        }
        return results;
    }

    private GenerationResult invoke(GenerationTask task, Callable<GenerationResult> work) {
        try {
            GenerationResult result = work.call();
            return result == null ? GenerationResult.failure(task, "empty result") : result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GenerationResult.failure(task, task.getCode() + " was cancelled");
        } catch (Exception e) {
            log.error("生成任务异常: task={}", task.getCode(), e);
            return GenerationResult.failure(task, e.getMessage());
        }
    }

    private void notifyListener(Consumer<GenerationResult> listener, GenerationResult result) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(result);
        } catch (RuntimeException e) {
            log.warn("生成结果回调失败: task={}, error={}", result.getTask().getCode(), e.getMessage());
        }
    }
}
