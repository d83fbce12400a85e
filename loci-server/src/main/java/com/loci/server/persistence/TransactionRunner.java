package com.loci.server.persistence;

import com.loci.common.exception.BaseException;
import com.loci.common.exception.PersistenceException;
import com.loci.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * 显式事务执行器：begin / commit / rollback 都由这里控制。
 *
 * - 工作单元内任一步骤抛异常，整体回滚，并以 PersistenceException 抛出，消息里带上失败步骤；
 * - 回滚本身失败时只记日志并挂到原异常的 suppressed 上，调用方拿到的永远是原始错误；
 * - 业务异常（BaseException）与 Error 回滚后原样抛出，不再包装。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionRunner {

    private final PlatformTransactionManager transactionManager;
    private final MetricsRecorder metricsRecorder;

    public <T> T inTransaction(String operation, TransactionalWork<T> work) {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setName(operation);
        definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        StepTracker tracker = new StepTracker();
        TransactionStatus status = transactionManager.getTransaction(definition);
        T result;
        try {
            result = work.execute(tracker);
        } catch (Error e) {
            rollbackPreservingCause(status, e, operation, tracker.current());
            metricsRecorder.recordPersistence(operation, "rollback");
            throw e;
        } catch (RuntimeException e) {
            rollbackPreservingCause(status, e, operation, tracker.current());
            metricsRecorder.recordPersistence(operation, "rollback");
            if (e instanceof BaseException) {
                throw e;
            }
            throw new PersistenceException(tracker.current(), operation + " failed: " + e.getMessage(), e);
        }

        try {
            transactionManager.commit(status);
        } catch (RuntimeException e) {
            metricsRecorder.recordPersistence(operation, "commit_fail");
            throw new PersistenceException("commit", operation + " commit failed: " + e.getMessage(), e);
        }
        metricsRecorder.recordPersistence(operation, "success");
        return result;
    }

    private void rollbackPreservingCause(TransactionStatus status, Throwable cause, String operation, String step) {
        if (status.isCompleted()) {
            return;
        }
        try {
            transactionManager.rollback(status);
            log.warn("事务已回滚: operation={}, step={}, cause={}", operation, step, cause.getMessage());
        } catch (RuntimeException rollbackEx) {
            log.error("事务回滚失败，保留原始异常: operation={}, step={}, cause={}",
                    operation, step, cause.getMessage(), rollbackEx);
            cause.addSuppressed(rollbackEx);
        }
    }

    @FunctionalInterface
    public interface TransactionalWork<T> {
        T execute(StepTracker tracker);
    }

    /**
     * 记录当前执行到的步骤名，失败时用于定位。
     */
    public static class StepTracker {

        private String current = "begin";

        public void step(String name) {
            this.current = name;
        }

        public String current() {
            return current;
        }
    }
}
