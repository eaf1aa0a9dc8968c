package com.ryuqq.macropipeline.adapter.local.cluster;

import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.ClusterStatus;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 호출자가 소유한 {@link ExecutorService}를 Cluster로 노출하는 어댑터.
 *
 * <p>상태는 ExecutorService로부터 계산합니다:
 * 종료 전 RUNNING, shutdown 후 종료 대기 중 CLOSING, 종료 후 CLOSED.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorServiceCluster implements Cluster {

    private static final long CLOSE_TIMEOUT_SECONDS = 30;

    private final ExecutorService executorService;

    /**
     * 생성자.
     *
     * @param executorService 작업을 실행할 ExecutorService
     * @throws IllegalArgumentException executorService가 null인 경우
     */
    public ExecutorServiceCluster(ExecutorService executorService) {
        if (executorService == null) {
            throw new IllegalArgumentException("executorService cannot be null");
        }
        this.executorService = executorService;
    }

    @Override
    public ClusterStatus getStatus() {
        if (executorService.isTerminated()) {
            return ClusterStatus.CLOSED;
        }
        return executorService.isShutdown() ? ClusterStatus.CLOSING : ClusterStatus.RUNNING;
    }

    @Override
    public <T> Future<T> submit(Callable<T> unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        ClusterStatus current = getStatus();
        if (!current.isAcceptingWork()) {
            throw new IllegalStateException("executor service is not running (status: " + current + ")");
        }
        try {
            return executorService.submit(unit);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("executor service rejected the unit (status: " + getStatus() + ")", e);
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return "ExecutorServiceCluster{status=" + getStatus() + "}";
    }
}
