package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.ClusterStatus;
import com.ryuqq.macropipeline.core.executor.Executor;
import com.ryuqq.macropipeline.core.executor.GatherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Cluster 기반 Executor 공통 구현.
 *
 * <p>제출과 수집을 분리합니다. 모든 작업을 먼저 제출한 뒤, Future를 제출 순서대로 기다려
 * 결과를 같은 순서로 모읍니다. 완료 순서와 무관하게 인덱스 i의 결과는 i번째 작업의 결과입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract sealed class ClusterExecutor implements Executor permits ExternalExecutor, LocalExecutor {

    private static final Logger log = LoggerFactory.getLogger(ClusterExecutor.class);

    private final Cluster cluster;

    /**
     * 생성자.
     *
     * @param cluster 작업을 실행할 Cluster
     * @throws IllegalArgumentException cluster가 null인 경우
     */
    protected ClusterExecutor(Cluster cluster) {
        if (cluster == null) {
            throw new IllegalArgumentException("cluster cannot be null");
        }
        this.cluster = cluster;
    }

    @Override
    public ClusterStatus getStatus() {
        return cluster.getStatus();
    }

    @Override
    public Cluster getCluster() {
        return cluster;
    }

    @Override
    public <T> List<T> submitAndGather(List<? extends Callable<? extends T>> units) {
        if (units == null) {
            throw new IllegalArgumentException("units cannot be null");
        }

        for (int i = 0; i < units.size(); i++) {
            if (units.get(i) == null) {
                throw new IllegalArgumentException("units cannot contain null (index: " + i + ")");
            }
        }

        // 1. 전부 제출 (비블로킹), 중간에 제출이 거부되면 이미 제출한 작업은 취소
        List<Future<? extends T>> futures = new ArrayList<>(units.size());
        try {
            for (Callable<? extends T> unit : units) {
                futures.add(cluster.submit(unit));
            }
        } catch (RuntimeException e) {
            log.warn("Submission failed after {} of {} units; cancelling submitted units", futures.size(), units.size());
            futures.forEach(future -> future.cancel(true));
            throw e;
        }

        // 2. 제출 순서대로 수집 (블로킹)
        List<T> results = new ArrayList<>(futures.size());
        GatherException firstFailure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                if (firstFailure == null) {
                    firstFailure = new GatherException(i, e.getCause());
                }
                results.add(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Gather interrupted after " + i + " of " + futures.size() + " units", e);
            }
        }

        if (firstFailure != null) {
            throw firstFailure;
        }
        return results;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{cluster=" + cluster + "}";
    }
}
