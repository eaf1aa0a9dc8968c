package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.adapter.local.cluster.LocalCluster;
import com.ryuqq.macropipeline.adapter.local.cluster.LocalClusterConfig;

/**
 * 직접 생성한 {@link LocalCluster}를 소유하는 Executor.
 *
 * <p>{@link #shutdown()}은 소유한 Cluster를 종료하고 worker 작업 디렉토리를 삭제합니다.
 * 자동 종료는 없으므로 호출자가 명시적으로 shutdown()을 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LocalExecutor extends ClusterExecutor {

    private final LocalCluster localCluster;

    private LocalExecutor(LocalCluster localCluster) {
        super(localCluster);
        this.localCluster = localCluster;
    }

    /**
     * 로컬 Cluster를 생성하고 RUNNING 상태가 된 뒤 반환.
     *
     * @param config Cluster 설정
     * @return LocalExecutor
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static LocalExecutor start(LocalClusterConfig config) {
        return new LocalExecutor(LocalCluster.start(config));
    }

    @Override
    public LocalCluster getCluster() {
        return localCluster;
    }

    @Override
    public void shutdown() {
        localCluster.close();
    }
}
