package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.core.executor.Cluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 호출자가 전달한 Cluster에 연결된 Executor.
 *
 * <p>Cluster의 수명은 호출자가 관리합니다. {@link #shutdown()}은 Cluster를 종료하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExternalExecutor extends ClusterExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalExecutor.class);

    /**
     * 생성자.
     *
     * @param cluster 호출자 소유 Cluster
     * @throws IllegalArgumentException cluster가 null인 경우
     */
    public ExternalExecutor(Cluster cluster) {
        super(cluster);
    }

    @Override
    public void shutdown() {
        log.debug("Detached from external cluster {}; cluster left running", getCluster());
    }
}
