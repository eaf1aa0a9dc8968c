package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.adapter.local.cluster.LocalClusterConfig;
import com.ryuqq.macropipeline.core.executor.Cluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

/**
 * client 구성 요청으로부터 Executor 생성.
 *
 * <p><strong>분기 규칙:</strong></p>
 * <ol>
 *   <li>cluster 지정 → {@link ExternalExecutor} (mode/options 무시)</li>
 *   <li>mode = "local" → options로 {@link LocalExecutor} 생성</li>
 *   <li>그 외 → {@link ClientSetupResult.Rejected} (모드 이름 포함)</li>
 * </ol>
 *
 * <p>예외를 던지지 않고 결과 객체로 반환합니다. 호출자가 거절을 자신의 예외로 변환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorFactory {

    private static final Logger log = LoggerFactory.getLogger(ExecutorFactory.class);

    // Utility class - prevent instantiation
    private ExecutorFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 구성 요청 처리.
     *
     * @param setup 구성 요청
     * @return Configured 또는 Rejected
     * @throws IllegalArgumentException setup이 null인 경우
     */
    public static ClientSetupResult create(ClientSetup setup) {
        if (setup == null) {
            throw new IllegalArgumentException("setup cannot be null");
        }
        if (setup.cluster() != null) {
            return attach(setup.cluster());
        }
        if (!ClientSetup.LOCAL_MODE.equals(setup.mode())) {
            return new ClientSetupResult.Rejected(
                "unsupported client mode '" + setup.mode() + "' (supported: " + ClientSetup.LOCAL_MODE + ")");
        }

        LocalClusterConfig config;
        try {
            config = LocalClusterConfig.fromOptions(setup.options());
        } catch (IllegalArgumentException e) {
            return new ClientSetupResult.Rejected("invalid local cluster options: " + e.getMessage());
        }
        return createLocal(config);
    }

    /**
     * 기존 Cluster에 연결.
     *
     * @param cluster 호출자 소유 Cluster
     * @return Configured(ExternalExecutor) 또는 Rejected (cluster가 null인 경우)
     */
    public static ClientSetupResult attach(Cluster cluster) {
        if (cluster == null) {
            return new ClientSetupResult.Rejected("cluster cannot be null");
        }
        log.info("Attaching to external cluster {} (status: {})", cluster, cluster.getStatus());
        return new ClientSetupResult.Configured(new ExternalExecutor(cluster));
    }

    /**
     * 새 로컬 Cluster 생성.
     *
     * @param config Cluster 설정
     * @return Configured(LocalExecutor) 또는 Rejected (config가 null이거나 Cluster 시작에 실패한 경우)
     */
    public static ClientSetupResult createLocal(LocalClusterConfig config) {
        if (config == null) {
            return new ClientSetupResult.Rejected("local cluster config cannot be null");
        }
        try {
            return new ClientSetupResult.Configured(LocalExecutor.start(config));
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.warn("Failed to start local cluster with {}", config, e);
            return new ClientSetupResult.Rejected("failed to start local cluster: " + e.getMessage());
        }
    }
}
