package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.core.executor.Cluster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * client 구성 요청.
 *
 * <p>cluster가 지정되면 mode와 options는 무시하고 해당 Cluster에 연결합니다.
 * 그렇지 않으면 mode에 따라 새 Cluster를 생성합니다. mode가 null이면 {@link #LOCAL_MODE}입니다.</p>
 *
 * @param cluster 연결할 기존 Cluster (null 가능)
 * @param mode 실행 모드 (기본 {@link #LOCAL_MODE})
 * @param options 모드별 옵션 (읽기 전용 사본)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ClientSetup(
    Cluster cluster,
    String mode,
    Map<String, Object> options
) {

    /** 로컬 Cluster 생성 모드. */
    public static final String LOCAL_MODE = "local";

    /**
     * Compact Constructor.
     */
    public ClientSetup {
        mode = mode == null ? LOCAL_MODE : mode;
        options = options == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /**
     * 기존 Cluster 연결 요청.
     *
     * @param cluster 연결할 Cluster
     * @return ClientSetup
     */
    public static ClientSetup attach(Cluster cluster) {
        return new ClientSetup(cluster, LOCAL_MODE, Map.of());
    }

    /**
     * 모드 기반 생성 요청.
     *
     * @param mode 실행 모드
     * @param options 모드별 옵션
     * @return ClientSetup
     */
    public static ClientSetup create(String mode, Map<String, ?> options) {
        return new ClientSetup(null, mode, options == null ? null : new LinkedHashMap<String, Object>(options));
    }
}
