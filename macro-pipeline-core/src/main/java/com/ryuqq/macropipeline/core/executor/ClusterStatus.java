package com.ryuqq.macropipeline.core.executor;

/**
 * Cluster 생명주기 상태.
 *
 * <pre>
 * STARTING ──► RUNNING ──► CLOSING ──► CLOSED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ClusterStatus {

    /**
     * Worker 준비 중.
     */
    STARTING,

    /**
     * 작업 수락 가능.
     */
    RUNNING,

    /**
     * 종료 진행 중 (신규 작업 거부).
     */
    CLOSING,

    /**
     * 종료 완료.
     */
    CLOSED;

    /**
     * 작업을 수락할 수 있는 상태인지 확인.
     *
     * @return RUNNING인 경우 true
     */
    public boolean isAcceptingWork() {
        return this == RUNNING;
    }
}
