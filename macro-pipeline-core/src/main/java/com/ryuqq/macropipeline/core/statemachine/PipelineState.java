package com.ryuqq.macropipeline.core.statemachine;

/**
 * MacroPipeline 인스턴스의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNCONFIGURED
 *    │
 *    ▼ (setupClient)
 * CLIENT_CONFIGURED ◄──────────────┐
 *    │                             │ (setupClient / 실행 중단)
 *    ▼ (run)                       │
 * RUNNING ─────────────────────────┤
 *    │                             │
 *    ▼ (모든 작업 완료)            │
 * COMPLETED ───────────────────────┘
 *    │
 *    └─► RUNNING (재실행, 결과 전체 교체)
 *
 * 금지된 전이:
 * - UNCONFIGURED → RUNNING ❌ (client 미설정)
 * - UNCONFIGURED → COMPLETED ❌
 * - CLIENT_CONFIGURED → COMPLETED ❌
 * - RUNNING → RUNNING ❌ (중첩 실행)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PipelineState {

    /**
     * client 미설정.
     */
    UNCONFIGURED,

    /**
     * client 설정 완료, 실행 가능.
     */
    CLIENT_CONFIGURED,

    /**
     * 작업 실행 중.
     */
    RUNNING,

    /**
     * 실행 완료, 결과 조회 가능.
     */
    COMPLETED;

    /**
     * 실행 결과가 존재하는 상태인지 확인.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean hasResults() {
        return this == COMPLETED;
    }

    /**
     * run() 호출이 가능한 상태인지 확인.
     *
     * @return CLIENT_CONFIGURED 또는 COMPLETED인 경우 true
     */
    public boolean isReadyToRun() {
        return this == CLIENT_CONFIGURED || this == COMPLETED;
    }
}
