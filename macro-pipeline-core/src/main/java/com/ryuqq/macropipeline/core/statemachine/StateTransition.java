package com.ryuqq.macropipeline.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 MacroPipeline의 상태 전이가 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>UNCONFIGURED → CLIENT_CONFIGURED</li>
 *   <li>CLIENT_CONFIGURED → CLIENT_CONFIGURED (client 교체)</li>
 *   <li>CLIENT_CONFIGURED → RUNNING</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → CLIENT_CONFIGURED (실행 중단)</li>
 *   <li>COMPLETED → RUNNING (재실행)</li>
 *   <li>COMPLETED → CLIENT_CONFIGURED (client 교체)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(PipelineState from, PipelineState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case UNCONFIGURED -> to == PipelineState.CLIENT_CONFIGURED;
            case CLIENT_CONFIGURED -> to == PipelineState.CLIENT_CONFIGURED || to == PipelineState.RUNNING;
            case RUNNING -> to == PipelineState.COMPLETED || to == PipelineState.CLIENT_CONFIGURED;
            case COMPLETED -> to == PipelineState.RUNNING || to == PipelineState.CLIENT_CONFIGURED;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static PipelineState transition(PipelineState current, PipelineState next) {
        validate(current, next);
        return next;
    }
}
