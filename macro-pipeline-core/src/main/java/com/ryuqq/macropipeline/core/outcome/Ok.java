package com.ryuqq.macropipeline.core.outcome;

/**
 * 성공 결과.
 *
 * <p>Operation이 성공적으로 완료되었음을 나타냅니다.</p>
 *
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    String message
) implements StepResult {

    private static final Ok EMPTY = new Ok(null);

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @return Ok 인스턴스
     */
    public static Ok of() {
        return EMPTY;
    }

    /**
     * 메시지를 포함한 성공 결과 생성.
     *
     * @param message 성공 메시지
     * @return Ok 인스턴스
     */
    public static Ok of(String message) {
        return new Ok(message);
    }
}
