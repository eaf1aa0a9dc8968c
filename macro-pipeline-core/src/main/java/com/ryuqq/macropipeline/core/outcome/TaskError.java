package com.ryuqq.macropipeline.core.outcome;

/**
 * Task 실행 오류 쌍 (오류 종류, 오류 상세).
 *
 * <p>{@code (null, null)}은 성공을 의미합니다. 오류 종류 없이 상세만 있는 조합은 허용하지 않습니다.</p>
 *
 * @param errorKind 오류 종류 (성공 시 null)
 * @param errorDetail 오류 상세 (성공 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskError(
    Class<? extends Throwable> errorKind,
    String errorDetail
) {

    private static final TaskError NONE = new TaskError(null, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorKind 없이 errorDetail만 지정된 경우
     */
    public TaskError {
        if (errorKind == null && errorDetail != null) {
            throw new IllegalArgumentException("errorDetail requires errorKind (detail: " + errorDetail + ")");
        }
    }

    /**
     * 성공을 나타내는 오류 쌍 {@code (null, null)}.
     *
     * @return 빈 TaskError
     */
    public static TaskError none() {
        return NONE;
    }

    /**
     * 오류가 없는지 확인.
     *
     * @return {@code (null, null)}인 경우 true
     */
    public boolean isNone() {
        return errorKind == null;
    }
}
