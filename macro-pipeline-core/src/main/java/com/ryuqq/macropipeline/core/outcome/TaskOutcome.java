package com.ryuqq.macropipeline.core.outcome;

/**
 * Task 한 건의 실행 결과.
 *
 * <p>성공 여부와 함께, 실패 시 실패한 Operation의 오류 종류와 상세를 담습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>success = true 이면 errorKind, errorDetail 모두 null</li>
 *   <li>success = false 이면 errorKind non-null</li>
 * </ul>
 *
 * @param label Task 라벨 (null이면 빈 문자열)
 * @param success 성공 여부
 * @param errorKind 오류 종류 (성공 시 null)
 * @param errorDetail 오류 상세 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskOutcome(
    String label,
    boolean success,
    Class<? extends Throwable> errorKind,
    String errorDetail
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 성공/실패와 오류 정보 조합이 맞지 않는 경우
     */
    public TaskOutcome {
        label = label == null ? "" : label;
        if (success && (errorKind != null || errorDetail != null)) {
            throw new IllegalArgumentException("successful outcome cannot carry an error (label: " + label + ")");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("failed outcome requires errorKind (label: " + label + ")");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param label Task 라벨
     * @return 성공 TaskOutcome
     */
    public static TaskOutcome completed(String label) {
        return new TaskOutcome(label, true, null, null);
    }

    /**
     * Operation 실패로부터 실패 결과 생성.
     *
     * @param label Task 라벨
     * @param fail 실패한 Operation의 결과
     * @return 실패 TaskOutcome
     * @throws IllegalArgumentException fail이 null인 경우
     */
    public static TaskOutcome failed(String label, Fail fail) {
        if (fail == null) {
            throw new IllegalArgumentException("fail cannot be null");
        }
        return new TaskOutcome(label, false, fail.errorKind(), fail.detail());
    }

    /**
     * 예외로부터 실패 결과 생성.
     *
     * @param label Task 라벨
     * @param error 실패 원인
     * @return 실패 TaskOutcome
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static TaskOutcome failed(String label, Throwable error) {
        return failed(label, Fail.of(error));
    }

    /**
     * 오류 쌍 조회.
     *
     * @return 성공 시 {@link TaskError#none()}, 실패 시 (errorKind, errorDetail)
     */
    public TaskError toError() {
        return success ? TaskError.none() : new TaskError(errorKind, errorDetail);
    }
}
