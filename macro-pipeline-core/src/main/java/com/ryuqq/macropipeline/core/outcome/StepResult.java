package com.ryuqq.macropipeline.core.outcome;

/**
 * Pipeline 개별 Operation의 실행 결과.
 *
 * <p>StepResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Fail}: 실패, 이후 Operation은 실행되지 않음</li>
 * </ul>
 *
 * <p>Operation은 예외를 던지는 대신 StepResult를 반환합니다.
 * Pipeline은 첫 번째 {@link Fail}을 {@link TaskOutcome}으로 집계합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StepResult result = StepResult.attempt(() -&gt; writer.write(text));
 * if (result instanceof Fail fail) {
 *     log.warn("write failed: {}", fail.errorKind().getSimpleName());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StepResult permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 메시지 없는 성공 결과.
     *
     * @return Ok 인스턴스
     */
    static StepResult ok() {
        return Ok.of();
    }

    /**
     * 예외로부터 실패 결과 생성.
     *
     * @param error 실패 원인
     * @return Fail 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static StepResult fail(Throwable error) {
        return Fail.of(error);
    }

    /**
     * 동작을 실행하고 결과를 StepResult로 변환.
     *
     * <p>동작이 정상 종료되면 {@link Ok}, 예외를 던지면 해당 예외를 담은 {@link Fail}을 반환합니다.
     * {@link Error}는 변환하지 않고 그대로 전파합니다.</p>
     *
     * @param action 실행할 동작
     * @return 실행 결과
     * @throws IllegalArgumentException action이 null인 경우
     */
    static StepResult attempt(StepAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try {
            action.run();
            return ok();
        } catch (Exception e) {
            return fail(e);
        }
    }
}
