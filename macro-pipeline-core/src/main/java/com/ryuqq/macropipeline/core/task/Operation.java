package com.ryuqq.macropipeline.core.task;

import com.ryuqq.macropipeline.core.outcome.StepResult;

/**
 * Pipeline을 구성하는 이름 붙은 단일 동작.
 *
 * <p>인자는 Pipeline 입력 매핑의 값이 그대로 전달됩니다.
 * 실패는 {@link com.ryuqq.macropipeline.core.outcome.Fail}로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation {

    /**
     * 동작 실행.
     *
     * @param argument 입력 매핑에 지정된 인자 (null 가능)
     * @return 실행 결과
     */
    StepResult apply(Object argument);
}
