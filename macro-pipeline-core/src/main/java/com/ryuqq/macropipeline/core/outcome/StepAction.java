package com.ryuqq.macropipeline.core.outcome;

/**
 * 검사 예외를 던질 수 있는 단일 동작.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see StepResult#attempt(StepAction)
 */
@FunctionalInterface
public interface StepAction {

    /**
     * 동작 실행.
     *
     * @throws Exception 동작 실패 시
     */
    void run() throws Exception;
}
