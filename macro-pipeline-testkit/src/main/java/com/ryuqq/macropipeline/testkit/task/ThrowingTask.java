package com.ryuqq.macropipeline.testkit.task;

import com.ryuqq.macropipeline.core.outcome.TaskOutcome;
import com.ryuqq.macropipeline.core.task.Task;

/**
 * 결과를 반환하지 않고 예외를 던지는 Task (계약 위반 구현 시뮬레이션).
 *
 * <p>checked 예외도 선언 없이 그대로 던지므로, 다른 JVM 언어로 작성되었거나
 * 리플렉션으로 호출되는 Task의 동작을 재현할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ThrowingTask implements Task {

    private final Throwable error;
    private String label = "";

    /**
     * 생성자.
     *
     * @param error run() 호출 시 던질 예외 (checked 예외, Error 포함)
     * @throws IllegalArgumentException error가 null인 경우
     */
    public ThrowingTask(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        this.error = error;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public void setLabel(String label) {
        this.label = label;
    }

    @Override
    public TaskOutcome run() {
        throw ThrowingTask.<RuntimeException>propagate(error);
    }

    @SuppressWarnings("unchecked")
    private static <X extends Throwable> X propagate(Throwable error) throws X {
        throw (X) error;
    }
}
