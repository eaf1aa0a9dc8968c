package com.ryuqq.macropipeline.testkit.task;

import com.ryuqq.macropipeline.core.outcome.TaskOutcome;
import com.ryuqq.macropipeline.core.task.Task;

import java.util.Queue;

/**
 * 지정 시간 대기 후 완료되는 Task.
 *
 * <p>완료 시 자신의 라벨을 {@code completionOrder}에 추가하므로,
 * 실제 완료 순서와 결과 저장 순서를 비교할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SleepingTask implements Task {

    private final long sleepMillis;
    private final Queue<String> completionOrder;
    private String label;

    /**
     * 생성자.
     *
     * @param label 라벨
     * @param sleepMillis 대기 시간 (밀리초)
     * @param completionOrder 완료 순서 기록용 thread-safe 큐
     */
    public SleepingTask(String label, long sleepMillis, Queue<String> completionOrder) {
        this.label = label;
        this.sleepMillis = sleepMillis;
        this.completionOrder = completionOrder;
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
        try {
            Thread.sleep(sleepMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failed(label, e);
        }
        completionOrder.add(label);
        return TaskOutcome.completed(label);
    }
}
