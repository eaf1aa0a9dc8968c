package com.ryuqq.macropipeline.application.orchestrator;

import com.ryuqq.macropipeline.core.outcome.TaskOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * 실행 결과 리포트 포맷터.
 *
 * <p>Task 순서대로 한 줄씩 출력하며, 각 줄의 마지막 토큰이 상태입니다.</p>
 *
 * <pre>
 * 001 file_a Completed
 * 002 file_b Failed(FileSystemException)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OutcomeReport {

    /** 성공 상태 토큰. */
    public static final String COMPLETED = "Completed";

    private static final String NO_LABEL = "-";

    private OutcomeReport() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 리포트 줄 생성.
     *
     * @param outcomes Task 순서의 실행 결과
     * @return 결과당 한 줄
     */
    public static List<String> render(List<TaskOutcome> outcomes) {
        List<String> lines = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            TaskOutcome outcome = outcomes.get(i);
            String label = outcome.label().isBlank() ? NO_LABEL : outcome.label();
            lines.add(String.format("%03d %s %s", i + 1, label, status(outcome)));
        }
        return lines;
    }

    /**
     * 상태 토큰.
     *
     * @param outcome 실행 결과
     * @return 성공 시 {@value #COMPLETED}, 실패 시 {@code Failed(<오류 종류>)}
     */
    public static String status(TaskOutcome outcome) {
        if (outcome.success()) {
            return COMPLETED;
        }
        return "Failed(" + outcome.errorKind().getSimpleName() + ")";
    }
}
