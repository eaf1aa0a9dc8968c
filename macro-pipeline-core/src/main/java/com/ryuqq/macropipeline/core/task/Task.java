package com.ryuqq.macropipeline.core.task;

import com.ryuqq.macropipeline.core.outcome.TaskOutcome;

/**
 * 독립적으로 실행 가능한 작업 단위.
 *
 * <p>MacroPipeline은 이 계약에만 의존합니다. 구현 방식(파일 I/O, 외부 호출 등)은 알지 못합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #run()}은 실패를 예외로 던지지 않고 {@link TaskOutcome}으로 반환해야 합니다.</li>
 *   <li>라벨은 식별 보조용이며 고유할 필요가 없습니다.</li>
 *   <li>실행 중에는 외부에서 Task를 변경하지 않습니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Task {

    /**
     * 라벨 조회.
     *
     * @return 라벨 (non-null, 기본값 빈 문자열)
     */
    String getLabel();

    /**
     * 라벨 지정.
     *
     * @param label 라벨 (고유성 검사 없음)
     */
    void setLabel(String label);

    /**
     * Task 실행.
     *
     * @return 실행 결과 (라벨, 성공 여부, 실패 시 오류 종류/상세)
     */
    TaskOutcome run();
}
