package com.ryuqq.macropipeline.core.executor;

/**
 * 제출한 작업 단위가 결과 대신 예외를 던졌을 때 발생.
 *
 * <p>모든 작업이 끝난 뒤 던져지며, 제출 순서상 가장 앞선 실패를 담습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GatherException extends RuntimeException {

    private final int unitIndex;

    /**
     * 생성자.
     *
     * @param unitIndex 실패한 작업의 제출 인덱스 (0부터)
     * @param cause 작업이 던진 예외
     */
    public GatherException(int unitIndex, Throwable cause) {
        super("unit " + unitIndex + " failed: " + cause, cause);
        this.unitIndex = unitIndex;
    }

    /**
     * 실패한 작업의 제출 인덱스 조회.
     *
     * @return 제출 인덱스 (0부터)
     */
    public int getUnitIndex() {
        return unitIndex;
    }
}
