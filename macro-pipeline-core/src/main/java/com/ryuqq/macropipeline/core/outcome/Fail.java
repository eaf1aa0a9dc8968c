package com.ryuqq.macropipeline.core.outcome;

/**
 * 실패 결과.
 *
 * <p>Operation이 실패했음을 나타냅니다. Pipeline은 첫 번째 Fail에서 실행을 멈추고,
 * 이미 완료된 Operation의 부수 효과는 되돌리지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>디렉토리 경로에 파일 쓰기 시도 ({@code FileSystemException})</li>
 *   <li>존재하지 않는 입력 파일 ({@code NoSuchFileException})</li>
 *   <li>잘못된 인자 타입 ({@code IllegalArgumentException})</li>
 * </ul>
 *
 * @param errorKind 오류 종류 (실패를 일으킨 예외 타입)
 * @param detail 오류 상세 (예외 메시지, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    Class<? extends Throwable> errorKind,
    String detail
) implements StepResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorKind가 null인 경우
     */
    public Fail {
        if (errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null");
        }
        // detail은 null 허용 (메시지 없는 예외)
    }

    /**
     * 예외로부터 Fail 생성.
     *
     * @param error 실패 원인
     * @return Fail 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Fail of(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Fail(error.getClass(), error.getMessage());
    }

    /**
     * 오류 종류와 상세로 Fail 생성.
     *
     * @param errorKind 오류 종류
     * @param detail 오류 상세
     * @return Fail 인스턴스
     * @throws IllegalArgumentException errorKind가 null인 경우
     */
    public static Fail of(Class<? extends Throwable> errorKind, String detail) {
        return new Fail(errorKind, detail);
    }
}
