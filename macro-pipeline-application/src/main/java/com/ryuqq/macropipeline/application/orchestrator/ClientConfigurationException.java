package com.ryuqq.macropipeline.application.orchestrator;

/**
 * client 구성 오류.
 *
 * <p>지원하지 않는 모드나 잘못된 옵션으로 {@code setupClient}를 호출했을 때 즉시 발생합니다.
 * 병렬 작업이 시작되기 전에 실패하며, 내부에서 복구하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ClientConfigurationException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지 (잘못된 모드/옵션 포함)
     */
    public ClientConfigurationException(String message) {
        super(message);
    }
}
