package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.core.executor.Executor;

import java.util.function.Function;

/**
 * client 구성 결과.
 *
 * <ul>
 *   <li>{@link Configured}: Executor 생성 성공</li>
 *   <li>{@link Rejected}: 지원하지 않는 모드 또는 잘못된 옵션</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ClientSetupResult {

    /**
     * 성공 여부 확인.
     *
     * @return Configured인 경우 true
     */
    default boolean isConfigured() {
        return this instanceof Configured;
    }

    /**
     * Executor 조회, 실패 시 예외 변환.
     *
     * @param exceptionFactory 거절 사유 → 던질 예외
     * @param <X> 예외 타입
     * @return 생성된 Executor
     * @throws X Rejected인 경우
     */
    default <X extends RuntimeException> Executor orElseThrow(Function<String, X> exceptionFactory) {
        if (this instanceof Configured configured) {
            return configured.executor();
        }
        throw exceptionFactory.apply(((Rejected) this).reason());
    }

    /**
     * 성공 결과.
     *
     * @param executor 생성된 Executor
     */
    record Configured(Executor executor) implements ClientSetupResult {

        public Configured {
            if (executor == null) {
                throw new IllegalArgumentException("executor cannot be null");
            }
        }
    }

    /**
     * 거절 결과.
     *
     * @param reason 거절 사유
     */
    record Rejected(String reason) implements ClientSetupResult {

        public Rejected {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }
}
