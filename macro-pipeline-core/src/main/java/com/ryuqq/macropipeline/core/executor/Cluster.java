package com.ryuqq.macropipeline.core.executor;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * 작업 단위를 병렬 실행하는 compute worker 풀.
 *
 * <p><strong>소유권:</strong> Cluster를 생성한 쪽이 {@link #close()} 책임을 집니다.
 * 외부에서 전달받은 Cluster는 MacroPipeline이 종료하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Cluster extends AutoCloseable {

    /**
     * 현재 상태 조회.
     *
     * @return Cluster 상태
     */
    ClusterStatus getStatus();

    /**
     * 작업 단위 제출 (비블로킹).
     *
     * @param unit 실행할 작업
     * @param <T> 결과 타입
     * @return 결과 Future
     * @throws IllegalArgumentException unit이 null인 경우
     * @throws IllegalStateException Cluster가 RUNNING 상태가 아닌 경우
     */
    <T> Future<T> submit(Callable<T> unit);

    /**
     * Cluster 종료.
     *
     * <p>진행 중인 작업이 끝나기를 기다린 뒤 자원을 해제합니다. 여러 번 호출해도 안전합니다.</p>
     */
    @Override
    void close();
}
