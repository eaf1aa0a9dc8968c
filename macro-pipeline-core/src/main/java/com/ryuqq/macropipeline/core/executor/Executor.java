package com.ryuqq.macropipeline.core.executor;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Cluster 위의 "제출 후 수집" 실행자.
 *
 * <p>Cluster가 호출자로부터 전달되었는지, 로컬에서 생성되었는지와 무관하게
 * 동일한 병렬 실행 기능을 제공합니다.</p>
 *
 * <p><strong>순서 보장:</strong> {@link #submitAndGather(List)}의 결과 순서는
 * worker의 완료 순서가 아니라 제출 순서를 따릅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;Callable&lt;TaskOutcome&gt;&gt; units = tasks.stream()
 *     .map(task -&gt; (Callable&lt;TaskOutcome&gt;) task::run)
 *     .toList();
 * List&lt;TaskOutcome&gt; outcomes = executor.submitAndGather(units); // 블로킹
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Executor {

    /**
     * 하위 Cluster 상태 조회.
     *
     * @return Cluster 상태
     */
    ClusterStatus getStatus();

    /**
     * 하위 Cluster 조회.
     *
     * @return Cluster (non-null)
     */
    Cluster getCluster();

    /**
     * 작업 단위를 모두 제출하고 결과를 제출 순서대로 수집.
     *
     * <p>모든 작업이 끝날 때까지 호출 스레드를 블로킹합니다.
     * 일부 작업이 예외를 던져도 나머지 작업의 완료를 기다린 뒤,
     * 제출 순서상 가장 앞선 실패를 담은 {@link GatherException}을 던집니다.</p>
     *
     * @param units 실행할 작업 목록
     * @param <T> 결과 타입
     * @return 제출 순서와 같은 순서의 결과 목록
     * @throws IllegalArgumentException units가 null이거나 null 원소를 포함한 경우
     * @throws GatherException 작업 중 하나 이상이 예외를 던진 경우
     * @throws IllegalStateException 수집 대기 중 인터럽트 발생 시
     */
    <T> List<T> submitAndGather(List<? extends Callable<? extends T>> units);

    /**
     * 실행자 종료.
     *
     * <p>실행자가 직접 생성한 Cluster만 종료합니다. 외부에서 전달받은 Cluster는 그대로 둡니다.</p>
     */
    void shutdown();
}
