package com.ryuqq.macropipeline.testkit.contract;

import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.ClusterStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Cluster 구현체 공통 계약 테스트.
 *
 * <p>구현 모듈은 이 클래스를 상속하고 {@link #createCluster()}만 구현합니다.
 * 생성되는 Cluster는 최소 2개의 작업을 동시에 실행할 수 있어야 합니다.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class LocalClusterContractTest extends AbstractClusterContractTest {
 *     {@literal @}Override
 *     protected Cluster createCluster() {
 *         return LocalCluster.start(new LocalClusterConfig(2, 1, true, root));
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractClusterContractTest {

    protected Cluster cluster;

    /**
     * 테스트 대상 Cluster 생성 (RUNNING 상태, 동시 실행 2 이상).
     *
     * @return 새 Cluster
     */
    protected abstract Cluster createCluster();

    @BeforeEach
    void setUpCluster() {
        cluster = createCluster();
    }

    @AfterEach
    void tearDownCluster() {
        if (cluster != null) {
            cluster.close();
        }
    }

    @Test
    void 생성된_Cluster는_RUNNING_상태() {
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.RUNNING);
    }

    @Test
    void 제출한_작업의_결과를_Future로_반환() throws Exception {
        // When
        Future<String> future = cluster.submit(() -> "done");

        // Then
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("done");
    }

    @Test
    void 작업_예외는_Future에_담겨_전달() {
        // When
        Future<String> future = cluster.submit(() -> {
            throw new IllegalStateException("boom");
        });

        // Then
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.RUNNING);
    }

    @Test
    void 두_작업이_동시에_실행됨() throws Exception {
        // Given: 두 작업이 서로를 기다림 (동시 실행이 아니면 타임아웃)
        CountDownLatch bothStarted = new CountDownLatch(2);
        List<Future<Boolean>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 2; i++) {
            futures.add(cluster.submit(() -> {
                bothStarted.countDown();
                return bothStarted.await(5, TimeUnit.SECONDS);
            }));
        }

        // Then
        for (Future<Boolean> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void close_후_CLOSED_상태() {
        // When
        cluster.close();

        // Then
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.CLOSED);
    }

    @Test
    void close_는_진행_중인_작업_완료를_기다림() throws Exception {
        // Given
        Future<String> future = cluster.submit(() -> {
            Thread.sleep(200);
            return "finished";
        });

        // When
        cluster.close();

        // Then
        assertThat(future.isDone()).isTrue();
        assertThat(future.get()).isEqualTo("finished");
    }

    @Test
    void close_는_여러_번_호출해도_안전() {
        // When
        cluster.close();
        cluster.close();

        // Then
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.CLOSED);
    }

    @Test
    void close_후_제출은_거부() {
        // Given
        cluster.close();

        // When & Then
        assertThatThrownBy(() -> cluster.submit(() -> "late"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void null_작업_제출은_거부() {
        assertThatThrownBy(() -> cluster.submit(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
