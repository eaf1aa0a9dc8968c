package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.adapter.local.cluster.ExecutorServiceCluster;
import com.ryuqq.macropipeline.adapter.local.cluster.LocalCluster;
import com.ryuqq.macropipeline.adapter.local.cluster.LocalClusterConfig;
import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.ClusterStatus;
import com.ryuqq.macropipeline.core.executor.GatherException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ClusterExecutor (ExternalExecutor / LocalExecutor) 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>submitAndGather 결과는 완료 순서와 무관하게 제출 순서</li>
 *   <li>실패한 작업이 있어도 모든 작업 완료 후 GatherException</li>
 *   <li>ExternalExecutor는 외부 Cluster를 닫지 않음</li>
 *   <li>LocalExecutor는 자신이 만든 Cluster를 닫음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ClusterExecutorTest {

    @Mock
    private Cluster mockCluster;

    @Mock
    private Future<Object> submittedFuture;

    @TempDir
    Path workerSpaceRoot;

    private final List<AutoCloseable> resources = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable resource : resources) {
            resource.close();
        }
    }

    // ============================================================
    // 1. submitAndGather
    // ============================================================

    @Test
    void submitAndGather_지연이_달라도_제출_순서로_반환() {
        // Given
        ExternalExecutor executor = new ExternalExecutor(pooledCluster(4));
        List<Callable<Integer>> units = new ArrayList<>();
        long[] delays = {150, 0, 80, 20};
        for (int i = 0; i < delays.length; i++) {
            int index = i;
            long delay = delays[i];
            units.add(() -> {
                Thread.sleep(delay);
                return index;
            });
        }

        // When
        List<Integer> results = executor.submitAndGather(units);

        // Then
        assertThat(results).containsExactly(0, 1, 2, 3);
    }

    @Test
    void submitAndGather_빈_목록은_빈_결과() {
        // Given
        ExternalExecutor executor = new ExternalExecutor(pooledCluster(1));

        // When
        List<String> results = executor.submitAndGather(List.<Callable<String>>of());

        // Then
        assertThat(results).isEmpty();
    }

    @Test
    void submitAndGather_실패는_모든_작업_완료_후_첫_번째_인덱스로_전달() {
        // Given
        ExternalExecutor executor = new ExternalExecutor(pooledCluster(4));
        AtomicBoolean slowUnitFinished = new AtomicBoolean(false);
        List<Callable<String>> units = Arrays.asList(
            () -> "a",
            () -> {
                throw new IOException("bad");
            },
            () -> {
                Thread.sleep(200);
                slowUnitFinished.set(true);
                return "c";
            },
            () -> {
                throw new IllegalStateException("later failure");
            }
        );

        // When
        GatherException exception = catchThrowableOfType(
            () -> executor.submitAndGather(units), GatherException.class);

        // Then
        assertThat(exception).isNotNull();
        assertThat(exception.getUnitIndex()).isEqualTo(1);
        assertThat(exception.getCause()).isInstanceOf(IOException.class).hasMessage("bad");
        assertThat(slowUnitFinished).isTrue();
    }

    @Test
    void submitAndGather_null_작업은_거부() {
        // Given
        ExternalExecutor executor = new ExternalExecutor(pooledCluster(1));

        // When & Then
        assertThatThrownBy(() -> executor.submitAndGather(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.submitAndGather(Arrays.<Callable<String>>asList(() -> "a", null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index: 1");
    }

    @Test
    void submitAndGather_닫힌_Cluster는_IllegalStateException() {
        // Given
        Cluster cluster = pooledCluster(1);
        ExternalExecutor executor = new ExternalExecutor(cluster);
        cluster.close();

        // When & Then
        assertThatThrownBy(() -> executor.submitAndGather(List.<Callable<String>>of(() -> "a")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void submitAndGather_제출_도중_거부되면_이미_제출한_작업을_취소() {
        // Given: 첫 번째 제출은 성공, 두 번째 제출에서 Cluster가 종료됨
        doReturn(submittedFuture)
            .doThrow(new IllegalStateException("cluster closed"))
            .when(mockCluster).submit(any());
        ExternalExecutor executor = new ExternalExecutor(mockCluster);

        // When & Then
        assertThatThrownBy(() -> executor.submitAndGather(List.<Callable<String>>of(() -> "a", () -> "b", () -> "c")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("cluster closed");
        verify(submittedFuture).cancel(true);
        verify(mockCluster, times(2)).submit(any());
    }

    @Test
    void submitAndGather_null_작업이_있으면_아무것도_제출하지_않음() {
        // Given
        ExternalExecutor executor = new ExternalExecutor(mockCluster);

        // When & Then
        assertThatThrownBy(() -> executor.submitAndGather(Arrays.<Callable<String>>asList(() -> "a", null)))
            .isInstanceOf(IllegalArgumentException.class);
        verify(mockCluster, never()).submit(any());
    }

    // ============================================================
    // 2. ExternalExecutor
    // ============================================================

    @Test
    void ExternalExecutor_상태는_Cluster_상태를_따름() {
        // Given
        when(mockCluster.getStatus()).thenReturn(ClusterStatus.CLOSING);
        ExternalExecutor executor = new ExternalExecutor(mockCluster);

        // When & Then
        assertThat(executor.getStatus()).isEqualTo(ClusterStatus.CLOSING);
        assertThat(executor.getCluster()).isSameAs(mockCluster);
    }

    @Test
    void ExternalExecutor_shutdown은_외부_Cluster를_닫지_않음() {
        // Given
        ExternalExecutor executor = new ExternalExecutor(mockCluster);

        // When
        executor.shutdown();

        // Then
        verify(mockCluster, never()).close();
    }

    @Test
    void ExternalExecutor_null_Cluster는_거부() {
        assertThatThrownBy(() -> new ExternalExecutor(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cluster cannot be null");
    }

    // ============================================================
    // 3. LocalExecutor
    // ============================================================

    @Test
    void LocalExecutor_start_후_RUNNING_shutdown_후_CLOSED() {
        // Given
        LocalExecutor executor = LocalExecutor.start(new LocalClusterConfig(2, 1, true, workerSpaceRoot));
        LocalCluster cluster = executor.getCluster();

        // Then
        assertThat(executor.getStatus()).isEqualTo(ClusterStatus.RUNNING);
        assertThat(executor.submitAndGather(List.<Callable<String>>of(() -> "x", () -> "y")))
            .containsExactly("x", "y");

        // When
        executor.shutdown();
        executor.shutdown();

        // Then
        assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.CLOSED);
        assertThat(cluster.getWorkerSpace()).doesNotExist();
    }

    private Cluster pooledCluster(int threads) {
        Cluster cluster = new ExecutorServiceCluster(Executors.newFixedThreadPool(threads));
        resources.add(cluster);
        return cluster;
    }
}
