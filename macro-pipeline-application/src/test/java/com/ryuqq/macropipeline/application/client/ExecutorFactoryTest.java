package com.ryuqq.macropipeline.application.client;

import com.ryuqq.macropipeline.adapter.local.cluster.LocalClusterConfig;
import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.ClusterStatus;
import com.ryuqq.macropipeline.core.executor.Executor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutorFactory 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ExecutorFactoryTest {

    @Mock
    private Cluster cluster;

    @TempDir
    Path workerSpaceRoot;

    private Executor created;

    @AfterEach
    void tearDown() {
        if (created != null) {
            created.shutdown();
        }
    }

    @Test
    void create_Cluster가_있으면_ExternalExecutor로_연결() {
        // When
        ClientSetupResult result = ExecutorFactory.create(ClientSetup.attach(cluster));

        // Then
        assertThat(result.isConfigured()).isTrue();
        Executor executor = result.orElseThrow(IllegalStateException::new);
        assertThat(executor).isInstanceOf(ExternalExecutor.class);
        assertThat(executor.getCluster()).isSameAs(cluster);
    }

    @Test
    void create_Cluster가_있으면_mode는_무시() {
        // When
        ClientSetupResult result = ExecutorFactory.create(new ClientSetup(cluster, "distributed", Map.of()));

        // Then
        assertThat(result).isInstanceOf(ClientSetupResult.Configured.class);
    }

    @Test
    void create_local_mode는_옵션으로_LocalExecutor_생성() {
        // Given
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(LocalClusterConfig.WORKER_COUNT, 2);
        options.put(LocalClusterConfig.THREADS_PER_WORKER, 1);
        options.put(LocalClusterConfig.PROCESSES, false);
        options.put(LocalClusterConfig.WORKER_SPACE_ROOT, workerSpaceRoot.toString());

        // When
        ClientSetupResult result = ExecutorFactory.create(ClientSetup.create("local", options));

        // Then
        created = result.orElseThrow(IllegalStateException::new);
        assertThat(created).isInstanceOf(LocalExecutor.class);
        assertThat(created.getStatus()).isEqualTo(ClusterStatus.RUNNING);
        assertThat(((LocalExecutor) created).getCluster().getConfig())
            .isEqualTo(new LocalClusterConfig(2, 1, false, workerSpaceRoot));
    }

    @Test
    void create_지원하지_않는_mode는_Rejected() {
        // When
        ClientSetupResult result = ExecutorFactory.create(ClientSetup.create("distributed", Map.of()));

        // Then
        assertThat(result.isConfigured()).isFalse();
        assertThat(((ClientSetupResult.Rejected) result).reason())
            .contains("'distributed'")
            .contains("supported: local");
    }

    @Test
    void create_알_수_없는_옵션은_Rejected() {
        // When
        ClientSetupResult result = ExecutorFactory.create(ClientSetup.create("local", Map.of("memoryLimit", "4GB")));

        // Then
        assertThat(result).isInstanceOf(ClientSetupResult.Rejected.class);
        assertThat(((ClientSetupResult.Rejected) result).reason())
            .isEqualTo("invalid local cluster options: unknown local cluster option: memoryLimit");
    }

    @Test
    void create_null_설정은_거부() {
        assertThatThrownBy(() -> ExecutorFactory.create(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void attach_null_Cluster는_Rejected() {
        assertThat(ExecutorFactory.attach(null)).isInstanceOf(ClientSetupResult.Rejected.class);
    }

    @Test
    void createLocal_null_설정은_Rejected() {
        assertThat(ExecutorFactory.createLocal(null)).isInstanceOf(ClientSetupResult.Rejected.class);
    }

    @Test
    void orElseThrow_Rejected는_사유로_예외_생성() {
        // Given
        ClientSetupResult result = new ClientSetupResult.Rejected("no cluster");

        // When & Then
        assertThatThrownBy(() -> result.orElseThrow(IllegalStateException::new))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("no cluster");
    }

    @Test
    void ClientSetup_null_mode는_local로_기본값() {
        // When
        ClientSetup setup = ClientSetup.create(null, null);

        // Then
        assertThat(setup.mode()).isEqualTo(ClientSetup.LOCAL_MODE);
        assertThat(setup.options()).isEmpty();
        assertThat(setup.cluster()).isNull();
    }

    @Test
    void ClientSetup_옵션은_방어적으로_복사() {
        // Given
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(LocalClusterConfig.WORKER_COUNT, 2);
        ClientSetup setup = ClientSetup.create("local", options);

        // When
        options.put(LocalClusterConfig.PROCESSES, false);

        // Then
        assertThat(setup.options()).containsOnlyKeys(LocalClusterConfig.WORKER_COUNT);
        assertThatThrownBy(() -> setup.options().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
