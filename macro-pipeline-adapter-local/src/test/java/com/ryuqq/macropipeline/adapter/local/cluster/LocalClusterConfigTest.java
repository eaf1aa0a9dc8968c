package com.ryuqq.macropipeline.adapter.local.cluster;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LocalClusterConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LocalClusterConfigTest {

    private static final Path ROOT = Path.of("build", "worker-space");

    @Test
    void defaultConstructor_UsesProcessorsAndTempDir() {
        // When
        LocalClusterConfig config = new LocalClusterConfig();

        // Then
        assertEquals(Runtime.getRuntime().availableProcessors(), config.workerCount());
        assertEquals(1, config.threadsPerWorker());
        assertTrue(config.processes());
        assertEquals(Path.of(System.getProperty("java.io.tmpdir")), config.workerSpaceRoot());
    }

    @Test
    void constructor_ZeroWorkerCount_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new LocalClusterConfig(0, 1, true, ROOT)
        );
        assertTrue(exception.getMessage().contains("workerCount must be positive"));
    }

    @Test
    void constructor_NegativeThreadsPerWorker_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new LocalClusterConfig(1, -1, true, ROOT)
        );
        assertTrue(exception.getMessage().contains("threadsPerWorker must be positive"));
    }

    @Test
    void constructor_NullWorkerSpaceRoot_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new LocalClusterConfig(1, 1, true, null));
    }

    @Test
    void totalThreads_MultipliesWorkersAndThreads() {
        assertEquals(6, new LocalClusterConfig(3, 2, false, ROOT).totalThreads());
    }

    @Test
    void withMethods_ReturnModifiedCopy() {
        // Given
        LocalClusterConfig original = new LocalClusterConfig(1, 1, true, ROOT);

        // When
        LocalClusterConfig modified = original
            .withWorkerCount(4)
            .withThreadsPerWorker(2)
            .withProcesses(false)
            .withWorkerSpaceRoot(Path.of("other"));

        // Then
        assertEquals(new LocalClusterConfig(4, 2, false, Path.of("other")), modified);
        assertEquals(1, original.workerCount());
    }

    @Test
    void fromOptions_NullOrEmpty_ReturnsDefault() {
        assertEquals(new LocalClusterConfig(), LocalClusterConfig.fromOptions(null));
        assertEquals(new LocalClusterConfig(), LocalClusterConfig.fromOptions(Map.of()));
    }

    @Test
    void fromOptions_TypedValues_AreApplied() {
        // Given
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(LocalClusterConfig.WORKER_COUNT, 3);
        options.put(LocalClusterConfig.THREADS_PER_WORKER, 2L);
        options.put(LocalClusterConfig.PROCESSES, false);
        options.put(LocalClusterConfig.WORKER_SPACE_ROOT, ROOT);

        // When
        LocalClusterConfig config = LocalClusterConfig.fromOptions(options);

        // Then
        assertEquals(new LocalClusterConfig(3, 2, false, ROOT), config);
    }

    @Test
    void fromOptions_StringValues_AreParsed() {
        // Given
        Map<String, String> options = Map.of(
            "workerCount", " 2 ",
            "threadsPerWorker", "4",
            "processes", "FALSE",
            "workerSpaceRoot", "build/worker-space"
        );

        // When
        LocalClusterConfig config = LocalClusterConfig.fromOptions(options);

        // Then
        assertEquals(new LocalClusterConfig(2, 4, false, ROOT), config);
    }

    @Test
    void fromOptions_UnknownKey_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> LocalClusterConfig.fromOptions(Map.of("memoryLimit", "4GB"))
        );
        assertEquals("unknown local cluster option: memoryLimit", exception.getMessage());
    }

    @Test
    void fromOptions_NonNumericWorkerCount_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> LocalClusterConfig.fromOptions(Map.of("workerCount", "many"))
        );
        assertTrue(exception.getMessage().contains("workerCount must be an integer"));
        assertInstanceOf(NumberFormatException.class, exception.getCause());
    }

    @Test
    void fromOptions_InvalidBoolean_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> LocalClusterConfig.fromOptions(Map.of("processes", "yes")));
    }

    @Test
    void fromOptions_ZeroWorkerCount_FailsValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> LocalClusterConfig.fromOptions(Map.of("workerCount", 0)));
    }

    @Test
    void fromOptions_FractionalNumber_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> LocalClusterConfig.fromOptions(Map.of("threadsPerWorker", 1.9))
        );
        assertTrue(exception.getMessage().contains("threadsPerWorker must be an integer"));
    }

    @Test
    void fromOptions_LongOutOfIntRange_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> LocalClusterConfig.fromOptions(Map.of("workerCount", 4294967297L))
        );
        assertTrue(exception.getMessage().contains("workerCount must be an integer"));
    }

    @Test
    void fromOptions_IntegralDouble_IsAccepted() {
        assertEquals(3, LocalClusterConfig.fromOptions(Map.of("workerCount", 3.0)).workerCount());
    }

    @Test
    void constructor_TotalThreadsOverflow_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new LocalClusterConfig(65536, 65536, false, ROOT)
        );
        assertTrue(exception.getMessage().contains("exceeds int range"));
        assertInstanceOf(ArithmeticException.class, exception.getCause());
    }

    @Test
    void fromOptions_TotalThreadsOverflow_ThrowsException() {
        // Given
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(LocalClusterConfig.WORKER_COUNT, 65536);
        options.put(LocalClusterConfig.THREADS_PER_WORKER, 65536);
        options.put(LocalClusterConfig.PROCESSES, false);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> LocalClusterConfig.fromOptions(options));
    }
}
