package com.ryuqq.macropipeline.adapter.local.cluster;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Map;

/**
 * LocalCluster 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: worker 수 (기본값: 사용 가능한 프로세서 수)</li>
 *   <li>threadsPerWorker: worker당 스레드 수 (기본 1)</li>
 *   <li>processes: worker 격리 여부 (기본 true)</li>
 *   <li>workerSpaceRoot: worker 작업 디렉토리의 상위 경로 (기본: java.io.tmpdir)</li>
 * </ul>
 *
 * <p><strong>processes 모드:</strong></p>
 * <ul>
 *   <li>true: worker마다 독립된 스레드 풀 (threadsPerWorker개), 작업은 round-robin 배정</li>
 *   <li>false: 하나의 공유 스레드 풀 (workerCount × threadsPerWorker개)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param workerCount worker 수 (1 이상이어야 함)
 * @param threadsPerWorker worker당 스레드 수 (1 이상이어야 함)
 * @param processes worker 격리 여부
 * @param workerSpaceRoot worker 작업 디렉토리의 상위 경로 (non-null)
 */
public record LocalClusterConfig(
    int workerCount,
    int threadsPerWorker,
    boolean processes,
    Path workerSpaceRoot
) {

    /** {@link #fromOptions(Map)} 옵션 키: worker 수. */
    public static final String WORKER_COUNT = "workerCount";

    /** {@link #fromOptions(Map)} 옵션 키: worker당 스레드 수. */
    public static final String THREADS_PER_WORKER = "threadsPerWorker";

    /** {@link #fromOptions(Map)} 옵션 키: worker 격리 여부. */
    public static final String PROCESSES = "processes";

    /** {@link #fromOptions(Map)} 옵션 키: worker 작업 디렉토리의 상위 경로. */
    public static final String WORKER_SPACE_ROOT = "workerSpaceRoot";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=availableProcessors, threadsPerWorker=1, processes=true,
     * workerSpaceRoot=java.io.tmpdir</p>
     */
    public LocalClusterConfig() {
        this(Runtime.getRuntime().availableProcessors(), 1, true, defaultWorkerSpaceRoot());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LocalClusterConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
        if (threadsPerWorker <= 0) {
            throw new IllegalArgumentException(
                "threadsPerWorker must be positive (current: " + threadsPerWorker + ")"
            );
        }
        try {
            Math.multiplyExact(workerCount, threadsPerWorker);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                "workerCount × threadsPerWorker exceeds int range (current: " + workerCount + " × " + threadsPerWorker + ")", e
            );
        }
        if (workerSpaceRoot == null) {
            throw new IllegalArgumentException("workerSpaceRoot cannot be null");
        }
    }

    /**
     * 키워드 옵션에서 설정 생성.
     *
     * <p>지정하지 않은 항목은 기본값을 사용합니다.
     * 정수 항목은 {@link Number} 또는 숫자 문자열, processes는 {@link Boolean} 또는 문자열,
     * workerSpaceRoot는 {@link Path} 또는 문자열을 받습니다.</p>
     *
     * @param options 옵션 (키: {@link #WORKER_COUNT}, {@link #THREADS_PER_WORKER},
     *                {@link #PROCESSES}, {@link #WORKER_SPACE_ROOT})
     * @return LocalClusterConfig
     * @throws IllegalArgumentException 알 수 없는 키이거나 값의 타입/범위가 잘못된 경우
     */
    public static LocalClusterConfig fromOptions(Map<String, ?> options) {
        LocalClusterConfig config = new LocalClusterConfig();
        if (options == null) {
            return config;
        }
        for (Map.Entry<String, ?> option : options.entrySet()) {
            String key = option.getKey();
            Object value = option.getValue();
            if (WORKER_COUNT.equals(key)) {
                config = config.withWorkerCount(toInt(key, value));
            } else if (THREADS_PER_WORKER.equals(key)) {
                config = config.withThreadsPerWorker(toInt(key, value));
            } else if (PROCESSES.equals(key)) {
                config = config.withProcesses(toBoolean(key, value));
            } else if (WORKER_SPACE_ROOT.equals(key)) {
                config = config.withWorkerSpaceRoot(toPath(key, value));
            } else {
                throw new IllegalArgumentException("unknown local cluster option: " + key);
            }
        }
        return config;
    }

    /**
     * 총 스레드 수.
     *
     * @return workerCount × threadsPerWorker
     */
    public int totalThreads() {
        return Math.multiplyExact(workerCount, threadsPerWorker);
    }

    /**
     * workerCount만 변경한 새 인스턴스 생성.
     */
    public LocalClusterConfig withWorkerCount(int workerCount) {
        return new LocalClusterConfig(workerCount, threadsPerWorker, processes, workerSpaceRoot);
    }

    /**
     * threadsPerWorker만 변경한 새 인스턴스 생성.
     */
    public LocalClusterConfig withThreadsPerWorker(int threadsPerWorker) {
        return new LocalClusterConfig(workerCount, threadsPerWorker, processes, workerSpaceRoot);
    }

    /**
     * processes만 변경한 새 인스턴스 생성.
     */
    public LocalClusterConfig withProcesses(boolean processes) {
        return new LocalClusterConfig(workerCount, threadsPerWorker, processes, workerSpaceRoot);
    }

    /**
     * workerSpaceRoot만 변경한 새 인스턴스 생성.
     */
    public LocalClusterConfig withWorkerSpaceRoot(Path workerSpaceRoot) {
        return new LocalClusterConfig(workerCount, threadsPerWorker, processes, workerSpaceRoot);
    }

    private static Path defaultWorkerSpaceRoot() {
        return Path.of(System.getProperty("java.io.tmpdir"));
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number number) {
            // 소수부가 있거나 int 범위를 벗어나면 거부
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer (current: " + number + ")", e);
            }
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer (current: " + text + ")", e);
            }
        }
        throw new IllegalArgumentException(key + " must be an integer (current: " + value + ")");
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(key + " must be a boolean (current: " + value + ")");
    }

    private static Path toPath(String key, Object value) {
        if (value instanceof Path path) {
            return path;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Path.of(text);
        }
        throw new IllegalArgumentException(key + " must be a path (current: " + value + ")");
    }
}
