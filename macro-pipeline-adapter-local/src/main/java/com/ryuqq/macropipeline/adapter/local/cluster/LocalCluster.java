package com.ryuqq.macropipeline.adapter.local.cluster;

import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.ClusterStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * JVM 내부 worker 풀로 구성된 로컬 Cluster.
 *
 * <p>{@link #start(LocalClusterConfig)}는 모든 worker가 준비되어 RUNNING 상태가 된 뒤 반환합니다.</p>
 *
 * <p><strong>Worker 구성:</strong></p>
 * <ul>
 *   <li>processes=true: worker마다 독립된 고정 크기 스레드 풀, 작업은 round-robin 배정</li>
 *   <li>processes=false: workerCount × threadsPerWorker 크기의 공유 스레드 풀 1개</li>
 * </ul>
 *
 * <p><strong>자원:</strong></p>
 * <ul>
 *   <li>worker 스레드는 daemon 스레드</li>
 *   <li>worker 작업 디렉토리는 시작 시 생성, {@link #close()} 시 삭제</li>
 *   <li>자동 종료 없음: 생성한 쪽이 close() 호출</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (LocalCluster cluster = LocalCluster.start(new LocalClusterConfig(2, 1, true, root))) {
 *     Future&lt;String&gt; future = cluster.submit(() -&gt; "done");
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LocalCluster implements Cluster {

    private static final Logger log = LoggerFactory.getLogger(LocalCluster.class);
    private static final AtomicInteger CLUSTER_SEQUENCE = new AtomicInteger();
    private static final long CLOSE_TIMEOUT_SECONDS = 30;

    private final String name;
    private final LocalClusterConfig config;
    private final List<ExecutorService> workers;
    private final AtomicInteger nextWorker = new AtomicInteger();
    private final WorkerSpace workerSpace;
    private volatile ClusterStatus status = ClusterStatus.STARTING;

    private LocalCluster(LocalClusterConfig config, BiFunction<Integer, ThreadFactory, ExecutorService> poolFactory) {
        this.name = "local-cluster-" + CLUSTER_SEQUENCE.incrementAndGet();
        this.config = config;
        this.workerSpace = WorkerSpace.acquire(config.workerSpaceRoot(), name);
        try {
            this.workers = Collections.unmodifiableList(createWorkers(config, poolFactory));
        } catch (RuntimeException e) {
            workerSpace.release();
            throw e;
        }
        this.status = ClusterStatus.RUNNING;
    }

    /**
     * 로컬 Cluster 생성 및 시작.
     *
     * @param config Cluster 설정
     * @return RUNNING 상태의 LocalCluster
     * @throws IllegalArgumentException config가 null인 경우
     * @throws java.io.UncheckedIOException worker 작업 디렉토리 생성 실패 시
     */
    public static LocalCluster start(LocalClusterConfig config) {
        return start(config, Executors::newFixedThreadPool);
    }

    /**
     * worker 풀 생성 방식을 지정하여 시작 (테스트용).
     *
     * @param config Cluster 설정
     * @param poolFactory (스레드 수, ThreadFactory) → worker 풀
     * @return RUNNING 상태의 LocalCluster
     */
    static LocalCluster start(LocalClusterConfig config, BiFunction<Integer, ThreadFactory, ExecutorService> poolFactory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        LocalCluster cluster = new LocalCluster(config, poolFactory);
        log.info("{} started: workers={}, threadsPerWorker={}, processes={}",
            cluster.name, config.workerCount(), config.threadsPerWorker(), config.processes());
        return cluster;
    }

    /**
     * 기본 설정으로 로컬 Cluster 생성 및 시작.
     *
     * @return RUNNING 상태의 LocalCluster
     */
    public static LocalCluster start() {
        return start(new LocalClusterConfig());
    }

    @Override
    public ClusterStatus getStatus() {
        return status;
    }

    @Override
    public <T> Future<T> submit(Callable<T> unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        ClusterStatus current = status;
        if (!current.isAcceptingWork()) {
            throw new IllegalStateException(name + " is not running (status: " + current + ")");
        }
        int index = Math.floorMod(nextWorker.getAndIncrement(), workers.size());
        try {
            return workers.get(index).submit(unit);
        } catch (RejectedExecutionException e) {
            // close()와 경합하여 worker가 먼저 종료된 경우
            throw new IllegalStateException(name + " is not running (status: " + status + ")", e);
        }
    }

    /**
     * Cluster 종료.
     *
     * <p>신규 작업을 거부하고, 진행 중인 작업을 최대 30초 기다린 뒤 worker와 작업 디렉토리를 정리합니다.</p>
     */
    @Override
    public synchronized void close() {
        if (status == ClusterStatus.CLOSED || status == ClusterStatus.CLOSING) {
            return;
        }
        status = ClusterStatus.CLOSING;

        for (ExecutorService worker : workers) {
            worker.shutdown();
        }
        try {
            for (ExecutorService worker : workers) {
                if (!worker.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("{} worker did not terminate within {}s, forcing shutdown", name, CLOSE_TIMEOUT_SECONDS);
                    worker.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.forEach(ExecutorService::shutdownNow);
        } finally {
            workerSpace.release();
            status = ClusterStatus.CLOSED;
            log.info("{} closed", name);
        }
    }

    /**
     * Cluster 이름 조회.
     *
     * @return 이름 (예: local-cluster-1)
     */
    public String getName() {
        return name;
    }

    /**
     * 설정 조회.
     *
     * @return Cluster 설정
     */
    public LocalClusterConfig getConfig() {
        return config;
    }

    /**
     * worker 작업 디렉토리 조회.
     *
     * <p>close() 이후에는 삭제된 경로를 가리킵니다.</p>
     *
     * @return 작업 디렉토리 경로
     */
    public Path getWorkerSpace() {
        return workerSpace.getDirectory();
    }

    @Override
    public String toString() {
        return "LocalCluster{name=" + name + ", status=" + status
            + ", workers=" + config.workerCount() + ", threadsPerWorker=" + config.threadsPerWorker()
            + ", processes=" + config.processes() + "}";
    }

    private List<ExecutorService> createWorkers(
        LocalClusterConfig config,
        BiFunction<Integer, ThreadFactory, ExecutorService> poolFactory
    ) {
        List<ExecutorService> pools = new ArrayList<>();
        try {
            if (config.processes()) {
                for (int i = 0; i < config.workerCount(); i++) {
                    pools.add(poolFactory.apply(config.threadsPerWorker(), threadFactory("worker-" + i)));
                }
            } else {
                pools.add(poolFactory.apply(config.totalThreads(), threadFactory("shared")));
            }
        } catch (RuntimeException e) {
            log.warn("{} failed to create worker pools, shutting down {} created", name, pools.size());
            pools.forEach(ExecutorService::shutdownNow);
            throw e;
        }
        return pools;
    }

    private ThreadFactory threadFactory(String poolName) {
        AtomicInteger threadSequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + poolName + "-thread-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
