package com.ryuqq.macropipeline.adapter.local.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * LocalCluster 수명에 묶인 임시 작업 디렉토리.
 *
 * <p>Cluster 시작 시 생성({@link #acquire(Path, String)})되고, 종료 시 하위 파일과 함께 삭제({@link #release()})됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class WorkerSpace {

    private static final Logger log = LoggerFactory.getLogger(WorkerSpace.class);
    private static final String PREFIX = "macro-pipeline-worker-space-";

    private final Path directory;
    private boolean released;

    private WorkerSpace(Path directory) {
        this.directory = directory;
    }

    /**
     * 작업 디렉토리 생성.
     *
     * @param root 상위 경로 (없으면 생성)
     * @param clusterName Cluster 이름 (디렉토리 이름 접두어)
     * @return WorkerSpace
     * @throws UncheckedIOException 디렉토리 생성 실패 시
     */
    static WorkerSpace acquire(Path root, String clusterName) {
        try {
            Files.createDirectories(root);
            Path directory = Files.createTempDirectory(root, PREFIX + clusterName + "-");
            log.debug("Worker space acquired: {}", directory);
            return new WorkerSpace(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create worker space under " + root, e);
        }
    }

    Path getDirectory() {
        return directory;
    }

    /**
     * 작업 디렉토리 삭제 (멱등).
     *
     * <p>삭제 실패는 Cluster 종료를 막지 않도록 경고 로그만 남깁니다.</p>
     */
    synchronized void release() {
        if (released) {
            return;
        }
        released = true;

        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to scan worker space {} for cleanup", directory, e);
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Failed to delete {} from worker space", path, e);
            }
        }
        log.debug("Worker space released: {}", directory);
    }
}
