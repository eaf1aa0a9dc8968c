package com.ryuqq.macropipeline.application.orchestrator;

import com.ryuqq.macropipeline.adapter.local.cluster.LocalClusterConfig;
import com.ryuqq.macropipeline.application.client.ClientSetup;
import com.ryuqq.macropipeline.application.client.ClientSetupResult;
import com.ryuqq.macropipeline.application.client.ExecutorFactory;
import com.ryuqq.macropipeline.core.executor.Cluster;
import com.ryuqq.macropipeline.core.executor.Executor;
import com.ryuqq.macropipeline.core.outcome.TaskError;
import com.ryuqq.macropipeline.core.outcome.TaskOutcome;
import com.ryuqq.macropipeline.core.statemachine.PipelineState;
import com.ryuqq.macropipeline.core.statemachine.StateTransition;
import com.ryuqq.macropipeline.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * 독립 Task 묶음을 병렬 실행하고 결과를 집계하는 조정자.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Task 목록 관리 (삽입 순서 = 실행 인덱스)</li>
 *   <li>client(Executor) 구성: 기존 Cluster 연결 또는 로컬 Cluster 생성</li>
 *   <li>모든 Task를 병렬 제출, 완료까지 블로킹, 결과를 Task 순서대로 저장</li>
 *   <li>실패 Task 조회와 결과 리포트 출력</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * setTasks / addTask
 *   ↓
 * setupClient(cluster | mode + options) → UNCONFIGURED → CLIENT_CONFIGURED
 *   ↓
 * run()                                 → RUNNING
 *   1. 각 Task.run()을 작업 단위 하나로 제출
 *   2. 모든 작업 완료까지 대기 (단일 배리어)
 *   3. 결과를 Task 순서대로 저장 (이전 결과 전체 교체)
 *                                       → COMPLETED
 *   ↓
 * getFailedPipelines() / printOutcome()
 * </pre>
 *
 * <p><strong>장애 격리:</strong> Task 실패는 결과로만 기록되며 run()을 중단시키지 않습니다.
 * Task가 결과 대신 예외를 던져도 해당 Task의 실패로 기록합니다.</p>
 *
 * <p><strong>자원:</strong> client는 소유하지 않습니다. 외부 Cluster는 종료하지 않으며,
 * 로컬 Cluster도 자동 종료하지 않으므로 호출자가 {@code getClient().shutdown()}을 호출해야 합니다.</p>
 *
 * <p><strong>동시성:</strong> 한 인스턴스에서 run()을 겹쳐 호출하는 것은 지원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MacroPipeline {

    private static final Logger log = LoggerFactory.getLogger(MacroPipeline.class);

    private List<Task> tasks = new ArrayList<>();
    private List<Task> dispatchedTasks = List.of();
    private List<TaskOutcome> outcomes = List.of();
    private Executor client;
    private PipelineState state = PipelineState.UNCONFIGURED;

    /**
     * Task 목록 조회.
     *
     * @return 현재 Task 목록 (변경 가능한 내부 목록)
     */
    public List<Task> getTasks() {
        return tasks;
    }

    /**
     * Task 목록 교체.
     *
     * @param tasks 새 Task 목록 (순서 = 실행 인덱스)
     * @throws IllegalArgumentException tasks가 null이거나 null 원소를 포함한 경우
     */
    public void setTasks(List<? extends Task> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i) == null) {
                throw new IllegalArgumentException("tasks cannot contain null (index: " + i + ")");
            }
        }
        this.tasks = new ArrayList<>(tasks);
    }

    /**
     * Task 추가.
     *
     * @param task 추가할 Task
     * @throws IllegalArgumentException task가 null인 경우
     */
    public void addTask(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        tasks.add(task);
    }

    /**
     * 라벨을 위치 순서대로 지정 ({@code tasks[i].label = labels[i]}).
     *
     * @param labels 라벨 목록
     * @throws IllegalArgumentException labels가 null이거나 Task 수와 다른 경우
     */
    public void setLabels(List<String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        if (labels.size() != tasks.size()) {
            throw new IllegalArgumentException(
                String.format("labels size must match tasks size (labels: %d, tasks: %d)", labels.size(), tasks.size()));
        }
        for (int i = 0; i < labels.size(); i++) {
            tasks.get(i).setLabel(labels.get(i));
        }
    }

    /**
     * 기존 Cluster에 연결.
     *
     * @param cluster 호출자 소유 Cluster (종료하지 않음)
     * @throws ClientConfigurationException cluster가 null인 경우
     */
    public void setupClient(Cluster cluster) {
        configure(ExecutorFactory.attach(cluster));
    }

    /**
     * 설정으로 로컬 Cluster 생성.
     *
     * @param config 로컬 Cluster 설정
     * @throws ClientConfigurationException config가 null인 경우
     */
    public void setupClient(LocalClusterConfig config) {
        configure(ExecutorFactory.createLocal(config));
    }

    /**
     * 모드와 옵션으로 client 구성.
     *
     * @param mode 실행 모드 ("local")
     * @param options 모드별 옵션 (workerCount, threadsPerWorker, processes, workerSpaceRoot)
     * @throws ClientConfigurationException 지원하지 않는 모드이거나 옵션이 잘못된 경우
     */
    public void setupClient(String mode, Map<String, ?> options) {
        setupClient(null, mode, options);
    }

    /**
     * client 구성.
     *
     * <p>cluster가 지정되면 연결하고, 없으면 mode에 따라 새 Cluster를 생성합니다.
     * run() 전에 완료되어야 합니다. 기존 client는 종료하지 않고 교체합니다.</p>
     *
     * @param cluster 연결할 기존 Cluster (null 가능)
     * @param mode 실행 모드 (null이면 "local")
     * @param options 모드별 옵션 (null 가능)
     * @throws ClientConfigurationException 지원하지 않는 모드이거나 옵션이 잘못된 경우
     */
    public void setupClient(Cluster cluster, String mode, Map<String, ?> options) {
        ClientSetup setup = cluster != null
            ? ClientSetup.attach(cluster)
            : ClientSetup.create(mode, options);
        configure(ExecutorFactory.create(setup));
    }

    /**
     * 모든 Task를 병렬 실행하고 완료까지 대기.
     *
     * <p>결과는 Task 순서대로 저장되며 이전 실행 결과를 전부 교체합니다.
     * Task 실패는 예외로 전파되지 않습니다.</p>
     *
     * @throws IllegalStateException client가 구성되지 않았거나 이미 실행 중인 경우, 대기 중 인터럽트 발생 시
     */
    public void run() {
        if (client == null) {
            throw new IllegalStateException("client is not configured; call setupClient() before run()");
        }
        if (!state.isReadyToRun()) {
            throw new IllegalStateException("pipeline is not ready to run (state: " + state + ")");
        }
        state = StateTransition.transition(state, PipelineState.RUNNING);

        List<Task> snapshot = List.copyOf(tasks);
        List<Callable<TaskOutcome>> units = snapshot.stream()
            .map(task -> (Callable<TaskOutcome>) () -> runIsolated(task))
            .collect(Collectors.toList());

        log.info("Dispatching {} tasks to {}", snapshot.size(), client);
        List<TaskOutcome> gathered;
        try {
            gathered = client.submitAndGather(units);
        } catch (RuntimeException e) {
            state = StateTransition.transition(state, PipelineState.CLIENT_CONFIGURED);
            throw e;
        }

        this.dispatchedTasks = snapshot;
        this.outcomes = List.copyOf(gathered);
        this.state = StateTransition.transition(state, PipelineState.COMPLETED);

        long failed = outcomes.stream().filter(outcome -> !outcome.success()).count();
        log.info("Run completed: {} of {} tasks failed", failed, outcomes.size());
    }

    /**
     * Task 순서의 오류 쌍 조회.
     *
     * @return (errorKind, errorDetail) 목록, 성공은 (null, null). 실행 전에는 빈 목록
     */
    public List<TaskError> getErrors() {
        return outcomes.stream()
            .map(TaskOutcome::toError)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Task 순서의 실행 결과 조회.
     *
     * @return 실행 결과 목록 (실행 전에는 빈 목록)
     */
    public List<TaskOutcome> getOutcomes() {
        return outcomes;
    }

    /**
     * 실패한 Task 조회.
     *
     * @return 오류 쌍이 (null, null)이 아닌 Task 목록 (Task 순서 유지)
     */
    public List<Task> getFailedPipelines() {
        List<Task> failed = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            if (!outcomes.get(i).toError().isNone()) {
                failed.add(dispatchedTasks.get(i));
            }
        }
        return failed;
    }

    /**
     * 결과 리포트를 표준 출력으로 출력.
     */
    public void printOutcome() {
        printOutcome(System.out);
    }

    /**
     * 결과 리포트를 스트림으로 출력.
     *
     * @param out 출력 스트림
     * @throws IllegalArgumentException out이 null인 경우
     */
    public void printOutcome(PrintStream out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        OutcomeReport.render(outcomes).forEach(out::println);
        out.flush();
    }

    /**
     * 결과 리포트를 파일로 출력 (기존 내용 덮어씀).
     *
     * @param toFile 출력 파일 경로
     * @throws IllegalArgumentException toFile이 null인 경우
     * @throws UncheckedIOException 파일 쓰기 실패 시
     */
    public void printOutcome(Path toFile) {
        if (toFile == null) {
            throw new IllegalArgumentException("toFile cannot be null");
        }
        try (BufferedWriter writer = Files.newBufferedWriter(toFile, StandardCharsets.UTF_8)) {
            for (String line : OutcomeReport.render(outcomes)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write outcome report to " + toFile, e);
        }
    }

    /**
     * client 조회.
     *
     * @return 구성된 Executor (미구성 시 null)
     */
    public Executor getClient() {
        return client;
    }

    /**
     * 현재 상태 조회.
     *
     * @return 생명주기 상태
     */
    public PipelineState getState() {
        return state;
    }

    private void configure(ClientSetupResult result) {
        Executor executor = result.orElseThrow(ClientConfigurationException::new);
        state = StateTransition.transition(state, PipelineState.CLIENT_CONFIGURED);
        if (client != null) {
            log.info("Replacing client {} with {}", client, executor);
        }
        this.client = executor;
    }

    /**
     * 단일 Task 실행 (worker 스레드에서 호출).
     *
     * <p>Task가 예외(checked 포함)나 AssertionError 같은 Error를 던지거나 결과를 반환하지 않아도
     * 실패 결과로 변환하여 다른 Task에 영향을 주지 않습니다. JVM 자체의 오류(VirtualMachineError)만 전파합니다.</p>
     */
    private static TaskOutcome runIsolated(Task task) {
        try {
            TaskOutcome outcome = task.run();
            if (outcome == null) {
                return new TaskOutcome(task.getLabel(), false, IllegalStateException.class, "task returned no outcome");
            }
            return outcome;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Task '{}' threw instead of returning an outcome", task.getLabel(), e);
            return TaskOutcome.failed(task.getLabel(), e);
        }
    }
}
