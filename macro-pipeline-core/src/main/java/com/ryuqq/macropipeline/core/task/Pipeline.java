package com.ryuqq.macropipeline.core.task;

import com.ryuqq.macropipeline.core.config.PipelineInputReader;
import com.ryuqq.macropipeline.core.outcome.Fail;
import com.ryuqq.macropipeline.core.outcome.StepResult;
import com.ryuqq.macropipeline.core.outcome.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 이름 붙은 Operation을 순서대로 실행하는 Task.
 *
 * <p>하위 클래스는 생성자에서 {@link #register(String, Operation)}로 지원하는 Operation을 등록하고,
 * 호출자는 입력 매핑(Operation 이름 → 인자)을 지정합니다.
 * {@link #run()}은 입력 매핑의 삽입 순서대로 Operation을 실행합니다.</p>
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ol>
 *   <li>입력 매핑 순서대로 Operation 실행 (같은 스레드)</li>
 *   <li>첫 번째 실패에서 중단, 이후 Operation은 실행하지 않음</li>
 *   <li>이미 완료된 Operation의 부수 효과는 되돌리지 않음</li>
 *   <li>Operation이 예외를 던져도 실패 결과로 변환</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public class CopyPipeline extends Pipeline {
 *     public CopyPipeline() {
 *         register("read", arg -&gt; StepResult.attempt(() -&gt; read(Path.of(arg.toString()))));
 *         register("write", arg -&gt; StepResult.attempt(() -&gt; write(Path.of(arg.toString()))));
 *     }
 * }
 *
 * CopyPipeline pipeline = new CopyPipeline();
 * pipeline.setInput(Map.of("read", "in.txt", "write", "out.txt"));
 * TaskOutcome outcome = pipeline.run();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class Pipeline implements Task {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Map<String, Operation> operations = new LinkedHashMap<>();
    private final Map<String, Object> input = new LinkedHashMap<>();
    private String label = "";

    /**
     * Operation 등록.
     *
     * @param name Operation 이름
     * @param operation Operation 구현
     * @throws IllegalArgumentException name이 null/blank이거나 operation이 null인 경우
     * @throws IllegalStateException 같은 이름이 이미 등록된 경우
     */
    protected final void register(String name, Operation operation) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("operation name cannot be null or blank");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null (name: " + name + ")");
        }
        if (operations.putIfAbsent(name, operation) != null) {
            throw new IllegalStateException("operation already registered: " + name);
        }
    }

    /**
     * 등록된 Operation 이름 조회.
     *
     * @return 등록 순서의 이름 집합 (읽기 전용)
     */
    public Set<String> getOperationNames() {
        return Collections.unmodifiableSet(operations.keySet());
    }

    /**
     * 입력 매핑 조회.
     *
     * @return 삽입 순서의 입력 매핑 (읽기 전용)
     */
    public Map<String, Object> getInput() {
        return Collections.unmodifiableMap(input);
    }

    /**
     * 입력 매핑 지정.
     *
     * <p>기존 입력은 모두 교체됩니다. 전달한 Map의 반복 순서가 실행 순서가 되므로
     * 순서가 필요한 경우 {@link LinkedHashMap}을 사용해야 합니다.</p>
     *
     * @param input Operation 이름 → 인자
     * @throws IllegalArgumentException input이 null이거나 등록되지 않은 Operation 이름을 포함한 경우
     */
    public void setInput(Map<String, ?> input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        for (String name : input.keySet()) {
            if (!operations.containsKey(name)) {
                throw new IllegalArgumentException(
                    String.format("unknown operation '%s' for %s (available: %s)",
                        name, getClass().getSimpleName(), operations.keySet()));
            }
        }
        this.input.clear();
        this.input.putAll(input);
    }

    /**
     * JSON 파일에서 입력 매핑 로드.
     *
     * @param inputFile JSON 객체 파일 (키 = Operation 이름)
     * @throws java.io.UncheckedIOException 파일을 읽거나 파싱할 수 없는 경우
     * @throws IllegalArgumentException 등록되지 않은 Operation 이름을 포함한 경우
     */
    public void configure(Path inputFile) {
        setInput(PipelineInputReader.read(inputFile));
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public void setLabel(String label) {
        this.label = label == null ? "" : label;
    }

    @Override
    public TaskOutcome run() {
        Map<String, Object> steps = new LinkedHashMap<>(input);

        for (Map.Entry<String, Object> step : steps.entrySet()) {
            String name = step.getKey();
            log.debug("Running operation '{}' of pipeline '{}'", name, label);

            StepResult result = execute(name, step.getValue());
            if (result instanceof Fail fail) {
                log.warn("Operation '{}' of pipeline '{}' failed: {} - {}",
                    name, label, fail.errorKind().getSimpleName(), fail.detail());
                return TaskOutcome.failed(label, fail);
            }
        }
        return TaskOutcome.completed(label);
    }

    /**
     * 단일 Operation 실행.
     *
     * <p>Operation이 결과 대신 RuntimeException을 던지거나 null을 반환해도 실패로 변환합니다.</p>
     */
    private StepResult execute(String name, Object argument) {
        try {
            StepResult result = operations.get(name).apply(argument);
            if (result == null) {
                return Fail.of(IllegalStateException.class, "operation '" + name + "' returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            return StepResult.fail(e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{label=" + label + ", input=" + input.keySet() + "}";
    }
}
