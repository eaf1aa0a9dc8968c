package com.ryuqq.macropipeline.testkit.task;

import com.ryuqq.macropipeline.core.outcome.StepResult;
import com.ryuqq.macropipeline.core.task.Pipeline;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 파일 열기 → 쓰기 → 닫기로 구성된 짧은 I/O Pipeline.
 *
 * <p><strong>Operation:</strong></p>
 * <ul>
 *   <li>{@code open}: 인자 경로의 파일을 쓰기용으로 엶 (디렉토리이면 {@code FileSystemException})</li>
 *   <li>{@code write}: 인자 목록의 각 원소를 한 줄씩 씀 (실패하면 파일을 닫음)</li>
 *   <li>{@code close}: 파일을 닫음 (인자 무시)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShortIOPipeline extends Pipeline {

    private BufferedWriter writer;

    public ShortIOPipeline() {
        register("open", argument -> StepResult.attempt(() -> open(argument)));
        register("write", argument -> StepResult.attempt(() -> write(argument)));
        register("close", argument -> StepResult.attempt(this::close));
    }

    private void open(Object argument) throws IOException {
        if (argument == null) {
            throw new IllegalArgumentException("open requires a file path");
        }
        writer = Files.newBufferedWriter(Path.of(argument.toString()), StandardCharsets.UTF_8);
    }

    private void write(Object argument) throws IOException {
        if (writer == null) {
            throw new IllegalStateException("file is not open");
        }
        List<?> lines = argument instanceof List<?> list ? list : List.of(String.valueOf(argument));
        try {
            for (Object line : lines) {
                writer.write(String.valueOf(line));
                writer.newLine();
            }
        } catch (IOException e) {
            // 실패 이후 close operation은 실행되지 않으므로 여기서 닫음
            try {
                close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    private void close() throws IOException {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } finally {
            writer = null;
        }
    }

    /**
     * 파일이 열려 있는지 확인.
     *
     * @return open 이후 close 전이면 true
     */
    public boolean isOpen() {
        return writer != null;
    }
}
