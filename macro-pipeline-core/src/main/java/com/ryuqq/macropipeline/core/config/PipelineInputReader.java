package com.ryuqq.macropipeline.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Pipeline 입력 매핑 JSON 리더.
 *
 * <p>JSON 객체의 키는 Operation 이름, 값은 인자입니다. 키 순서는 파일에 적힌 순서를 유지합니다.</p>
 *
 * <pre>
 * {
 *   "open":  "out/file_a.txt",
 *   "write": ["hello world"],
 *   "close": {}
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PipelineInputReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> INPUT_TYPE = new TypeReference<>() {
    };

    private PipelineInputReader() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * JSON 파일 읽기.
     *
     * @param file JSON 파일 경로
     * @return 삽입 순서를 유지하는 입력 매핑
     * @throws IllegalArgumentException file이 null인 경우
     * @throws UncheckedIOException 읽기 또는 파싱 실패 시
     */
    public static LinkedHashMap<String, Object> read(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        try {
            return MAPPER.readValue(file.toFile(), INPUT_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline input: " + file, e);
        }
    }

    /**
     * JSON 문자열 파싱.
     *
     * @param json JSON 객체 문자열
     * @return 삽입 순서를 유지하는 입력 매핑
     * @throws IllegalArgumentException json이 null인 경우
     * @throws UncheckedIOException 파싱 실패 시
     */
    public static LinkedHashMap<String, Object> parse(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        try {
            return MAPPER.readValue(json, INPUT_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse pipeline input", e);
        }
    }
}
