/**
 * Orchestrator Application Layer - Task 묶음 병렬 실행 API.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.application.orchestrator.MacroPipeline} - Task 목록, client 구성, 실행, 결과 조회</li>
 *   <li>{@link com.ryuqq.macropipeline.application.orchestrator.OutcomeReport} - 결과 리포트 포맷</li>
 *   <li>{@link com.ryuqq.macropipeline.application.orchestrator.ClientConfigurationException} - client 구성 오류</li>
 * </ul>
 *
 * <h2>오류 처리</h2>
 * <ul>
 *   <li><strong>구성/사용 오류:</strong> 호출 지점에서 즉시 예외 (병렬 작업 시작 전)</li>
 *   <li><strong>Task 실행 오류:</strong> Task별로 격리되어 결과로만 보고</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.application.orchestrator;
