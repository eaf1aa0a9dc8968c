/**
 * Task 계약과 Pipeline 기반 클래스.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.core.task.Task} - 실행 계약 (run → TaskOutcome)</li>
 *   <li>{@link com.ryuqq.macropipeline.core.task.Pipeline} - 이름 붙은 Operation을 순서대로 실행하는 Task</li>
 *   <li>{@link com.ryuqq.macropipeline.core.task.Operation} - Pipeline의 단일 동작</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.core.task;
