/**
 * Executor Domain Service - 병렬 실행 SPI.
 *
 * <p>이 패키지는 compute cluster와 그 위의 "제출 후 수집" 실행자를 정의합니다.
 * 구현체는 adapter-local(Cluster)과 application(Executor) 모듈에 위치합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.core.executor.Cluster} - worker 풀</li>
 *   <li>{@link com.ryuqq.macropipeline.core.executor.Executor} - 순서 보장 수집 실행자</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>단일 배리어:</strong> submitAndGather()는 모든 작업이 끝날 때까지 블로킹</li>
 *   <li><strong>순서 보장:</strong> 결과는 완료 순서가 아닌 제출 순서</li>
 *   <li><strong>소유권 분리:</strong> Cluster 종료는 생성한 쪽의 책임</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.core.executor;
