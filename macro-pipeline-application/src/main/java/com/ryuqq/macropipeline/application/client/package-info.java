/**
 * Client 구성 - Cluster 연결/생성과 순서 보장 수집.
 *
 * <h2>Executor 구현</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.application.client.ExternalExecutor} - 호출자 소유 Cluster에 연결 (종료하지 않음)</li>
 *   <li>{@link com.ryuqq.macropipeline.application.client.LocalExecutor} - 직접 생성한 LocalCluster 소유</li>
 * </ul>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.application.client.ClientSetup} - 구성 요청 (cluster, mode, options)</li>
 *   <li>{@link com.ryuqq.macropipeline.application.client.ExecutorFactory} - 요청 → {@link com.ryuqq.macropipeline.application.client.ClientSetupResult}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.application.client;
