/**
 * Local Cluster Adapter - JVM 내부 worker 풀 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.adapter.local.cluster.LocalCluster} - 설정 기반으로 생성되는 로컬 worker 풀</li>
 *   <li>{@link com.ryuqq.macropipeline.adapter.local.cluster.ExecutorServiceCluster} - 호출자 소유 ExecutorService 어댑터</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (ExternalExecutor, LocalExecutor, MacroPipeline)
 *   ↓ depends on
 * adapter-local (LocalCluster, ExecutorServiceCluster)
 *   ↓ implements
 * core/executor (Cluster interface)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.adapter.local.cluster;
