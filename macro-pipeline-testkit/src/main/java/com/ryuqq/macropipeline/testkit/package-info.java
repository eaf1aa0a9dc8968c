/**
 * Test fixtures shared across modules.
 *
 * <ul>
 *   <li>{@code task} - sample tasks: a short file I/O pipeline, a sleeping task, a throwing task</li>
 *   <li>{@code contract} - abstract contract test every {@link com.ryuqq.macropipeline.core.executor.Cluster} implementation extends</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.testkit;
