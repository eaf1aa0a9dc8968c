/**
 * MacroPipeline lifecycle state machine.
 *
 * <h2>States</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.core.statemachine.PipelineState#UNCONFIGURED} - no client yet</li>
 *   <li>{@link com.ryuqq.macropipeline.core.statemachine.PipelineState#CLIENT_CONFIGURED} - ready to run</li>
 *   <li>{@link com.ryuqq.macropipeline.core.statemachine.PipelineState#RUNNING} - waiting on the gather barrier</li>
 *   <li>{@link com.ryuqq.macropipeline.core.statemachine.PipelineState#COMPLETED} - outcomes available</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.macropipeline.core.statemachine.StateTransition} rejects every transition
 * not drawn in the {@link com.ryuqq.macropipeline.core.statemachine.PipelineState} diagram.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.macropipeline.core.statemachine;
