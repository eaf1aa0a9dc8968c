/**
 * Step and task outcome package.
 *
 * <p>Operations return a {@link com.ryuqq.macropipeline.core.outcome.StepResult}
 * instead of unwinding with exceptions. A pipeline folds the first failure into a single
 * {@link com.ryuqq.macropipeline.core.outcome.TaskOutcome}.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.macropipeline.core.outcome.StepResult} - Sealed interface (permits Ok, Fail)</li>
 *   <li>{@link com.ryuqq.macropipeline.core.outcome.Ok} - Operation completed</li>
 *   <li>{@link com.ryuqq.macropipeline.core.outcome.Fail} - Operation failed with an error kind and detail</li>
 *   <li>{@link com.ryuqq.macropipeline.core.outcome.TaskOutcome} - Per-task result record</li>
 *   <li>{@link com.ryuqq.macropipeline.core.outcome.TaskError} - (errorKind, errorDetail) pair, {@code (null, null)} on success</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.macropipeline.core.outcome;
