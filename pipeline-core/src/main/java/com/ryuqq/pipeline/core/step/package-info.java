/**
 * Step Contract.
 *
 * <p>{@link com.ryuqq.pipeline.core.step.StepExecutor} is the only seam between the orchestrator and
 * the work a step performs. Each {@link com.ryuqq.pipeline.core.model.StepType} maps to exactly one
 * executor in a {@link com.ryuqq.pipeline.core.step.StepExecutorRegistry}.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Typed outcome:</strong> failures are {@link com.ryuqq.pipeline.core.step.StepResult} values</li>
 *   <li><strong>No context writes:</strong> outputs are merged back by the orchestrator after the step ends</li>
 *   <li><strong>Closed set:</strong> a new step kind is a new executor, the orchestrator is untouched</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.step;
