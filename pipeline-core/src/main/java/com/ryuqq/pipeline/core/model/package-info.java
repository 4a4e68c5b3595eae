/**
 * Pipeline definition model.
 *
 * <p>Immutable value types describing what a user authored: the pipeline, its steps,
 * data-flow connections and run settings. The engine only reads these.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.model.PipelineDefinition} - ordered steps, connections, variables, settings</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.StepDefinition} - one typed unit of work</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.StepConfig} - typed view over type-specific configuration</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.ExecutionId} - identity of one run</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.model;
