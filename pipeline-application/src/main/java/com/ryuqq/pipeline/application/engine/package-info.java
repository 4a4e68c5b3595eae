/**
 * Engine-facing API.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.application.engine.PipelineEngine} - validate, execute, cancel and registry access</li>
 *   <li>{@link com.ryuqq.pipeline.application.engine.ExecutionHandle} - execution id plus event subscription</li>
 *   <li>{@link com.ryuqq.pipeline.application.engine.ExecuteOptions} - dry run and debug flags</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.application.engine;
