/**
 * Execution-scoped state.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.context.ExecutionContext} - variables, step outputs, metadata, cancellation signal</li>
 *   <li>{@link com.ryuqq.pipeline.core.context.TemplateResolver} - {@code {{dotted.path}}} interpolation, strict on unresolved paths</li>
 *   <li>{@link com.ryuqq.pipeline.core.context.PathLookup} - nested map/list traversal</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.context;
