/**
 * Error taxonomy of the pipeline engine.
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li><strong>Validation:</strong> aborts before any side effect</li>
 *   <li><strong>Input binding / step execution:</strong> local to one step, contained by the retry loop</li>
 *   <li><strong>Engine fault:</strong> fatal to the run, cancels in-flight steps</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.error;
