package com.ryuqq.pipeline.core.spi;

/**
 * Model-serving collaborator SPI.
 *
 * <p>Implementations translate a {@link ModelRequest} into a call against a concrete
 * model server and report token usage. The engine never talks to a model server directly.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrently running steps share one client</li>
 *   <li>Failures are reported by throwing
 *       {@link com.ryuqq.pipeline.core.error.StepExecutionException}</li>
 *   <li>Interruption must be honoured so that a timed-out attempt releases its connection</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ModelClient {

    /**
     * Generates a completion.
     *
     * @param request resolved request
     * @return generated text with usage
     * @throws com.ryuqq.pipeline.core.error.StepExecutionException if the model server fails
     */
    ModelResponse generate(ModelRequest request);
}
