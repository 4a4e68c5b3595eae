package com.ryuqq.pipeline.core.spi;

/**
 * HTTP client SPI used by the HTTP-call step.
 *
 * <p>Non-2xx responses are returned, not thrown; the step decides whether they are failures.
 * Transport-level failures (connect error, per-call timeout) are thrown as
 * {@link com.ryuqq.pipeline.core.error.StepExecutionException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface HttpTransport {

    /**
     * Sends a request and waits for the full response.
     *
     * @param call request description
     * @return response
     * @throws com.ryuqq.pipeline.core.error.StepExecutionException on transport failure
     */
    HttpReply send(HttpCall call);
}
