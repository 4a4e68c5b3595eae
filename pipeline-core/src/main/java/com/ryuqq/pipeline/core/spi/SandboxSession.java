package com.ryuqq.pipeline.core.spi;

/**
 * One acquired sandbox (interpreter process, container).
 *
 * <p>Sessions are acquired per attempt and always released with {@link #close()},
 * including on timeout and cancellation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SandboxSession extends AutoCloseable {

    /**
     * Runs the snippet. Exceptions raised by the snippet are reported in the outcome.
     *
     * @param request snippet and limits
     * @return outcome
     * @throws com.ryuqq.pipeline.core.error.StepExecutionException if the sandbox itself fails
     */
    CodeOutcome run(CodeRequest request);

    @Override
    void close();
}
