package com.ryuqq.pipeline.core.spi;

import java.util.Set;

/**
 * Sandboxed code-execution collaborator SPI.
 *
 * <p>Snippets run without filesystem or network access under a wall-clock timeout.
 * The engine acquires a {@link SandboxSession} per attempt in a try-with-resources block.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CodeSandbox {

    /**
     * Acquires a session for the given language.
     *
     * @param language "python" or "javascript"
     * @return a fresh session, released by the caller
     * @throws com.ryuqq.pipeline.core.error.StepExecutionException if no sandbox can be acquired
     */
    SandboxSession open(String language);

    /**
     * Languages this sandbox can run.
     */
    Set<String> supportedLanguages();
}
