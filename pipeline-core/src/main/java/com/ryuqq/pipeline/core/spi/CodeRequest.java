package com.ryuqq.pipeline.core.spi;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Snippet to run in the sandbox.
 *
 * @param language "python" or "javascript"
 * @param code source text
 * @param inputs values exposed to the snippet as global variables
 * @param timeout wall-clock limit of the snippet
 * @param memoryLimitMb memory limit in megabytes
 * @param packages packages the snippet may import
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CodeRequest(
    String language,
    String code,
    Map<String, Object> inputs,
    Duration timeout,
    int memoryLimitMb,
    List<String> packages
) {

    public CodeRequest {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language cannot be null or blank");
        }
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (memoryLimitMb <= 0) {
            throw new IllegalArgumentException("memoryLimitMb must be positive (current: " + memoryLimitMb + ")");
        }
        inputs = inputs == null ? Map.of() : inputs;
        packages = packages == null ? List.of() : List.copyOf(packages);
    }
}
