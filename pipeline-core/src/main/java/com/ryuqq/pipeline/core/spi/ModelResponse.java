package com.ryuqq.pipeline.core.spi;

import java.util.Map;

/**
 * Response of the model-serving collaborator with usage accounting.
 *
 * @param text generated text
 * @param structured parsed JSON value when the request asked for JSON and parsing succeeded, otherwise null
 * @param promptTokens tokens consumed by the prompt
 * @param completionTokens tokens generated
 * @param cost cost reported by the collaborator, or null to let the executor price the usage
 * @param metadata provider specific details (model, finish reason, latency)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModelResponse(
    String text,
    Object structured,
    long promptTokens,
    long completionTokens,
    Double cost,
    Map<String, Object> metadata
) {

    public ModelResponse {
        text = text == null ? "" : text;
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException(
                "token counts must not be negative (prompt: " + promptTokens + ", completion: " + completionTokens + ")"
            );
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ModelResponse of(String text, long promptTokens, long completionTokens) {
        return new ModelResponse(text, null, promptTokens, completionTokens, null, Map.of());
    }

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
