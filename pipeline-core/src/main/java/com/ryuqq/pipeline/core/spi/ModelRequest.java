package com.ryuqq.pipeline.core.spi;

/**
 * Request sent to the model-serving collaborator.
 *
 * @param modelId model identifier
 * @param prompt fully resolved user prompt
 * @param systemPrompt resolved system prompt, may be null
 * @param maxTokens completion token cap
 * @param temperature sampling temperature
 * @param topP nucleus sampling mass
 * @param frequencyPenalty frequency penalty
 * @param presencePenalty presence penalty
 * @param responseFormat "text" or "json"
 * @param provider provider hint, may be null
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModelRequest(
    String modelId,
    String prompt,
    String systemPrompt,
    int maxTokens,
    double temperature,
    double topP,
    double frequencyPenalty,
    double presencePenalty,
    String responseFormat,
    String provider
) {

    public ModelRequest {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId cannot be null or blank");
        }
        if (prompt == null) {
            throw new IllegalArgumentException("prompt cannot be null");
        }
        responseFormat = responseFormat == null ? "text" : responseFormat;
    }

    public boolean wantsJson() {
        return "json".equalsIgnoreCase(responseFormat);
    }
}
