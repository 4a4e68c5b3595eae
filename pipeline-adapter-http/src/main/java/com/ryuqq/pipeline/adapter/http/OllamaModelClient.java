package com.ryuqq.pipeline.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.spi.ModelClient;
import com.ryuqq.pipeline.core.spi.ModelRequest;
import com.ryuqq.pipeline.core.spi.ModelResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelClient} that calls an Ollama-compatible {@code /api/chat} endpoint.
 *
 * <p>Token usage comes from {@code prompt_eval_count} and {@code eval_count}. Local models carry no
 * price, so {@link ModelResponse#cost()} is left empty and the model-call step applies its default rate.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OllamaModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final OllamaConfig config;
    private final HttpClient httpClient;

    public OllamaModelClient() {
        this(new OllamaConfig());
    }

    public OllamaModelClient(OllamaConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
            .build();
    }

    @Override
    public ModelResponse generate(ModelRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        String json = toJson(requestBody(request));
        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(config.baseUrl() + "/api/chat"))
            .header("Content-Type", "application/json")
            .timeout(Duration.ofMillis(config.requestTimeoutMs()))
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();

        log.debug("Calling model {} at {}", request.modelId(), config.baseUrl());
        try {
            HttpResponse<String> response = httpClient.send(httpRequest,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new StepExecutionException(
                    "Model API error: " + response.statusCode() + " " + truncate(response.body()));
            }
            return toResponse(request, response.body());

        } catch (IOException e) {
            throw new StepExecutionException("Model API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("Model API request interrupted", e);
        }
    }

    static Map<String, Object> requestBody(ModelRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.prompt()));

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", request.temperature());
        options.put("top_p", request.topP());
        options.put("num_predict", request.maxTokens());
        options.put("frequency_penalty", request.frequencyPenalty());
        options.put("presence_penalty", request.presencePenalty());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.modelId());
        body.put("messages", messages);
        body.put("stream", false);
        if (request.wantsJson()) {
            body.put("format", "json");
        }
        body.put("options", options);
        return body;
    }

    static ModelResponse toResponse(ModelRequest request, String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Model API returned malformed JSON: " + e.getOriginalMessage(), e);
        }

        String text = root.path("message").path("content").asText("");
        Object structured = null;
        if (request.wantsJson() && !text.isBlank()) {
            try {
                structured = MAPPER.readValue(text, Object.class);
            } catch (JsonProcessingException e) {
                log.warn("Model {} returned non-JSON content for a json response_format", request.modelId());
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model", root.path("model").asText(request.modelId()));
        if (root.hasNonNull("done_reason")) {
            metadata.put("done_reason", root.get("done_reason").asText());
        }
        if (root.hasNonNull("total_duration")) {
            metadata.put("total_duration_ns", root.get("total_duration").asLong());
        }

        return new ModelResponse(text, structured,
            root.path("prompt_eval_count").asLong(0),
            root.path("eval_count").asLong(0),
            null, metadata);
    }

    private static String toJson(Map<String, Object> body) {
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Model request is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 500 ? body : body.substring(0, 500);
    }
}
