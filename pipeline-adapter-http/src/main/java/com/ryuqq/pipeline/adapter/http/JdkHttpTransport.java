package com.ryuqq.pipeline.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.spi.HttpCall;
import com.ryuqq.pipeline.core.spi.HttpReply;
import com.ryuqq.pipeline.core.spi.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link HttpTransport} backed by {@code java.net.http.HttpClient}.
 *
 * <p>Non-string bodies are encoded as JSON. Response bodies that parse as JSON are exposed
 * through {@link HttpReply#json()}; everything else stays in {@link HttpReply#body()}.</p>
 *
 * <p>I/O failures surface as {@link StepExecutionException} so the HTTP step reports them
 * as a regular step failure.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(new HttpClientConfig());
    }

    public JdkHttpTransport(HttpClientConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
            .followRedirects(config.followRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
            .build();
    }

    @Override
    public HttpReply send(HttpCall call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        HttpRequest request = buildRequest(call);
        log.debug("Sending {} {}", call.method(), call.url());

        try {
            HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            Map<String, String> headers = firstValues(response.headers().map());
            String body = response.body();
            return new HttpReply(response.statusCode(), headers, body, parseJson(body));

        } catch (IOException e) {
            throw new StepExecutionException("HTTP request failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("HTTP request interrupted", e);
        }
    }

    private HttpRequest buildRequest(HttpCall call) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(call.url())).timeout(call.timeout());
        } catch (IllegalArgumentException e) {
            throw new StepExecutionException("Invalid URL: " + call.url(), e);
        }

        boolean hasContentType = false;
        for (Map.Entry<String, String> header : call.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
            if ("content-type".equalsIgnoreCase(header.getKey())) {
                hasContentType = true;
            }
        }

        HttpRequest.BodyPublisher publisher;
        if (call.body() == null) {
            publisher = HttpRequest.BodyPublishers.noBody();
        } else if (call.body() instanceof String) {
            publisher = HttpRequest.BodyPublishers.ofString((String) call.body(), StandardCharsets.UTF_8);
        } else {
            publisher = HttpRequest.BodyPublishers.ofString(toJson(call.body()), StandardCharsets.UTF_8);
            if (!hasContentType) {
                builder.header("Content-Type", "application/json");
            }
        }

        return builder.method(call.method().toUpperCase(Locale.ROOT), publisher).build();
    }

    private static String toJson(Object body) {
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Request body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    static Object parseJson(String body) {
        if (body == null) {
            return null;
        }
        String trimmed = body.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return null;
        }
        try {
            return MAPPER.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static Map<String, String> firstValues(Map<String, List<String>> headers) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                result.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return result;
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
