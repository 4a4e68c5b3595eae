package com.ryuqq.pipeline.core.spi;

import java.time.Duration;
import java.util.Map;

/**
 * Outbound HTTP request description.
 *
 * @param method HTTP method in upper case
 * @param url absolute URL
 * @param headers request headers
 * @param body a {@link Map} or {@link java.util.List} to be sent as JSON, a String sent as-is, or null
 * @param timeout per-call timeout
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HttpCall(
    String method,
    String url,
    Map<String, String> headers,
    Object body,
    Duration timeout
) {

    public HttpCall {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
