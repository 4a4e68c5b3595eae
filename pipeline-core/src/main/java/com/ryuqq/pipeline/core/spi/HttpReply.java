package com.ryuqq.pipeline.core.spi;

import java.util.Map;

/**
 * HTTP response returned by an {@link HttpTransport}.
 *
 * @param statusCode status code
 * @param headers response headers (first value per name)
 * @param body raw body text
 * @param json parsed JSON body when the body was JSON, otherwise null
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HttpReply(
    int statusCode,
    Map<String, String> headers,
    String body,
    Object json
) {

    public HttpReply {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * JSON body when available, raw text otherwise.
     */
    public Object content() {
        return json != null ? json : body;
    }
}
