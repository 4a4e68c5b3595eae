package com.ryuqq.pipeline.adapter.http;

/**
 * OllamaModelClient 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: 서버 주소 (기본 http://localhost:11434)</li>
 *   <li>requestTimeoutMs: 요청 타임아웃 (기본 120000ms = 2분)</li>
 *   <li>connectTimeoutMs: 연결 타임아웃 (기본 10000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param baseUrl 서버 주소 (끝의 '/'는 제거됨)
 * @param requestTimeoutMs 요청 타임아웃 (밀리초, 양수여야 함)
 * @param connectTimeoutMs 연결 타임아웃 (밀리초, 양수여야 함)
 */
public record OllamaConfig(
    String baseUrl,
    long requestTimeoutMs,
    long connectTimeoutMs
) {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    public OllamaConfig() {
        this(DEFAULT_BASE_URL, 120000, 10000);
    }

    public OllamaConfig {
        baseUrl = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl.trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")"
            );
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")"
            );
        }
    }

    public OllamaConfig withBaseUrl(String baseUrl) {
        return new OllamaConfig(baseUrl, requestTimeoutMs, connectTimeoutMs);
    }

    public OllamaConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new OllamaConfig(baseUrl, requestTimeoutMs, connectTimeoutMs);
    }
}
