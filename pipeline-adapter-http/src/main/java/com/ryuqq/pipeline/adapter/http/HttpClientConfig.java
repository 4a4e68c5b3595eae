package com.ryuqq.pipeline.adapter.http;

/**
 * JdkHttpTransport 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>connectTimeoutMs: 연결 타임아웃 (기본 10000ms)</li>
 *   <li>followRedirects: 리다이렉트 추적 여부 (기본 true)</li>
 * </ul>
 *
 * <p>요청 단위 타임아웃은 Step 설정의 {@code timeout}을 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param connectTimeoutMs 연결 타임아웃 (밀리초, 양수여야 함)
 * @param followRedirects 리다이렉트 추적 여부
 */
public record HttpClientConfig(
    long connectTimeoutMs,
    boolean followRedirects
) {

    public HttpClientConfig() {
        this(10000, true);
    }

    public HttpClientConfig {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")"
            );
        }
    }

    public HttpClientConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new HttpClientConfig(connectTimeoutMs, followRedirects);
    }

    public HttpClientConfig withFollowRedirects(boolean followRedirects) {
        return new HttpClientConfig(connectTimeoutMs, followRedirects);
    }
}
