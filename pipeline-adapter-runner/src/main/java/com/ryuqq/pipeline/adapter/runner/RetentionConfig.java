package com.ryuqq.pipeline.adapter.runner;

/**
 * ExecutionReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 300000ms = 5분)</li>
 *   <li>retentionMs: 종료된 실행 보관 기간 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param retentionMs 보관 기간 (밀리초, 0 이상이어야 함)
 */
public record RetentionConfig(
    long scanIntervalMs,
    long retentionMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=300000ms (5분), retentionMs=3600000ms (1시간)</p>
     */
    public RetentionConfig() {
        this(300000, 3600000);
    }

    public RetentionConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (retentionMs < 0) {
            throw new IllegalArgumentException(
                "retentionMs must not be negative (current: " + retentionMs + ")"
            );
        }
    }

    public RetentionConfig withScanIntervalMs(long scanIntervalMs) {
        return new RetentionConfig(scanIntervalMs, retentionMs);
    }

    public RetentionConfig withRetentionMs(long retentionMs) {
        return new RetentionConfig(scanIntervalMs, retentionMs);
    }
}
