package com.ryuqq.pipeline.adapter.runner;

/**
 * 파이프라인 러너 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retryBackoffMs: 재시도 사이 고정 대기 시간 (기본 1000ms)</li>
 *   <li>completionPollMs: 코디네이터가 Step 완료를 기다리는 최대 간격, 전체 타임아웃 확인 주기 (기본 50ms)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중인 작업 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param retryBackoffMs 재시도 간 고정 백오프 (0 이상)
 * @param completionPollMs 완료 대기 주기 (양수)
 * @param shutdownTimeoutMs 종료 대기 시간 (양수)
 */
public record RunnerConfig(
    long retryBackoffMs,
    long completionPollMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: retryBackoffMs=1000ms, completionPollMs=50ms, shutdownTimeoutMs=60000ms</p>
     */
    public RunnerConfig() {
        this(1000, 50, 60000);
    }

    public RunnerConfig {
        if (retryBackoffMs < 0) {
            throw new IllegalArgumentException(
                "retryBackoffMs must not be negative (current: " + retryBackoffMs + ")"
            );
        }
        if (completionPollMs <= 0) {
            throw new IllegalArgumentException(
                "completionPollMs must be positive (current: " + completionPollMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * retryBackoffMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withRetryBackoffMs(long retryBackoffMs) {
        return new RunnerConfig(retryBackoffMs, completionPollMs, shutdownTimeoutMs);
    }

    /**
     * completionPollMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withCompletionPollMs(long completionPollMs) {
        return new RunnerConfig(retryBackoffMs, completionPollMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new RunnerConfig(retryBackoffMs, completionPollMs, shutdownTimeoutMs);
    }
}
