package com.ryuqq.pipeline.adapter.runner;

/**
 * 고정 백오프 계산기.
 *
 * <p>Step 재시도 사이의 대기 시간은 시도 횟수와 무관하게 일정합니다.</p>
 *
 * <pre>
 * delay(attempt) = fixedDelayMs
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long fixedDelayMs;

    /**
     * 기본 설정으로 생성 (1000ms).
     */
    public BackoffCalculator() {
        this(1000);
    }

    /**
     * @param fixedDelayMs 재시도 간 대기 시간 (밀리초, 0 이상)
     * @throws IllegalArgumentException fixedDelayMs가 음수인 경우
     */
    public BackoffCalculator(long fixedDelayMs) {
        if (fixedDelayMs < 0) {
            throw new IllegalArgumentException(
                "fixedDelayMs must not be negative (current: " + fixedDelayMs + ")"
            );
        }
        this.fixedDelayMs = fixedDelayMs;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param retryNumber 몇 번째 재시도인지 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }
        return fixedDelayMs;
    }

    public long getFixedDelayMs() {
        return fixedDelayMs;
    }
}
