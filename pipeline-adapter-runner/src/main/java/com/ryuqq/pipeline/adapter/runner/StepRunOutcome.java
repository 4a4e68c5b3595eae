package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.step.StepResult;

/**
 * 재시도를 모두 마친 Step의 최종 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param kind 결과 종류
 * @param result 마지막 시도의 결과 (취소, 엔진 오류 시 null일 수 있음)
 * @param attempts 수행한 시도 횟수
 * @param error 실패, 취소 시 오류 메시지
 * @param fault 엔진 오류 원인 (FAULT일 때만)
 */
public record StepRunOutcome(
    Kind kind,
    StepResult result,
    int attempts,
    String error,
    Throwable fault
) {

    /**
     * 결과 종류.
     */
    public enum Kind {
        COMPLETED,
        FAILED,
        CANCELLED,
        FAULT
    }

    public StepRunOutcome {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative (current: " + attempts + ")");
        }
    }

    static StepRunOutcome completed(StepResult result, int attempts) {
        return new StepRunOutcome(Kind.COMPLETED, result, attempts, null, null);
    }

    static StepRunOutcome failed(StepResult result, int attempts, String error) {
        return new StepRunOutcome(Kind.FAILED, result, attempts, error, null);
    }

    static StepRunOutcome cancelled(int attempts, String error) {
        return new StepRunOutcome(Kind.CANCELLED, null, attempts, error == null ? "Step cancelled" : error, null);
    }

    static StepRunOutcome fault(int attempts, Throwable fault) {
        return new StepRunOutcome(Kind.FAULT, null, attempts, fault.getMessage(), fault);
    }
}
