package com.ryuqq.pipeline.core.execution;

import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.statemachine.ExecutionStatus;
import com.ryuqq.pipeline.core.statemachine.StateTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * (실행, Step) 쌍 하나에 대한 실행 기록.
 *
 * <p>디스패치(또는 스킵) 시점에 생성되고 종료 상태에서 확정됩니다.
 * Orchestrator만 상태를 변경하며, 조회는 어느 스레드에서든 안전합니다.</p>
 *
 * <p><strong>비용 집계:</strong> cost와 tokensUsed는 모든 시도의 합계입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepExecution {

    private final String stepId;
    private final String stepName;
    private final StepType stepType;
    private final int stepIndex;

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private double cost;
    private long tokensUsed;
    private Map<String, Object> inputSnapshot = Map.of();
    private Object output;
    private String error;
    private int attempts;

    public StepExecution(String stepId, String stepName, StepType stepType, int stepIndex) {
        if (stepId == null) {
            throw new IllegalArgumentException("stepId cannot be null");
        }
        if (stepType == null) {
            throw new IllegalArgumentException("stepType cannot be null");
        }
        this.stepId = stepId;
        this.stepName = stepName;
        this.stepType = stepType;
        this.stepIndex = stepIndex;
    }

    public synchronized void start(Map<String, Object> inputs) {
        status = StateTransition.transition(status, ExecutionStatus.RUNNING);
        startedAt = Instant.now();
        inputSnapshot = inputs == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    /**
     * 시도 1회의 사용량 누적. 종료된 기록에는 반영하지 않습니다.
     */
    public synchronized void recordAttempt(double attemptCost, long attemptTokens) {
        if (status.isTerminal()) {
            return;
        }
        attempts++;
        cost += attemptCost;
        tokensUsed += attemptTokens;
    }

    public synchronized void complete(Object output) {
        status = StateTransition.transition(status, ExecutionStatus.COMPLETED);
        this.output = output;
        this.finishedAt = Instant.now();
    }

    public synchronized void fail(String error) {
        status = StateTransition.transition(status, ExecutionStatus.FAILED);
        this.error = error;
        this.finishedAt = Instant.now();
    }

    public synchronized void cancel(String error) {
        status = StateTransition.transition(status, ExecutionStatus.CANCELLED);
        this.error = error;
        this.finishedAt = Instant.now();
    }

    public synchronized void skip(String reason) {
        status = StateTransition.transition(status, ExecutionStatus.SKIPPED);
        this.error = reason;
        this.startedAt = Instant.now();
        this.finishedAt = startedAt;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    public StepType getStepType() {
        return stepType;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized double getCost() {
        return cost;
    }

    public synchronized long getTokensUsed() {
        return tokensUsed;
    }

    public synchronized Map<String, Object> getInputSnapshot() {
        return inputSnapshot;
    }

    public synchronized Object getOutput() {
        return output;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    /**
     * 첫 시도 이후 재시도한 횟수.
     */
    public synchronized int getRetryCount() {
        return Math.max(0, attempts - 1);
    }

    /**
     * 실행 시간 (초). 시작 전이면 0.
     */
    public synchronized double getExecutionTimeSeconds() {
        if (startedAt == null) {
            return 0.0;
        }
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Duration.between(startedAt, end).toNanos() / 1_000_000_000.0;
    }

    @Override
    public synchronized String toString() {
        return "StepExecution{" + stepId + ", " + status + ", attempts=" + attempts + '}';
    }
}
