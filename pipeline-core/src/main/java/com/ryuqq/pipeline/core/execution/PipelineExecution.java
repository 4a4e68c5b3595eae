package com.ryuqq.pipeline.core.execution;

import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.statemachine.ExecutionStatus;
import com.ryuqq.pipeline.core.statemachine.StateTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 실행(run) 단위 기록.
 *
 * <p>실행 시작 시 생성되고 Orchestrator만 변경합니다. 상태가 COMPLETED, FAILED,
 * CANCELLED에 도달하면 더 이상 바뀌지 않습니다.</p>
 *
 * <p><strong>집계:</strong> {@link #getTotalCost()}와 {@link #getTotalTokens()}는
 * 종료된 {@link StepExecution}의 합으로 계산되며 별도로 저장하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PipelineExecution {

    private final ExecutionId executionId;
    private final String pipelineId;
    private final boolean dryRun;
    private final Map<String, StepExecution> steps = new LinkedHashMap<>();

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private Map<String, Object> finalOutput;
    private String error;

    public PipelineExecution(ExecutionId executionId, String pipelineId, boolean dryRun) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        if (pipelineId == null) {
            throw new IllegalArgumentException("pipelineId cannot be null");
        }
        this.executionId = executionId;
        this.pipelineId = pipelineId;
        this.dryRun = dryRun;
    }

    public synchronized void start() {
        status = StateTransition.transition(status, ExecutionStatus.RUNNING);
        startedAt = Instant.now();
    }

    public synchronized void addStep(StepExecution step) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot add step to terminal execution: " + executionId);
        }
        steps.put(step.getStepId(), step);
    }

    public synchronized void complete(Map<String, Object> finalOutput) {
        status = StateTransition.transition(status, ExecutionStatus.COMPLETED);
        this.finalOutput = finalOutput == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(finalOutput));
        this.finishedAt = Instant.now();
    }

    public synchronized void fail(String error) {
        status = StateTransition.transition(status, ExecutionStatus.FAILED);
        this.error = error;
        this.finishedAt = Instant.now();
    }

    public synchronized void cancel() {
        status = StateTransition.transition(status, ExecutionStatus.CANCELLED);
        this.error = "Execution cancelled";
        this.finishedAt = Instant.now();
    }

    public synchronized void pause() {
        status = StateTransition.transition(status, ExecutionStatus.PAUSED);
    }

    public synchronized void resume() {
        status = StateTransition.transition(status, ExecutionStatus.RUNNING);
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized boolean isFinished() {
        return status.isTerminal();
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized Map<String, Object> getFinalOutput() {
        return finalOutput;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized List<StepExecution> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps.values()));
    }

    public synchronized Optional<StepExecution> getStep(String stepId) {
        return Optional.ofNullable(steps.get(stepId));
    }

    public synchronized double getTotalCost() {
        double total = 0.0;
        for (StepExecution step : steps.values()) {
            if (step.getStatus().isTerminal()) {
                total += step.getCost();
            }
        }
        return total;
    }

    public synchronized long getTotalTokens() {
        long total = 0;
        for (StepExecution step : steps.values()) {
            if (step.getStatus().isTerminal()) {
                total += step.getTokensUsed();
            }
        }
        return total;
    }

    public synchronized int getStepsCompleted() {
        int completed = 0;
        for (StepExecution step : steps.values()) {
            if (step.getStatus() == ExecutionStatus.COMPLETED) {
                completed++;
            }
        }
        return completed;
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
        return "PipelineExecution{" + executionId.getValue() + ", " + status
            + ", steps=" + steps.size() + '}';
    }
}
