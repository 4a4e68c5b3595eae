package com.ryuqq.pipeline.core.event;

import com.ryuqq.pipeline.core.model.ExecutionId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 전이 하나에 대응하는 실행 이벤트 (불변 record).
 *
 * <p>소비자가 엔진을 다시 조회하지 않고도 실행/Step 상태를 재구성할 수 있도록
 * 필요한 필드를 모두 담습니다. 이벤트 종류와 무관한 필드는 null이며
 * 전송 어댑터가 인코딩 시 생략합니다.</p>
 *
 * <p><strong>종류별 필드:</strong></p>
 * <ul>
 *   <li>started: pipelineId, totalSteps</li>
 *   <li>step_started: stepId, stepName, stepIndex, totalSteps</li>
 *   <li>step_completed: result, executionTime, cost, tokensUsed, totalCost, totalTokens</li>
 *   <li>step_failed: error, executionTime, cost, tokensUsed, totalCost, totalTokens</li>
 *   <li>step_skipped: stepId, stepName, stepIndex</li>
 *   <li>completed: finalOutput, executionTime, totalCost, totalTokens, stepsCompleted</li>
 *   <li>failed / cancelled: error, executionTime, totalCost, totalTokens, stepsCompleted</li>
 * </ul>
 *
 * <p>{@code sequence}는 이벤트 채널이 게시 시점에 부여하는 실행 내 단조 증가 번호입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutionEvent(
    ExecutionEventType type,
    ExecutionId executionId,
    long sequence,
    Instant timestamp,
    String pipelineId,
    String stepId,
    String stepName,
    Integer stepIndex,
    Integer totalSteps,
    Object result,
    Double executionTime,
    Double cost,
    Long tokensUsed,
    String error,
    Map<String, Object> finalOutput,
    Double totalCost,
    Long totalTokens,
    Integer stepsCompleted,
    Map<String, Object> debug
) {

    public ExecutionEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        finalOutput = finalOutput == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(finalOutput));
        debug = debug == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(debug));
    }

    public static ExecutionEvent started(ExecutionId executionId, String pipelineId, int totalSteps) {
        return new ExecutionEvent(ExecutionEventType.STARTED, executionId, 0, null, pipelineId,
            null, null, null, totalSteps, null, null, null, null, null, null, null, null, null, null);
    }

    public static ExecutionEvent stepStarted(ExecutionId executionId, String stepId, String stepName,
                                             int stepIndex, int totalSteps) {
        return new ExecutionEvent(ExecutionEventType.STEP_STARTED, executionId, 0, null, null,
            stepId, stepName, stepIndex, totalSteps, null, null, null, null, null, null, null, null, null, null);
    }

    public static ExecutionEvent stepCompleted(ExecutionId executionId, String stepId, String stepName,
                                               int stepIndex, Object result, double executionTime,
                                               double cost, long tokensUsed,
                                               double totalCost, long totalTokens) {
        return new ExecutionEvent(ExecutionEventType.STEP_COMPLETED, executionId, 0, null, null,
            stepId, stepName, stepIndex, null, result, executionTime, cost, tokensUsed, null, null,
            totalCost, totalTokens, null, null);
    }

    public static ExecutionEvent stepFailed(ExecutionId executionId, String stepId, String stepName,
                                            int stepIndex, String error, double executionTime,
                                            double cost, long tokensUsed,
                                            double totalCost, long totalTokens) {
        return new ExecutionEvent(ExecutionEventType.STEP_FAILED, executionId, 0, null, null,
            stepId, stepName, stepIndex, null, null, executionTime, cost, tokensUsed, error, null,
            totalCost, totalTokens, null, null);
    }

    public static ExecutionEvent stepSkipped(ExecutionId executionId, String stepId, String stepName,
                                             int stepIndex, String reason) {
        return new ExecutionEvent(ExecutionEventType.STEP_SKIPPED, executionId, 0, null, null,
            stepId, stepName, stepIndex, null, null, null, null, null, reason, null, null, null, null, null);
    }

    public static ExecutionEvent completed(ExecutionId executionId, Map<String, Object> finalOutput,
                                           double executionTime, double totalCost, long totalTokens,
                                           int stepsCompleted) {
        return new ExecutionEvent(ExecutionEventType.COMPLETED, executionId, 0, null, null,
            null, null, null, null, null, executionTime, null, null, null, finalOutput,
            totalCost, totalTokens, stepsCompleted, null);
    }

    public static ExecutionEvent failed(ExecutionId executionId, String error, double executionTime,
                                        double totalCost, long totalTokens, int stepsCompleted) {
        return new ExecutionEvent(ExecutionEventType.FAILED, executionId, 0, null, null,
            null, null, null, null, null, executionTime, null, null, error, null,
            totalCost, totalTokens, stepsCompleted, null);
    }

    public static ExecutionEvent cancelled(ExecutionId executionId, double executionTime,
                                           double totalCost, long totalTokens, int stepsCompleted) {
        return new ExecutionEvent(ExecutionEventType.CANCELLED, executionId, 0, null, null,
            null, null, null, null, null, executionTime, null, null, "Execution cancelled", null,
            totalCost, totalTokens, stepsCompleted, null);
    }

    /**
     * 채널이 부여한 순번을 적용한 복사본.
     */
    public ExecutionEvent withSequence(long sequence) {
        return new ExecutionEvent(type, executionId, sequence, timestamp, pipelineId, stepId, stepName,
            stepIndex, totalSteps, result, executionTime, cost, tokensUsed, error, finalOutput,
            totalCost, totalTokens, stepsCompleted, debug);
    }

    /**
     * debug_mode 실행에서 진단 정보를 덧붙인 복사본.
     */
    public ExecutionEvent withDebug(Map<String, Object> debug) {
        return new ExecutionEvent(type, executionId, sequence, timestamp, pipelineId, stepId, stepName,
            stepIndex, totalSteps, result, executionTime, cost, tokensUsed, error, finalOutput,
            totalCost, totalTokens, stepsCompleted, debug);
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }
}
