package com.ryuqq.pipeline.core.model;

/**
 * Step 간 데이터 흐름 간선.
 *
 * <p>source Step의 출력 이름이 target Step의 입력 이름으로 바인딩됩니다.
 * {@code depends_on}과 함께 의존 그래프의 간선이 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param sourceStepId 출력을 내는 Step ID
 * @param sourceOutput source Step의 출력 이름
 * @param targetStepId 입력을 받는 Step ID
 * @param targetInput target Step의 입력 이름
 */
public record Connection(
    String sourceStepId,
    String sourceOutput,
    String targetStepId,
    String targetInput
) {

    public Connection {
        if (sourceStepId == null || sourceStepId.isBlank()) {
            throw new IllegalArgumentException("sourceStepId cannot be null or blank");
        }
        if (targetStepId == null || targetStepId.isBlank()) {
            throw new IllegalArgumentException("targetStepId cannot be null or blank");
        }
        if (sourceOutput == null || sourceOutput.isBlank()) {
            throw new IllegalArgumentException("sourceOutput cannot be null or blank");
        }
        if (targetInput == null || targetInput.isBlank()) {
            throw new IllegalArgumentException("targetInput cannot be null or blank");
        }
    }
}
