package com.ryuqq.pipeline.application.engine;

import com.ryuqq.pipeline.core.model.StepType;

import java.util.Set;

/**
 * 엔진 상태 요약 (헬스 체크용).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param activeExecutions 실행 중인 실행 수
 * @param retainedExecutions 레지스트리에 남아 있는 실행 수 (종료 포함)
 * @param availableExecutors 등록된 Step 종류
 */
public record EngineStatus(
    int activeExecutions,
    int retainedExecutions,
    Set<StepType> availableExecutors
) {

    public EngineStatus {
        availableExecutors = availableExecutors == null ? Set.of() : Set.copyOf(availableExecutors);
    }

    public boolean isHealthy() {
        return availableExecutors.size() == StepType.values().length;
    }
}
