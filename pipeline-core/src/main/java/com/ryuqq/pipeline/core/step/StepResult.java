package com.ryuqq.pipeline.core.step;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Step 한 번의 시도 결과 (불변 record).
 *
 * <p>실패는 예외가 아닌 {@code success == false} 값으로 표현되며,
 * Orchestrator가 재시도 정책에 따라 해석합니다.</p>
 *
 * <p><strong>skipSteps:</strong> Condition Step이 선택하지 않은 분기의 Step ID 목록.
 * 다른 실행기는 항상 빈 목록을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param success 성공 여부
 * @param output 출력 값 (실패 시 null)
 * @param error 오류 메시지 (성공 시 null)
 * @param cost 이 시도의 비용
 * @param tokensUsed 이 시도의 토큰 사용량
 * @param executionTime 실행 시간
 * @param metadata 실행기별 부가 정보 (null 값 허용, 순서 유지)
 * @param skipSteps 건너뛸 Step ID 목록
 */
public record StepResult(
    boolean success,
    Object output,
    String error,
    double cost,
    long tokensUsed,
    Duration executionTime,
    Map<String, Object> metadata,
    List<String> skipSteps
) {

    public StepResult {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must not be negative (current: " + cost + ")");
        }
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must not be negative (current: " + tokensUsed + ")");
        }
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error cannot be null or blank for a failed result");
        }
        executionTime = executionTime == null ? Duration.ZERO : executionTime;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        skipSteps = skipSteps == null ? List.of() : List.copyOf(skipSteps);
    }

    public static StepResult success(Object output) {
        return new StepResult(true, output, null, 0.0, 0, Duration.ZERO, Map.of(), List.of());
    }

    public static StepResult success(Object output, double cost, long tokensUsed, Map<String, Object> metadata) {
        return new StepResult(true, output, null, cost, tokensUsed, Duration.ZERO, metadata, List.of());
    }

    public static StepResult failure(String error) {
        return new StepResult(false, null, error, 0.0, 0, Duration.ZERO, Map.of(), List.of());
    }

    public static StepResult failure(String error, double cost, long tokensUsed) {
        return new StepResult(false, null, error, cost, tokensUsed, Duration.ZERO, Map.of(), List.of());
    }

    public StepResult withExecutionTime(Duration executionTime) {
        return new StepResult(success, output, error, cost, tokensUsed, executionTime, metadata, skipSteps);
    }

    public StepResult withSkipSteps(List<String> skipSteps) {
        return new StepResult(success, output, error, cost, tokensUsed, executionTime, metadata, skipSteps);
    }
}
