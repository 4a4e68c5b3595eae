package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;

import java.util.List;
import java.util.Map;

/**
 * Step Contract.
 *
 * <p>Step 종류마다 정확히 하나의 구현이 존재하며, Orchestrator는 이 인터페이스만을 통해
 * Step을 실행합니다. 새 Step 종류를 추가할 때 Orchestrator는 수정하지 않습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 Step이 같은 실행기 인스턴스를 동시에 사용</li>
 *   <li>실패는 {@link StepResult#failure(String)}로 반환 (예외를 던지지 않음)</li>
 *   <li>컨텍스트에 직접 쓰지 않음 (출력은 Orchestrator가 병합)</li>
 *   <li>외부 I/O 직전에 {@link ExecutionContext#checkpoint()} 호출</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StepExecutor {

    /**
     * 이 실행기가 처리하는 Step 종류.
     */
    StepType type();

    /**
     * Step 설정 검증.
     *
     * <p>실행 전 {@code PipelineValidator}가 호출하며 부작용이 없어야 합니다.</p>
     *
     * @param step Step 정의
     * @return 오류 메시지 목록 (유효하면 빈 목록)
     */
    List<String> validate(StepDefinition step);

    /**
     * Step 1회 시도.
     *
     * @param config Step 설정 (템플릿 미해석 상태)
     * @param inputs upstream 출력과 connection으로 바인딩된 입력
     * @param context 실행 컨텍스트 (읽기 전용으로 사용)
     * @return 시도 결과
     */
    StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context);

    /**
     * 부작용 없는 시뮬레이션 실행.
     *
     * <p>기본 구현은 {@link #run}을 그대로 호출하므로 외부 I/O가 있는 실행기는 반드시 재정의해야 합니다.</p>
     */
    default StepResult dryRun(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        return run(config, inputs, context);
    }

    /**
     * 실행 결과에 따라 건너뛸 수 있는 하위 Step ID 목록.
     *
     * <p>Condition Step만 재정의합니다. Orchestrator는 이 목록을 암묵적 의존 간선으로 취급합니다.</p>
     */
    default List<String> branchTargets(StepConfig config) {
        return List.of();
    }
}
