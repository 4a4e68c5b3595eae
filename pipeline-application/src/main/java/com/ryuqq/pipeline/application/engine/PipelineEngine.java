package com.ryuqq.pipeline.application.engine;

import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.step.StepTemplate;
import com.ryuqq.pipeline.core.validation.ValidationResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 파이프라인 엔진 진입점.
 *
 * <p>전송 계층 어댑터(HTTP 라우트, SSE, WebSocket)가 호출하는 유일한 인터페이스입니다.</p>
 *
 * <p><strong>핵심 연산:</strong></p>
 * <ul>
 *   <li>{@link #validate}: 동기 검증</li>
 *   <li>{@link #execute}: 검증 후 백그라운드 실행, 실행 ID와 이벤트 스트림 반환</li>
 *   <li>{@link #cancel}: 최선 노력(best-effort) 협력적 취소</li>
 * </ul>
 *
 * <p><strong>레지스트리 연산:</strong> {@link #find}, {@link #activeExecutions},
 * {@link #evictFinished}로 실행 기록을 조회하고 종료된 실행을 정리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PipelineEngine {

    /**
     * 파이프라인 정의 검증.
     *
     * @param definition 정의
     * @return 검증 결과
     */
    ValidationResult validate(PipelineDefinition definition);

    /**
     * 파이프라인 실행 시작.
     *
     * @param definition 정의
     * @param initialVariables 초기 변수 (선언된 변수 기본값을 덮어씀)
     * @param options dry_run, debug_mode
     * @return 실행 핸들
     * @throws com.ryuqq.pipeline.core.error.PipelineValidationException 검증 실패 시 (어떤 Step도 실행되지 않음)
     */
    ExecutionHandle execute(PipelineDefinition definition, Map<String, Object> initialVariables, ExecuteOptions options);

    /**
     * 실행 취소 요청.
     *
     * @param executionId 실행 ID
     * @return 요청이 접수되면 true, 알 수 없거나 이미 종료된 실행이면 false
     */
    boolean cancel(ExecutionId executionId);

    /**
     * 실행 일시 중지 요청.
     *
     * <p>중지된 실행은 새 Step을 디스패치하지 않으며, 실행 중인 Step은 끝까지 수행됩니다.
     * 전체 타임아웃은 중지 중에도 계속 적용됩니다.</p>
     *
     * @param executionId 실행 ID
     * @return 요청이 접수되면 true, 알 수 없거나 종료, 취소 중인 실행이면 false
     */
    boolean pause(ExecutionId executionId);

    /**
     * 일시 중지된 실행 재개.
     *
     * @param executionId 실행 ID
     * @return 중지 요청된 실행이 재개되면 true
     */
    boolean resume(ExecutionId executionId);

    Optional<PipelineExecution> find(ExecutionId executionId);

    List<PipelineExecution> activeExecutions();

    /**
     * 종료 후 일정 시간이 지난 실행 제거.
     *
     * @param olderThan 종료 후 경과 시간
     * @return 제거된 실행 수
     */
    int evictFinished(Duration olderThan);

    EngineStatus status();

    List<StepTemplate> stepTemplates();
}
