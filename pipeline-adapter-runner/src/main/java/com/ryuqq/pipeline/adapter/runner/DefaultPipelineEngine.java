package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.application.engine.EngineStatus;
import com.ryuqq.pipeline.application.engine.ExecuteOptions;
import com.ryuqq.pipeline.application.engine.ExecutionHandle;
import com.ryuqq.pipeline.application.engine.PipelineEngine;
import com.ryuqq.pipeline.application.registry.ExecutionRegistry;
import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.PipelineValidationException;
import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.spi.EventChannel;
import com.ryuqq.pipeline.core.spi.ExecutionStore;
import com.ryuqq.pipeline.core.step.StepExecutorRegistry;
import com.ryuqq.pipeline.core.step.StepTemplate;
import com.ryuqq.pipeline.core.step.StepTemplateCatalog;
import com.ryuqq.pipeline.core.validation.PipelineValidator;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * PipelineEngine 기본 구현체.
 *
 * <p>검증, 실행 등록, DAG Runner 위임, 종료된 실행 정리를 하나의 진입점으로 묶습니다.</p>
 *
 * <p><strong>execute 흐름:</strong></p>
 * <pre>
 * 1. validate(definition) → 오류가 있으면 PipelineValidationException (디스패치 없음)
 * 2. 변수 준비: 정의의 기본값 위에 초기 변수 덮어쓰기
 * 3. ExecutionId 생성 → PipelineExecution 등록
 * 4. DagPipelineRunner.start() → ExecutionHandle 반환 (비동기)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultPipelineEngine implements PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineEngine.class);

    private final StepExecutorRegistry executors;
    private final PipelineValidator validator;
    private final ExecutionRegistry registry;
    private final EventChannel eventChannel;
    private final DagPipelineRunner runner;
    private final ExecutionReaper reaper;

    /**
     * 생성자 (기본 설정 사용).
     */
    public DefaultPipelineEngine(StepExecutorRegistry executors, ExecutionRegistry registry,
                                 EventChannel eventChannel, ExecutionStore executionStore) {
        this(executors, registry, eventChannel, executionStore, new RunnerConfig(), new RetentionConfig());
    }

    /**
     * 생성자.
     *
     * @param executors Step 실행기 레지스트리
     * @param registry 실행 레지스트리
     * @param eventChannel 이벤트 채널
     * @param executionStore 종료된 실행 기록 저장소
     * @param runnerConfig Runner 설정
     * @param retentionConfig 종료 실행 보관 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultPipelineEngine(StepExecutorRegistry executors, ExecutionRegistry registry,
                                 EventChannel eventChannel, ExecutionStore executionStore,
                                 RunnerConfig runnerConfig, RetentionConfig retentionConfig) {
        if (executors == null) {
            throw new IllegalArgumentException("executors cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (eventChannel == null) {
            throw new IllegalArgumentException("eventChannel cannot be null");
        }
        this.executors = executors;
        this.validator = new PipelineValidator(executors);
        this.registry = registry;
        this.eventChannel = eventChannel;
        this.runner = new DagPipelineRunner(executors, eventChannel, executionStore, runnerConfig);
        this.reaper = new ExecutionReaper(registry, eventChannel, retentionConfig);
    }

    @Override
    public ValidationResult validate(PipelineDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        return validator.validate(definition);
    }

    @Override
    public ExecutionHandle execute(PipelineDefinition definition, Map<String, Object> initialVariables,
                                   ExecuteOptions options) {
        ExecuteOptions effective = options == null ? ExecuteOptions.defaults() : options;

        // 1. 검증
        ValidationResult result = validate(definition);
        if (!result.valid()) {
            log.warn("Rejected invalid pipeline {}: {}", definition.id(), result.errors());
            throw new PipelineValidationException(result);
        }

        // 2. 변수 준비
        Map<String, Object> variables = new LinkedHashMap<>(definition.variables());
        if (initialVariables != null) {
            variables.putAll(initialVariables);
        }

        // 3. 실행 등록
        ExecutionId executionId = ExecutionId.generate();
        PipelineExecution execution = new PipelineExecution(executionId, definition.id(), effective.dryRun());
        ExecutionContext context = new ExecutionContext(executionId, definition.id(), variables,
            definition.steps().size(), effective.debugMode());
        registry.register(execution);

        // 4. 비동기 실행
        CompletableFuture<PipelineExecution> completion = runner.start(definition, execution, context);
        log.info("Execution accepted: executionId={}, pipelineId={}, dryRun={}, debugMode={}",
            executionId, definition.id(), effective.dryRun(), effective.debugMode());
        return new ExecutionHandle(executionId, eventChannel, completion);
    }

    @Override
    public boolean cancel(ExecutionId executionId) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        boolean accepted = runner.cancel(executionId);
        if (!accepted) {
            log.debug("Cancel ignored for unknown or finished execution {}", executionId);
        }
        return accepted;
    }

    @Override
    public boolean pause(ExecutionId executionId) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        return runner.pause(executionId);
    }

    @Override
    public boolean resume(ExecutionId executionId) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        return runner.resume(executionId);
    }

    @Override
    public Optional<PipelineExecution> find(ExecutionId executionId) {
        return registry.find(executionId);
    }

    @Override
    public List<PipelineExecution> activeExecutions() {
        return registry.active();
    }

    @Override
    public int evictFinished(Duration olderThan) {
        if (olderThan == null || olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan cannot be null or negative");
        }
        return reaper.evictFinishedBefore(reaper.now().minus(olderThan));
    }

    @Override
    public EngineStatus status() {
        return new EngineStatus(runner.activeRunCount(), registry.size(), executors.registeredTypes());
    }

    @Override
    public List<StepTemplate> stepTemplates() {
        return StepTemplateCatalog.templates();
    }

    /**
     * 주기 정리에 사용할 Reaper.
     */
    public ExecutionReaper reaper() {
        return reaper;
    }

    /**
     * 엔진 종료 (진행 중인 실행 취소 후 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        runner.shutdown();
    }
}
