package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.spi.EventChannel;
import com.ryuqq.pipeline.core.spi.ExecutionStore;
import com.ryuqq.pipeline.core.step.StepExecutorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DAG 기반 파이프라인 Runner.
 *
 * <p>실행마다 하나의 코디네이터 스레드가 의존성 그래프를 따라 Step을 디스패치하고,
 * 해당 실행의 모든 이벤트를 발행합니다.</p>
 *
 * <p><strong>스레드 구성:</strong></p>
 * <ul>
 *   <li>{@code pipeline-coordinator-*}: 실행별 스케줄링 루프 (이벤트 발행 단일 지점)</li>
 *   <li>{@code pipeline-step-*}: Step별 재시도 루프</li>
 *   <li>{@code pipeline-attempt-*}: 타임아웃이 적용되는 시도 1회</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>실행 단위 동시 Step 수는 {@code PipelineSettings.concurrencyLimit}으로 제한</li>
 *   <li>Step 출력의 컨텍스트 병합은 코디네이터 스레드에서만 수행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DagPipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(DagPipelineRunner.class);

    private final StepExecutorRegistry executors;
    private final EventChannel eventChannel;
    private final ExecutionStore executionStore;
    private final RunnerConfig config;
    private final ExecutorService coordinatorExecutor;
    private final ExecutorService stepExecutor;
    private final ExecutorService attemptExecutor;
    private final StepAttemptRunner attemptRunner;
    private final Map<ExecutionId, PipelineRun> activeRuns = new ConcurrentHashMap<>();

    /**
     * 생성자 (기본 RunnerConfig 사용).
     */
    public DagPipelineRunner(StepExecutorRegistry executors, EventChannel eventChannel, ExecutionStore executionStore) {
        this(executors, eventChannel, executionStore, new RunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param executors Step 실행기 레지스트리
     * @param eventChannel 이벤트 채널
     * @param executionStore 종료된 실행 기록 저장소
     * @param config Runner 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DagPipelineRunner(StepExecutorRegistry executors, EventChannel eventChannel,
                             ExecutionStore executionStore, RunnerConfig config) {
        if (executors == null) {
            throw new IllegalArgumentException("executors cannot be null");
        }
        if (eventChannel == null) {
            throw new IllegalArgumentException("eventChannel cannot be null");
        }
        if (executionStore == null) {
            throw new IllegalArgumentException("executionStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.executors = executors;
        this.eventChannel = eventChannel;
        this.executionStore = executionStore;
        this.config = config;
        this.coordinatorExecutor = Executors.newCachedThreadPool(namedThreadFactory("pipeline-coordinator-"));
        this.stepExecutor = Executors.newCachedThreadPool(namedThreadFactory("pipeline-step-"));
        this.attemptExecutor = Executors.newCachedThreadPool(namedThreadFactory("pipeline-attempt-"));
        this.attemptRunner = new StepAttemptRunner(attemptExecutor, new BackoffCalculator(config.retryBackoffMs()));
    }

    /**
     * 실행 시작.
     *
     * <p>호출 즉시 반환하며 실행은 코디네이터 스레드에서 진행됩니다.</p>
     *
     * @param definition 검증을 통과한 파이프라인 정의
     * @param execution PENDING 상태의 실행 기록
     * @param context 실행 컨텍스트
     * @return 종료된 실행 기록으로 완료되는 Future
     */
    public CompletableFuture<PipelineExecution> start(PipelineDefinition definition, PipelineExecution execution,
                                                      ExecutionContext context) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        CompletableFuture<PipelineExecution> completion = new CompletableFuture<>();
        PipelineRun run = new PipelineRun(definition, execution, context, executors, eventChannel,
            executionStore, attemptRunner, stepExecutor, config, completion);

        if (activeRuns.putIfAbsent(execution.getExecutionId(), run) != null) {
            throw new IllegalStateException("Execution already running: " + execution.getExecutionId());
        }
        completion.whenComplete((result, error) -> activeRuns.remove(execution.getExecutionId()));
        eventChannel.open(execution.getExecutionId());
        coordinatorExecutor.submit(run);
        return completion;
    }

    /**
     * 실행 취소 요청.
     *
     * @param executionId 실행 ID
     * @return 진행 중인 실행이 취소 요청을 수락하면 true
     */
    public boolean cancel(ExecutionId executionId) {
        PipelineRun run = activeRuns.get(executionId);
        if (run == null) {
            return false;
        }
        return run.requestCancel();
    }

    public boolean pause(ExecutionId executionId) {
        PipelineRun run = activeRuns.get(executionId);
        return run != null && run.requestPause();
    }

    public boolean resume(ExecutionId executionId) {
        PipelineRun run = activeRuns.get(executionId);
        return run != null && run.requestResume();
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    /**
     * Runner 종료.
     *
     * <p>진행 중인 실행에 취소를 요청하고 코디네이터가 끝나기를 기다립니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        List<PipelineRun> runs = new ArrayList<>(activeRuns.values());
        for (PipelineRun run : runs) {
            run.requestCancel();
        }
        log.info("Shutting down pipeline runner: {} active runs", runs.size());

        coordinatorExecutor.shutdown();
        if (!coordinatorExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            coordinatorExecutor.shutdownNow();
        }
        stepExecutor.shutdownNow();
        attemptExecutor.shutdownNow();
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
