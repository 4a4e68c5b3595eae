package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.EngineFaultException;
import com.ryuqq.pipeline.core.event.ExecutionEvent;
import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.execution.StepExecution;
import com.ryuqq.pipeline.core.graph.DependencyGraph;
import com.ryuqq.pipeline.core.model.Connection;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.spi.EventChannel;
import com.ryuqq.pipeline.core.spi.ExecutionStore;
import com.ryuqq.pipeline.core.statemachine.ExecutionStatus;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepExecutorRegistry;
import com.ryuqq.pipeline.core.step.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 1건의 코디네이터.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * started 발행
 *   ↓
 * loop:
 *   1. 취소, 일시 중지 요청 반영 (중지 중에는 2~3 생략)
 *   2. 건너뜀/차단 판정 (고정점까지 반복)
 *   3. 준비된 Step을 선언 순서대로 디스패치 (concurrencyLimit까지)
 *   4. 완료 큐 대기 (completionPollMs) → 결과 병합 + 이벤트 발행
 *   5. 전체 타임아웃 확인
 * 실행 중인 Step이 없고 더 진행할 Step이 없으면 종료
 *   ↓
 * completed | failed | cancelled 발행 → 채널 close → ExecutionStore.save
 * </pre>
 *
 * <p><strong>Step 판정 규칙:</strong></p>
 * <ul>
 *   <li>upstream 중 FAILED/CANCELLED/차단된 Step이 있으면 차단 (실행 기록 없음)</li>
 *   <li>비활성 Step, 선택되지 않은 분기는 SKIPPED</li>
 *   <li>upstream이 모두 선택되지 않은 분기에 속하면 SKIPPED (비활성 Step 뒤의 Step은 실행됨)</li>
 *   <li>upstream이 모두 COMPLETED 또는 SKIPPED면 실행 준비 완료</li>
 * </ul>
 *
 * <p>엔진 오류를 낸 Step은 FAILED로 기록되고, 나머지 실행 중인 Step은 CANCELLED로 기록됩니다.
 * 일시 중지 중에도 전체 타임아웃은 적용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class PipelineRun implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    private static final Completion WAKE_UP = new Completion(null, null);

    private final PipelineDefinition definition;
    private final PipelineExecution execution;
    private final ExecutionContext context;
    private final StepExecutorRegistry executors;
    private final EventChannel eventChannel;
    private final ExecutionStore executionStore;
    private final StepAttemptRunner attemptRunner;
    private final ExecutorService stepExecutor;
    private final RunnerConfig config;
    private final CompletableFuture<PipelineExecution> completion;

    private final DependencyGraph graph;
    private final ExecutionId executionId;
    private final boolean dryRun;
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final InFlightThreads runningThreads = new InFlightThreads();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean pauseRequested = new AtomicBoolean(false);

    // 아래 상태는 코디네이터 스레드 전용
    private final Map<String, ExecutionStatus> states = new HashMap<>();
    private final Map<String, StepExecution> records = new HashMap<>();
    private final Map<String, Map<String, Object>> stepInputs = new HashMap<>();
    private final Set<String> blocked = new LinkedHashSet<>();
    private final Set<String> skipRequested = new HashSet<>();
    private final Set<String> pruned = new HashSet<>();
    private final Set<String> inFlight = new LinkedHashSet<>();
    private boolean cancelling;
    private boolean deadlineExceeded;
    private String failedStepName;
    private String failedStepError;

    PipelineRun(PipelineDefinition definition, PipelineExecution execution, ExecutionContext context,
                StepExecutorRegistry executors, EventChannel eventChannel, ExecutionStore executionStore,
                StepAttemptRunner attemptRunner, ExecutorService stepExecutor, RunnerConfig config,
                CompletableFuture<PipelineExecution> completion) {
        this.definition = definition;
        this.execution = execution;
        this.context = context;
        this.executors = executors;
        this.eventChannel = eventChannel;
        this.executionStore = executionStore;
        this.attemptRunner = attemptRunner;
        this.stepExecutor = stepExecutor;
        this.config = config;
        this.completion = completion;
        this.executionId = execution.getExecutionId();
        this.dryRun = execution.isDryRun();
        this.graph = DependencyGraph.of(definition, step -> executors.find(step.type())
            .map(executor -> executor.branchTargets(step.config()))
            .orElse(List.of()));
        for (StepDefinition step : definition.steps()) {
            states.put(step.id(), ExecutionStatus.PENDING);
        }
    }

    /**
     * 취소 요청 (호출 스레드 무관).
     *
     * @return 아직 종료되지 않은 실행이면 true
     */
    boolean requestCancel() {
        if (completion.isDone() || execution.isFinished()) {
            return false;
        }
        if (cancelRequested.compareAndSet(false, true)) {
            context.requestCancellation();
            completions.offer(WAKE_UP);
            log.info("Cancellation requested: executionId={}", executionId);
        }
        return true;
    }

    /**
     * 일시 중지 요청. 실행 중인 Step은 계속 수행되고 새 디스패치만 멈춥니다.
     *
     * @return 진행 중이고 취소 요청이 없는 실행이면 true
     */
    boolean requestPause() {
        if (completion.isDone() || execution.isFinished() || cancelRequested.get()) {
            return false;
        }
        if (pauseRequested.compareAndSet(false, true)) {
            completions.offer(WAKE_UP);
            log.info("Pause requested: executionId={}", executionId);
        }
        return true;
    }

    /**
     * 재개 요청.
     *
     * @return 일시 중지 요청된 실행이면 true
     */
    boolean requestResume() {
        if (completion.isDone() || execution.isFinished()) {
            return false;
        }
        if (!pauseRequested.compareAndSet(true, false)) {
            return false;
        }
        completions.offer(WAKE_UP);
        log.info("Resume requested: executionId={}", executionId);
        return true;
    }

    @Override
    public void run() {
        long deadlineNanos = System.nanoTime() + definition.settings().globalTimeout().toNanos();
        try {
            execution.start();
            publish(ExecutionEvent.started(executionId, definition.id(), definition.steps().size()));
            log.info("Execution started: executionId={}, pipelineId={}, steps={}, dryRun={}",
                executionId, definition.id(), definition.steps().size(), dryRun);

            while (true) {
                // 1. 취소, 일시 중지 요청 반영
                if (cancelRequested.get() && !cancelling) {
                    cancelling = true;
                }
                boolean paused = applyPauseRequest();

                // 2~3. 판정 및 디스패치
                if (!cancelling && !deadlineExceeded && !paused) {
                    resolvePendingSteps();
                    dispatchReadySteps();
                }

                if (inFlight.isEmpty() && !paused) {
                    if (cancelling || deadlineExceeded) {
                        break;
                    }
                    List<String> stalled = unresolvedSteps();
                    if (!stalled.isEmpty()) {
                        throw new EngineFaultException("Scheduling stalled with pending steps: " + stalled);
                    }
                    break;
                }

                // 5. 전체 타임아웃
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
                if (remainingMs <= 0 && !deadlineExceeded) {
                    onDeadlineExceeded();
                    continue;
                }

                // 4. 완료 대기
                long waitMs = deadlineExceeded
                    ? config.completionPollMs()
                    : Math.max(1, Math.min(config.completionPollMs(), remainingMs));
                Completion next = completions.poll(waitMs, TimeUnit.MILLISECONDS);
                if (next == null || next == WAKE_UP) {
                    continue;
                }
                onStepFinished(next);
            }

            finish();

        } catch (EngineFaultException e) {
            onEngineFault(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onEngineFault(new EngineFaultException("Coordinator interrupted", e));
        } catch (RuntimeException e) {
            onEngineFault(new EngineFaultException("Unexpected coordinator failure: " + e.getMessage(), e));
        } finally {
            eventChannel.close(executionId);
            try {
                executionStore.save(execution);
            } catch (RuntimeException e) {
                log.error("Failed to store execution record: executionId={}", executionId, e);
            }
            completion.complete(execution);
        }
    }

    /**
     * 일시 중지 요청을 실행 상태에 반영.
     *
     * <p>취소 중이거나 전체 타임아웃이 지난 실행은 종료 처리를 위해 RUNNING으로 되돌립니다.</p>
     *
     * @return 현재 일시 중지 상태이면 true
     */
    private boolean applyPauseRequest() {
        boolean wantPaused = pauseRequested.get() && !cancelling && !deadlineExceeded;
        ExecutionStatus status = execution.getStatus();
        if (wantPaused && status == ExecutionStatus.RUNNING) {
            execution.pause();
            log.info("Execution paused: executionId={}, inFlight={}", executionId, inFlight);
        } else if (!wantPaused && status == ExecutionStatus.PAUSED) {
            execution.resume();
            log.info("Execution resumed: executionId={}", executionId);
        }
        return wantPaused;
    }

    /**
     * 모든 upstream이 정리된 PENDING Step의 건너뜀/차단 판정.
     */
    private void resolvePendingSteps() {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (StepDefinition step : definition.steps()) {
                String stepId = step.id();
                if (states.get(stepId) != ExecutionStatus.PENDING || blocked.contains(stepId)) {
                    continue;
                }
                Set<String> upstreams = graph.upstreamsOf(stepId);
                if (!allResolved(upstreams)) {
                    continue;
                }

                if (anyUnsatisfied(upstreams)) {
                    blocked.add(stepId);
                    log.debug("Step blocked by failed upstream: executionId={}, stepId={}", executionId, stepId);
                    changed = true;
                } else if (!step.enabled()) {
                    skip(step, "Step disabled");
                    changed = true;
                } else if (skipRequested.contains(stepId)) {
                    skip(step, "Branch not selected");
                    pruned.add(stepId);
                    changed = true;
                } else if (!upstreams.isEmpty() && allPruned(upstreams)) {
                    skip(step, "All upstream steps skipped");
                    pruned.add(stepId);
                    changed = true;
                }
            }
        }
    }

    private void dispatchReadySteps() {
        int limit = definition.settings().concurrencyLimit();
        for (StepDefinition step : definition.steps()) {
            if (inFlight.size() >= limit) {
                return;
            }
            String stepId = step.id();
            if (states.get(stepId) != ExecutionStatus.PENDING || blocked.contains(stepId)) {
                continue;
            }
            if (allSatisfied(graph.upstreamsOf(stepId))) {
                dispatch(step);
            }
        }
    }

    private void dispatch(StepDefinition step) {
        StepExecutor executor = executors.find(step.type())
            .orElseThrow(() -> new EngineFaultException("No executor registered for step type " + step.type()));

        int stepIndex = definition.indexOf(step.id());
        context.setCurrentStepIndex(stepIndex);

        Map<String, Object> inputs = bindInputs(step);
        StepExecution record = new StepExecution(step.id(), step.name(), step.type(), stepIndex);
        execution.addStep(record);
        record.start(inputs);
        records.put(step.id(), record);
        stepInputs.put(step.id(), inputs);
        states.put(step.id(), ExecutionStatus.RUNNING);
        inFlight.add(step.id());

        ExecutionEvent started = ExecutionEvent.stepStarted(executionId, step.id(), step.name(),
            stepIndex, definition.steps().size());
        if (context.isDebugMode()) {
            Map<String, Object> debug = new LinkedHashMap<>();
            debug.put("inputs", inputs);
            debug.put("retry_count", step.retryCount());
            debug.put("timeout", step.timeout().toMillis() / 1000.0);
            started = started.withDebug(debug);
            log.debug("Dispatching step: executionId={}, stepId={}, inputs={}", executionId, step.id(), inputs.keySet());
        }
        publish(started);

        stepExecutor.submit(() -> runStep(executor, step, inputs, record));
    }

    /**
     * Step 워커 스레드에서 실행.
     */
    private void runStep(StepExecutor executor, StepDefinition step, Map<String, Object> inputs, StepExecution record) {
        runningThreads.register(step.id(), Thread.currentThread());
        StepRunOutcome outcome;
        try {
            if (context.isCancellationRequested()) {
                outcome = StepRunOutcome.cancelled(0, null);
            } else {
                outcome = attemptRunner.run(executor, step, inputs, context, record, dryRun);
            }
        } catch (RuntimeException e) {
            outcome = StepRunOutcome.fault(0, e);
        } finally {
            runningThreads.deregister(step.id());
        }
        completions.offer(new Completion(step.id(), outcome));
    }

    private void onStepFinished(Completion finished) {
        String stepId = finished.stepId();
        StepRunOutcome outcome = finished.outcome();
        StepDefinition step = definition.stepById(stepId)
            .orElseThrow(() -> new EngineFaultException("Completion for unknown step " + stepId));
        StepExecution record = records.get(stepId);
        inFlight.remove(stepId);

        switch (outcome.kind()) {
            case COMPLETED -> onStepCompleted(step, record, outcome);
            case FAILED -> {
                record.fail(outcome.error());
                states.put(stepId, ExecutionStatus.FAILED);
                rememberFailure(step, outcome.error());
                publishStepFailed(step, record, outcome);
                log.warn("Step failed: executionId={}, stepId={}, attempts={}, error={}",
                    executionId, stepId, outcome.attempts(), outcome.error());
            }
            case CANCELLED -> {
                record.cancel(outcome.error());
                states.put(stepId, ExecutionStatus.CANCELLED);
                if (!cancelling && !deadlineExceeded) {
                    rememberFailure(step, outcome.error());
                }
                publishStepFailed(step, record, outcome);
                log.info("Step cancelled: executionId={}, stepId={}", executionId, stepId);
            }
            case FAULT -> {
                String error = "Engine fault: " + faultMessage(outcome.fault());
                record.fail(error);
                states.put(stepId, ExecutionStatus.FAILED);
                throw new EngineFaultException("Step " + stepId + " raised an engine fault", outcome.fault());
            }
            default -> throw new EngineFaultException("Unknown step outcome: " + outcome.kind());
        }
    }

    private void onStepCompleted(StepDefinition step, StepExecution record, StepRunOutcome outcome) {
        StepResult result = outcome.result();
        Object output = result.output();

        // 1. 컨텍스트 병합 (코디네이터 전용)
        record.complete(output);
        states.put(step.id(), ExecutionStatus.COMPLETED);
        context.recordStepOutput(step.id(), output);
        exportOutputs(step, output);

        // 2. 분기 결과 반영
        for (String target : result.skipSteps()) {
            if (states.get(target) == ExecutionStatus.PENDING) {
                skipRequested.add(target);
            }
        }

        // 3. 이벤트
        ExecutionEvent event = ExecutionEvent.stepCompleted(executionId, step.id(), step.name(),
            record.getStepIndex(), output, record.getExecutionTimeSeconds(), record.getCost(),
            record.getTokensUsed(), execution.getTotalCost(), execution.getTotalTokens());
        publish(withStepDebug(event, record, result.metadata()));
        log.info("Step completed: executionId={}, stepId={}, attempts={}, cost={}",
            executionId, step.id(), outcome.attempts(), record.getCost());
    }

    private void publishStepFailed(StepDefinition step, StepExecution record, StepRunOutcome outcome) {
        ExecutionEvent event = ExecutionEvent.stepFailed(executionId, step.id(), step.name(),
            record.getStepIndex(), outcome.error(), record.getExecutionTimeSeconds(), record.getCost(),
            record.getTokensUsed(), execution.getTotalCost(), execution.getTotalTokens());
        publish(withStepDebug(event, record, outcome.result() == null ? Map.of() : outcome.result().metadata()));
    }

    private ExecutionEvent withStepDebug(ExecutionEvent event, StepExecution record, Map<String, Object> metadata) {
        if (!context.isDebugMode()) {
            return event;
        }
        Map<String, Object> debug = new LinkedHashMap<>();
        debug.put("inputs", stepInputs.getOrDefault(record.getStepId(), Map.of()));
        debug.put("attempts", record.getAttempts());
        debug.put("retries", record.getRetryCount());
        if (metadata != null && !metadata.isEmpty()) {
            debug.put("metadata", metadata);
        }
        return event.withDebug(debug);
    }

    private void skip(StepDefinition step, String reason) {
        int stepIndex = definition.indexOf(step.id());
        StepExecution record = new StepExecution(step.id(), step.name(), step.type(), stepIndex);
        record.skip(reason);
        execution.addStep(record);
        records.put(step.id(), record);
        states.put(step.id(), ExecutionStatus.SKIPPED);
        publish(ExecutionEvent.stepSkipped(executionId, step.id(), step.name(), stepIndex, reason));
        log.info("Step skipped: executionId={}, stepId={}, reason={}", executionId, step.id(), reason);
    }

    /**
     * Step 입력 바인딩.
     *
     * <ol>
     *   <li>완료된 upstream 출력 (Step ID 키)</li>
     *   <li>connection으로 연결된 값 (targetInput 키)</li>
     *   <li>선언된 입력 중 변수에 있는 값</li>
     * </ol>
     */
    private Map<String, Object> bindInputs(StepDefinition step) {
        Map<String, Object> inputs = new LinkedHashMap<>();

        for (String upstream : graph.upstreamsOf(step.id())) {
            if (states.get(upstream) == ExecutionStatus.COMPLETED) {
                context.stepOutput(upstream).ifPresent(output -> inputs.put(upstream, output));
            }
        }

        for (Connection connection : definition.connections()) {
            if (!connection.targetStepId().equals(step.id())
                || states.get(connection.sourceStepId()) != ExecutionStatus.COMPLETED) {
                continue;
            }
            connectedValue(connection).ifPresent(value -> inputs.put(connection.targetInput(), value));
        }

        for (String name : step.inputs()) {
            if (!inputs.containsKey(name)) {
                Object value = context.get(name);
                if (value != null) {
                    inputs.put(name, value);
                }
            }
        }
        return inputs;
    }

    private Optional<Object> connectedValue(Connection connection) {
        Optional<Object> output = context.stepOutput(connection.sourceStepId());
        if (output.isEmpty()) {
            return Optional.empty();
        }
        Object value = output.get();
        if (value instanceof Map && ((Map<?, ?>) value).containsKey(connection.sourceOutput())) {
            return Optional.ofNullable(((Map<?, ?>) value).get(connection.sourceOutput()));
        }
        List<String> declared = definition.stepById(connection.sourceStepId())
            .map(StepDefinition::outputs)
            .orElse(List.of());
        if (declared.size() == 1) {
            return Optional.of(value);
        }
        return Optional.ofNullable(context.get(connection.sourceOutput()));
    }

    /**
     * 출력을 변수로 노출 ({@code step_<id>_output} 및 선언된 출력 이름).
     */
    private void exportOutputs(StepDefinition step, Object output) {
        context.set("step_" + step.id() + "_output", output);
        List<String> declared = step.outputs();
        for (String name : declared) {
            if (output instanceof Map && ((Map<?, ?>) output).containsKey(name)) {
                context.set(name, ((Map<?, ?>) output).get(name));
            } else if (declared.size() == 1) {
                context.set(name, output);
            }
        }
    }

    private void onDeadlineExceeded() {
        deadlineExceeded = true;
        log.warn("Execution deadline exceeded: executionId={}, globalTimeout={}, inFlight={}",
            executionId, definition.settings().globalTimeout(), inFlight);
        interruptInFlight();
    }

    private void interruptInFlight() {
        context.requestCancellation();
        runningThreads.interruptAll();
    }

    private void finish() {
        double elapsed = execution.getExecutionTimeSeconds();

        if (cancelling) {
            execution.cancel();
            publish(ExecutionEvent.cancelled(executionId, execution.getExecutionTimeSeconds(),
                execution.getTotalCost(), execution.getTotalTokens(), execution.getStepsCompleted()));
            log.info("Execution cancelled: executionId={}, stepsCompleted={}", executionId, execution.getStepsCompleted());
            return;
        }

        String error = null;
        if (deadlineExceeded) {
            error = "Pipeline timed out after "
                + StepAttemptRunner.formatSeconds(definition.settings().globalTimeout()) + " seconds";
        } else if (failedStepName != null) {
            error = "Step " + failedStepName + " failed: " + failedStepError;
        } else if (!blocked.isEmpty()) {
            error = "Steps blocked by failed dependencies: " + blocked;
        }

        if (error != null) {
            execution.fail(error);
            publish(ExecutionEvent.failed(executionId, error, execution.getExecutionTimeSeconds(),
                execution.getTotalCost(), execution.getTotalTokens(), execution.getStepsCompleted()));
            log.warn("Execution failed: executionId={}, error={}", executionId, error);
            return;
        }

        execution.complete(context.snapshot());
        publish(ExecutionEvent.completed(executionId, execution.getFinalOutput(), execution.getExecutionTimeSeconds(),
            execution.getTotalCost(), execution.getTotalTokens(), execution.getStepsCompleted()));
        log.info("Execution completed: executionId={}, steps={}, cost={}, tokens={}, elapsed={}s",
            executionId, execution.getStepsCompleted(), execution.getTotalCost(), execution.getTotalTokens(), elapsed);
    }

    private void onEngineFault(EngineFaultException fault) {
        log.error("Engine fault: executionId={}", executionId, fault);

        // 1. 실행 중인 Step 취소
        interruptInFlight();
        for (String stepId : inFlight) {
            StepExecution record = records.get(stepId);
            if (record != null) {
                record.cancel("Step cancelled: " + EngineFaultException.GENERIC_MESSAGE);
            }
        }

        // 2. 즉시 실패 처리
        if (execution.isFinished()) {
            return;
        }
        try {
            if (execution.getStatus() == ExecutionStatus.PAUSED) {
                execution.resume();
            }
            execution.fail(EngineFaultException.GENERIC_MESSAGE);
            publish(ExecutionEvent.failed(executionId, EngineFaultException.GENERIC_MESSAGE,
                execution.getExecutionTimeSeconds(), execution.getTotalCost(), execution.getTotalTokens(),
                execution.getStepsCompleted()));
        } catch (RuntimeException e) {
            log.error("Failed to publish engine fault: executionId={}", executionId, e);
        }
    }

    private static String faultMessage(Throwable fault) {
        if (fault == null) {
            return EngineFaultException.GENERIC_MESSAGE;
        }
        return fault.getMessage() == null ? fault.getClass().getSimpleName() : fault.getMessage();
    }

    private void rememberFailure(StepDefinition step, String error) {
        if (failedStepName == null) {
            failedStepName = step.name();
            failedStepError = error;
        }
    }

    private List<String> unresolvedSteps() {
        List<String> pending = new ArrayList<>();
        for (StepDefinition step : definition.steps()) {
            if (states.get(step.id()) == ExecutionStatus.PENDING && !blocked.contains(step.id())) {
                pending.add(step.id());
            }
        }
        return pending;
    }

    private boolean allResolved(Set<String> upstreams) {
        for (String upstream : upstreams) {
            ExecutionStatus status = states.get(upstream);
            if (!status.isTerminal() && !blocked.contains(upstream)) {
                return false;
            }
        }
        return true;
    }

    private boolean anyUnsatisfied(Set<String> upstreams) {
        for (String upstream : upstreams) {
            if (blocked.contains(upstream) || !states.get(upstream).satisfiesDependency()) {
                return true;
            }
        }
        return false;
    }

    private boolean allPruned(Set<String> upstreams) {
        for (String upstream : upstreams) {
            if (!pruned.contains(upstream)) {
                return false;
            }
        }
        return true;
    }

    private boolean allSatisfied(Set<String> upstreams) {
        for (String upstream : upstreams) {
            if (!states.get(upstream).satisfiesDependency()) {
                return false;
            }
        }
        return true;
    }

    private void publish(ExecutionEvent event) {
        eventChannel.publish(event);
    }

    /**
     * Step 워커가 코디네이터에 전달하는 종료 알림.
     */
    private record Completion(String stepId, StepRunOutcome outcome) {
    }
}
