package com.ryuqq.pipeline.application.engine;

import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.spi.EventChannel;
import com.ryuqq.pipeline.core.spi.EventSubscription;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link PipelineEngine#execute} 결과 핸들.
 *
 * <p>실행 ID와 해당 실행의 이벤트 스트림 접근을 제공합니다. 실행은 핸들이 반환된
 * 시점에 이미 백그라운드에서 진행 중입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionHandle handle = engine.execute(definition, Map.of("x", 10), ExecuteOptions.defaults());
 * try (EventSubscription events = handle.events()) {
 *     while (!events.isExhausted()) {
 *         events.poll(Duration.ofSeconds(1)).ifPresent(sse::send);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionHandle {

    private final ExecutionId executionId;
    private final EventChannel eventChannel;
    private final CompletableFuture<PipelineExecution> completion;

    public ExecutionHandle(ExecutionId executionId, EventChannel eventChannel,
                           CompletableFuture<PipelineExecution> completion) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        if (eventChannel == null) {
            throw new IllegalArgumentException("eventChannel cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        this.executionId = executionId;
        this.eventChannel = eventChannel;
        this.completion = completion;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    /**
     * 첫 이벤트부터 구독.
     */
    public EventSubscription events() {
        return eventChannel.subscribe(executionId, 0);
    }

    /**
     * 주어진 순번부터 구독 (재연결 시 사용).
     */
    public EventSubscription events(long fromSequence) {
        return eventChannel.subscribe(executionId, fromSequence);
    }

    public CompletableFuture<PipelineExecution> completion() {
        return completion;
    }

    /**
     * 실행 종료까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 종료된 실행 기록
     * @throws TimeoutException 시간 내 종료되지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public PipelineExecution await(Duration timeout) throws TimeoutException, InterruptedException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Execution " + executionId.getValue() + " terminated abnormally", e.getCause());
        }
    }

    @Override
    public String toString() {
        return "ExecutionHandle{executionId=" + executionId + ", done=" + completion.isDone() + "}";
    }
}
