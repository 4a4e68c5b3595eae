package com.ryuqq.pipeline.application.engine;

import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.spi.EventChannel;
import com.ryuqq.pipeline.core.spi.EventSubscription;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * ExecutionHandle, ExecuteOptions, EngineStatus 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ExecutionHandleTest {

    private final ExecutionId executionId = ExecutionId.of("exec-1");
    private final EventChannel eventChannel = mock(EventChannel.class);

    @Test
    void events_처음부터_또는_주어진_순번부터_구독함() {
        // given
        EventSubscription subscription = mock(EventSubscription.class);
        when(eventChannel.subscribe(executionId, 0)).thenReturn(subscription);
        when(eventChannel.subscribe(executionId, 5)).thenReturn(subscription);
        ExecutionHandle handle = new ExecutionHandle(executionId, eventChannel, new CompletableFuture<>());

        // when
        handle.events();
        handle.events(5);

        // then
        verify(eventChannel).subscribe(executionId, 0);
        verify(eventChannel).subscribe(executionId, 5);
    }

    @Test
    void await_완료된_실행_기록을_반환함() throws Exception {
        // given
        PipelineExecution execution = new PipelineExecution(executionId, "p", false);
        ExecutionHandle handle = new ExecutionHandle(executionId, eventChannel,
            CompletableFuture.completedFuture(execution));

        // when & then
        assertThat(handle.await(Duration.ofMillis(10))).isSameAs(execution);
    }

    @Test
    void await_시간_내_종료되지_않으면_TimeoutException() {
        // given
        ExecutionHandle handle = new ExecutionHandle(executionId, eventChannel, new CompletableFuture<>());

        // when & then
        assertThatThrownBy(() -> handle.await(Duration.ofMillis(20))).isInstanceOf(TimeoutException.class);
    }

    @Test
    void await_비정상_종료는_IllegalStateException() {
        // given
        CompletableFuture<PipelineExecution> completion = new CompletableFuture<>();
        completion.completeExceptionally(new IllegalStateException("coordinator died"));
        ExecutionHandle handle = new ExecutionHandle(executionId, eventChannel, completion);

        // when & then
        assertThatThrownBy(() -> handle.await(Duration.ofMillis(10)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("terminated abnormally");
    }

    @Test
    void constructor_null_의존성은_예외() {
        // when & then
        assertThatThrownBy(() -> new ExecutionHandle(null, eventChannel, new CompletableFuture<>()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void executeOptions_기본값과_복사본() {
        // given
        ExecuteOptions defaults = ExecuteOptions.defaults();

        // when
        ExecuteOptions debugDryRun = defaults.withDryRun(true).withDebugMode(true);

        // then
        assertThat(defaults.dryRun()).isFalse();
        assertThat(defaults.debugMode()).isFalse();
        assertThat(debugDryRun).isEqualTo(new ExecuteOptions(true, true));
    }

    @Test
    void engineStatus_여섯_종류가_모두_있어야_정상() {
        // when & then
        assertThat(new EngineStatus(0, 0, EnumSet.allOf(StepType.class)).isHealthy()).isTrue();
        assertThat(new EngineStatus(0, 0, Set.of(StepType.HTTP)).isHealthy()).isFalse();
        assertThat(new EngineStatus(0, 0, null).availableExecutors()).isEmpty();
    }
}
