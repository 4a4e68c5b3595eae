package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.EngineFaultException;
import com.ryuqq.pipeline.core.error.ExecutionCancelledException;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.execution.StepExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * StepAttemptRunner 유닛 테스트.
 *
 * <ul>
 *   <li>retry_count + 1회까지 시도</li>
 *   <li>시도별 타임아웃</li>
 *   <li>취소, 엔진 오류 분류</li>
 *   <li>시도별 사용량 누적</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StepAttemptRunnerTest {

    @Mock
    private StepExecutor executor;

    private ExecutorService attemptPool;
    private StepAttemptRunner runner;
    private ExecutionContext context;
    private StepExecution record;

    @BeforeEach
    void setUp() {
        attemptPool = Executors.newCachedThreadPool();
        runner = new StepAttemptRunner(attemptPool, new BackoffCalculator(10));
        context = new ExecutionContext(ExecutionId.of("exec-1"), "p", Map.of(), 1, false);
        record = new StepExecution("a", "Step A", StepType.TRANSFORM, 0);
        record.start(Map.of());
    }

    @AfterEach
    void tearDown() {
        attemptPool.shutdownNow();
    }

    private static StepDefinition step(int retryCount, Duration timeout) {
        return StepDefinition.builder("a", StepType.TRANSFORM)
            .retryCount(retryCount)
            .timeout(timeout)
            .build();
    }

    private StepRunOutcome run(StepDefinition step) {
        return runner.run(executor, step, Map.of(), context, record, false);
    }

    // ============================================================
    // 1. 성공과 재시도
    // ============================================================

    @Test
    void run_첫_시도에_성공하면_COMPLETED() {
        // given
        when(executor.run(any(), any(), any())).thenReturn(StepResult.success("ok", 0.1, 10, Map.of()));

        // when
        StepRunOutcome outcome = run(step(2, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.result().output()).isEqualTo("ok");
        assertThat(record.getAttempts()).isEqualTo(1);
        verify(executor, times(1)).run(any(), any(), any());
    }

    @Test
    void run_실패_후_재시도에_성공하면_사용량을_모두_누적함() {
        // given
        when(executor.run(any(), any(), any()))
            .thenReturn(StepResult.failure("flaky", 0.1, 10))
            .thenReturn(StepResult.success("ok", 0.2, 20, Map.of()));

        // when
        StepRunOutcome outcome = run(step(2, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(record.getCost()).isEqualTo(0.1 + 0.2);
        assertThat(record.getTokensUsed()).isEqualTo(30);
        assertThat(record.getRetryCount()).isEqualTo(1);
    }

    @Test
    void run_모든_시도가_실패하면_마지막_오류를_포함함() {
        // given
        when(executor.run(any(), any(), any())).thenReturn(StepResult.failure("boom"));

        // when
        StepRunOutcome outcome = run(step(2, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.FAILED);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.error()).isEqualTo("Step failed after 3 attempts. Last error: boom");
        verify(executor, times(3)).run(any(), any(), any());
    }

    @Test
    void run_재시도가_없으면_오류를_그대로_사용함() {
        // given
        when(executor.run(any(), any(), any())).thenThrow(new StepExecutionException("HTTP 500: oops"));

        // when
        StepRunOutcome outcome = run(step(0, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.FAILED);
        assertThat(outcome.error()).isEqualTo("HTTP 500: oops");
    }

    @Test
    void run_예상하지_못한_예외는_클래스_이름과_함께_보고함() {
        // given
        when(executor.run(any(), any(), any())).thenThrow(new IllegalStateException("bad state"));

        // when
        StepRunOutcome outcome = run(step(0, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.error()).isEqualTo("IllegalStateException: bad state");
    }

    // ============================================================
    // 2. 타임아웃
    // ============================================================

    @Test
    void run_시도가_타임아웃을_넘기면_실패로_기록함() {
        // given
        when(executor.run(any(), any(), any())).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return StepResult.success("late");
        });

        // when
        long started = System.nanoTime();
        StepRunOutcome outcome = run(step(0, Duration.ofMillis(100)));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.FAILED);
        assertThat(outcome.error()).isEqualTo("Step timed out after 0.1 seconds");
        assertThat(record.getAttempts()).isEqualTo(1);
        assertThat(elapsedMs).isLessThan(3000);
    }

    @Test
    void formatSeconds_정수_초는_소수점_없이_표시함() {
        // when & then
        assertThat(StepAttemptRunner.formatSeconds(Duration.ofSeconds(30))).isEqualTo("30");
        assertThat(StepAttemptRunner.formatSeconds(Duration.ofMillis(1500))).isEqualTo("1.5");
        assertThat(StepAttemptRunner.formatSeconds(Duration.ofMillis(200))).isEqualTo("0.2");
    }

    // ============================================================
    // 3. 취소와 엔진 오류
    // ============================================================

    @Test
    void run_실행기가_취소_예외를_던지면_CANCELLED() {
        // given
        when(executor.run(any(), any(), any())).thenThrow(new ExecutionCancelledException("exec-1"));

        // when
        StepRunOutcome outcome = run(step(3, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.CANCELLED);
        assertThat(outcome.error()).isEqualTo("Step cancelled");
        verify(executor, times(1)).run(any(), any(), any());
    }

    @Test
    void run_재시도_전에_취소되면_더_시도하지_않음() {
        // given
        when(executor.run(any(), any(), any())).thenAnswer(invocation -> {
            context.requestCancellation();
            return StepResult.failure("first failure");
        });

        // when
        StepRunOutcome outcome = run(step(3, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.CANCELLED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.error()).isEqualTo("first failure");
        verify(executor, times(1)).run(any(), any(), any());
    }

    @Test
    void run_엔진_오류는_재시도하지_않고_FAULT() {
        // given
        EngineFaultException fault = new EngineFaultException("registry corrupted");
        when(executor.run(any(), any(), any())).thenThrow(fault);

        // when
        StepRunOutcome outcome = run(step(3, Duration.ofSeconds(5)));

        // then
        assertThat(outcome.kind()).isEqualTo(StepRunOutcome.Kind.FAULT);
        assertThat(outcome.fault()).isSameAs(fault);
        verify(executor, times(1)).run(any(), any(), any());
    }

    // ============================================================
    // 4. 시뮬레이션 실행
    // ============================================================

    @Test
    void run_dryRun이면_dryRun_경로를_호출함() {
        // given
        when(executor.dryRun(any(), any(), any())).thenReturn(StepResult.success("[DRY RUN]"));

        // when
        StepRunOutcome outcome = runner.run(executor, step(0, Duration.ofSeconds(5)), Map.of(), context, record, true);

        // then
        assertThat(outcome.result().output()).isEqualTo("[DRY RUN]");
        verify(executor, never()).run(any(), any(), any());
    }
}
