package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.EngineFaultException;
import com.ryuqq.pipeline.core.error.ExecutionCancelledException;
import com.ryuqq.pipeline.core.error.PipelineException;
import com.ryuqq.pipeline.core.execution.StepExecution;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Step 하나의 시도/재시도 루프.
 *
 * <p>각 시도는 별도 스레드에서 실행되고 Step의 {@code timeout}으로 제한됩니다.
 * 타임아웃은 시도 1회에 적용되며 재시도 전체 합계에는 적용되지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 1..(retry_count + 1):
 *   1. (재시도라면) 취소 체크포인트 → 고정 백오프 대기 → 취소 체크포인트
 *   2. 시도 실행: future.get(timeout)
 *      - success       → COMPLETED
 *      - failure/timeout → 다음 시도
 *      - 취소/인터럽트  → CANCELLED
 *      - EngineFault   → FAULT
 * 모든 시도 실패 → FAILED ("Step failed after N attempts. Last error: ...")
 * </pre>
 *
 * <p>시도마다 비용과 토큰을 {@link StepExecution}에 누적합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepAttemptRunner {

    private static final Logger log = LoggerFactory.getLogger(StepAttemptRunner.class);

    private final ExecutorService attemptExecutor;
    private final BackoffCalculator backoffCalculator;

    public StepAttemptRunner(ExecutorService attemptExecutor, BackoffCalculator backoffCalculator) {
        if (attemptExecutor == null) {
            throw new IllegalArgumentException("attemptExecutor cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.attemptExecutor = attemptExecutor;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 재시도 정책을 적용해 Step 실행.
     *
     * @param executor Step 실행기
     * @param step Step 정의
     * @param inputs 바인딩된 입력
     * @param context 실행 컨텍스트
     * @param record 시도별 사용량을 누적할 Step 실행 기록
     * @param dryRun 시뮬레이션 실행 여부
     * @return 최종 결과
     */
    public StepRunOutcome run(StepExecutor executor, StepDefinition step, Map<String, Object> inputs,
                              ExecutionContext context, StepExecution record, boolean dryRun) {
        int maxAttempts = step.retryCount() + 1;
        StepResult last = null;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            // 1. 재시도 전 체크포인트와 백오프
            if (attempt > 1) {
                if (context.isCancellationRequested() || !sleepBackoff(attempt - 1)
                    || context.isCancellationRequested()) {
                    return StepRunOutcome.cancelled(attempt - 1, lastError);
                }
            }

            // 2. 시도 실행
            long startedNanos = System.nanoTime();
            Future<StepResult> future = attemptExecutor.submit(() -> dryRun
                ? executor.dryRun(step.config(), inputs, context)
                : executor.run(step.config(), inputs, context));

            try {
                StepResult result = future.get(step.timeout().toNanos(), TimeUnit.NANOSECONDS)
                    .withExecutionTime(Duration.ofNanos(System.nanoTime() - startedNanos));
                record.recordAttempt(result.cost(), result.tokensUsed());
                last = result;

                if (result.success()) {
                    return StepRunOutcome.completed(result, attempt);
                }
                lastError = result.error();

            } catch (TimeoutException e) {
                future.cancel(true);
                record.recordAttempt(0.0, 0);
                lastError = "Step timed out after " + formatSeconds(step.timeout()) + " seconds";

            } catch (InterruptedException | CancellationException e) {
                future.cancel(true);
                record.recordAttempt(0.0, 0);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return StepRunOutcome.cancelled(attempt, lastError);

            } catch (ExecutionException e) {
                record.recordAttempt(0.0, 0);
                Throwable cause = e.getCause();
                if (cause instanceof ExecutionCancelledException) {
                    return StepRunOutcome.cancelled(attempt, lastError);
                }
                if (cause instanceof EngineFaultException || cause instanceof Error) {
                    return StepRunOutcome.fault(attempt, cause);
                }
                if (cause instanceof PipelineException) {
                    lastError = cause.getMessage();
                } else {
                    log.warn("Step {} attempt {} raised an unexpected exception", step.id(), attempt, cause);
                    lastError = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                }
            }

            log.warn("Step {} attempt {}/{} failed: {}", step.id(), attempt, maxAttempts, lastError);
        }

        String error = maxAttempts > 1
            ? "Step failed after " + maxAttempts + " attempts. Last error: " + lastError
            : lastError;
        return StepRunOutcome.failed(last, maxAttempts, error);
    }

    /**
     * 백오프 대기.
     *
     * @return 인터럽트 없이 대기를 마치면 true
     */
    private boolean sleepBackoff(int retryNumber) {
        long delayMs = backoffCalculator.calculate(retryNumber);
        if (delayMs == 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return String.valueOf(millis / 1000);
        }
        return String.valueOf(millis / 1000.0);
    }
}
