package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.event.ExecutionEvent;
import com.ryuqq.pipeline.core.event.ExecutionEventType;
import com.ryuqq.pipeline.core.execution.StepExecution;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.statemachine.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: retry and per-attempt timeout.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>retry_count = 2 on a step that always fails gives exactly 3 attempts and one step_failed event</li>
 *   <li>A transient failure followed by success completes the step</li>
 *   <li>An attempt that exceeds the step timeout fails with a timeout error</li>
 *   <li>Downstream steps of a failed step never start</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractPipelineContractTest {

    @Test
    void testExhaustedRetries_ThreeAttemptsOneFailureEvent() {
        // Given
        modelClient.alwaysFail("boom");
        PipelineDefinition definition = PipelineDefinition.of("flaky", List.of(
            modelStep("a", "x").retryCount(2).build()));

        // When
        Run run = run(definition, Map.of());

        // Then
        assertEquals(3, modelClient.callCount());
        List<ExecutionEvent> failures = run.ofType(ExecutionEventType.STEP_FAILED);
        assertEquals(1, failures.size());
        assertEquals("Step failed after 3 attempts. Last error: boom", failures.get(0).error());

        StepExecution step = run.execution().getStep("a").orElseThrow();
        assertEquals(ExecutionStatus.FAILED, step.getStatus());
        assertEquals(3, step.getAttempts());
        assertEquals(2, step.getRetryCount());
        assertExecutionStatus(run.execution(), ExecutionStatus.FAILED);
        assertEquals(ExecutionEventType.FAILED, run.terminal().type());
    }

    @Test
    void testTransientFailure_RecoversOnRetry() {
        // Given
        modelClient.thenFail("temporary").thenReply("fine", 1, 1);
        PipelineDefinition definition = PipelineDefinition.of("recover", List.of(
            modelStep("a", "x").retryCount(1).build()));

        // When
        Run run = run(definition, Map.of());

        // Then
        assertExecutionStatus(run.execution(), ExecutionStatus.COMPLETED);
        StepExecution step = run.execution().getStep("a").orElseThrow();
        assertEquals(2, step.getAttempts());
        assertEquals("fine", step.getOutput());
        assertTrue(run.ofType(ExecutionEventType.STEP_FAILED).isEmpty(), "Retried attempts emit no step_failed");
    }

    @Test
    void testAttemptTimeout_FailsWithTimeoutError() {
        // Given
        modelClient.withLatency(1000);
        PipelineDefinition definition = PipelineDefinition.of("slow", List.of(
            modelStep("a", "x").timeout(Duration.ofMillis(100)).build()));

        // When
        Run run = run(definition, Map.of());

        // Then
        assertExecutionStatus(run.execution(), ExecutionStatus.FAILED);
        assertEquals("Step timed out after 0.1 seconds",
            run.execution().getStep("a").orElseThrow().getError());
    }

    @Test
    void testFailedStep_BlocksDownstream() {
        // Given
        modelClient.alwaysFail("down");
        PipelineDefinition definition = PipelineDefinition.of("blocked", List.of(
            modelStep("a", "x").build(),
            modelStep("b", "y").dependsOn("a").build()));

        // When
        Run run = run(definition, Map.of());

        // Then
        assertExecutionStatus(run.execution(), ExecutionStatus.FAILED);
        assertEquals("Step a failed: down", run.execution().getError());
        assertEquals(-1, indexOf(run.events(), ExecutionEventType.STEP_STARTED, "b"));
        assertTrue(run.execution().getStep("b").isEmpty(), "Blocked steps get no execution record");
        assertEquals(1, modelClient.callCount());
    }
}
