package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.event.ExecutionEventType;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.PipelineSettings;
import com.ryuqq.pipeline.core.statemachine.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: the pipeline-wide timeout fails the run and cancels in-flight steps.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PipelineTimeoutContractTest extends AbstractPipelineContractTest {

    @Test
    void testGlobalTimeout_FailsRunAndCancelsRunningStep() {
        // Given
        modelClient.withLatency(5000);
        PipelineDefinition definition = PipelineDefinition.of("stuck", List.of(
                modelStep("a", "x").build(),
                modelStep("b", "y").dependsOn("a").build()))
            .withSettings(new PipelineSettings().withGlobalTimeout(Duration.ofMillis(200)));

        // When
        long started = System.nanoTime();
        Run run = run(definition, Map.of());
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        // Then
        assertExecutionStatus(run.execution(), ExecutionStatus.FAILED);
        assertEquals("Pipeline timed out after 0.2 seconds", run.execution().getError());
        assertEquals(ExecutionEventType.FAILED, run.terminal().type());
        assertStepStatus(run.execution(), "a", ExecutionStatus.CANCELLED);
        assertTrue(run.execution().getStep("b").isEmpty());
        assertTrue(elapsedMs < 4000, "Run should end well before the step finishes, took " + elapsedMs + "ms");
    }
}
