package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.engine.ExecuteOptions;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.statemachine.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: dry run walks the graph without touching external systems.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DryRunContractTest extends AbstractPipelineContractTest {

    @Test
    void testDryRun_NoSideEffectsAndEstimatedUsage() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("dry", List.of(
            modelStep("ask", "hello world").build(),
            StepDefinition.builder("call", StepType.HTTP)
                .config(Map.of("url", "https://example.com/api", "method", "POST"))
                .dependsOn("ask")
                .build(),
            codeStep("compute", "result = 42").dependsOn("call").build()));

        // When
        Run run = run(definition, Map.of(), ExecuteOptions.defaults().withDryRun(true));

        // Then
        assertExecutionStatus(run.execution(), ExecutionStatus.COMPLETED);
        assertTrue(run.execution().isDryRun());
        assertEquals(0, modelClient.callCount());
        assertTrue(httpTransport.calls().isEmpty());
        assertTrue(codeSandbox.requests().isEmpty());

        assertEquals("[DRY RUN] LLM Response from test-model",
            run.execution().getStep("ask").orElseThrow().getOutput());
        assertEquals(52L, run.terminal().totalTokens());
        assertEquals(52 * 0.00001, run.terminal().totalCost(), 1e-9);
    }
}
