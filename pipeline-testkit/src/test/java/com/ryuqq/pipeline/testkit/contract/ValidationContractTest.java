package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.engine.ExecuteOptions;
import com.ryuqq.pipeline.core.error.PipelineValidationException;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: invalid pipelines are rejected before anything runs.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValidationContractTest extends AbstractPipelineContractTest {

    private PipelineDefinition cyclic() {
        return PipelineDefinition.of("cyclic", List.of(
            modelStep("a", "x").name("Alpha").dependsOn("c").build(),
            modelStep("b", "y").name("Beta").dependsOn("a").build(),
            modelStep("c", "z").name("Gamma").dependsOn("b").build()));
    }

    @Test
    void testCycle_RejectedWithStepNamesAndNothingDispatched() {
        // When
        PipelineValidationException exception = assertThrows(PipelineValidationException.class,
            () -> engine.execute(cyclic(), Map.of(), ExecuteOptions.defaults()));

        // Then
        ValidationResult result = exception.getResult();
        assertFalse(result.valid());
        String cycleError = result.errors().stream()
            .filter(error -> error.startsWith("Cycle detected: "))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No cycle error in " + result.errors()));
        assertTrue(cycleError.contains("Alpha") && cycleError.contains("Beta") && cycleError.contains("Gamma"),
            "Cycle error should name every step: " + cycleError);
        assertEquals(0, modelClient.callCount());
        assertEquals(0, registry.size());
        assertEquals(0, eventChannel.retainedLogs());
    }

    @Test
    void testValidate_IsIdempotent() {
        // When
        ValidationResult first = engine.validate(cyclic());
        ValidationResult second = engine.validate(cyclic());

        // Then
        assertEquals(first, second);
    }

    @Test
    void testEmptyPipeline_Rejected() {
        // When
        ValidationResult result = engine.validate(PipelineDefinition.of("empty", List.of()));

        // Then
        assertFalse(result.valid());
        assertTrue(result.errors().contains("Pipeline must contain at least one step"));
    }

    @Test
    void testDryRun_StillValidatesFirst() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("bad", List.of(
            StepDefinition.builder("a", StepType.MODEL_CALL)
                .config(Map.of("prompt", "no model"))
                .build()));

        // When / Then
        assertThrows(PipelineValidationException.class,
            () -> engine.execute(definition, Map.of(), ExecuteOptions.defaults().withDryRun(true)));
        assertEquals(0, registry.size());
    }

    @Test
    void testUnknownDependency_Rejected() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("dangling", List.of(
            modelStep("a", "x").dependsOn("ghost").build()));

        // When
        ValidationResult result = engine.validate(definition);

        // Then
        assertFalse(result.valid());
        assertTrue(result.errors().stream().anyMatch(error -> error.contains("ghost")),
            "Expected an error naming the missing step: " + result.errors());
    }
}
