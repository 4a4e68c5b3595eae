package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.step.StepResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConditionStepExecutor 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConditionStepExecutorTest {

    private final ConditionStepExecutor executor = new ConditionStepExecutor();

    private static ExecutionContext context(Map<String, Object> variables) {
        return new ExecutionContext(ExecutionId.of("exec-1"), "p", variables, 3, false);
    }

    private static StepConfig config(String operator, Object value) {
        return StepConfig.of(Map.of(
            "condition", Map.of("field", "score", "operator", operator, "value", value),
            "true_branch", List.of("notify", "shared"),
            "false_branch", List.of("archive", "shared")));
    }

    // ========== 분기 선택 ==========

    @Test
    void run_TrueOutcome_SkipsFalseOnlyTargets() {
        // When
        StepResult result = executor.run(config("gt", 5), Map.of(), context(Map.of("score", 10)));

        // Then
        assertTrue(result.success());
        assertEquals(Map.of("condition_result", true, "branch", "true"), result.output());
        assertEquals(List.of("archive"), result.skipSteps());
        assertEquals(true, result.metadata().get("evaluation_result"));
    }

    @Test
    void run_FalseOutcome_SkipsTrueOnlyTargets() {
        // When
        StepResult result = executor.run(config("gt", 5), Map.of(), context(Map.of("score", 1)));

        // Then
        assertEquals(Map.of("condition_result", false, "branch", "false"), result.output());
        assertEquals(List.of("notify"), result.skipSteps());
    }

    @Test
    void run_FieldFromInputs_WhenNotInContext() {
        // When
        StepResult result = executor.run(config("eq", "ok"), Map.of("score", "ok"), context(Map.of()));

        // Then
        assertEquals(true, ((Map<?, ?>) result.output()).get("condition_result"));
    }

    @Test
    void run_InputsTakePrecedenceOverVariables() {
        // When
        StepResult result = executor.run(config("gt", 5), Map.of("score", 1), context(Map.of("score", 10)));

        // Then
        assertEquals(Map.of("condition_result", false, "branch", "false"), result.output());
    }

    @Test
    void run_MissingCondition_Fails() {
        // When
        StepResult result = executor.run(StepConfig.empty(), Map.of(), context(Map.of()));

        // Then
        assertFalse(result.success());
        assertEquals("Condition configuration is required", result.error());
    }

    // ========== 연산자 ==========

    @Test
    void evaluate_NumericOperators_CoerceStrings() {
        // When & Then
        assertTrue(ConditionStepExecutor.evaluate("eq", "10", 10));
        assertTrue(ConditionStepExecutor.evaluate("gte", 5, "5"));
        assertFalse(ConditionStepExecutor.evaluate("lt", "abc", 5));
        assertTrue(ConditionStepExecutor.evaluate("ne", "a", "b"));
    }

    @Test
    void evaluate_CollectionOperators() {
        // When & Then
        assertTrue(ConditionStepExecutor.evaluate("in", "b", List.of("a", "b")));
        assertTrue(ConditionStepExecutor.evaluate("contains", "hello world", "world"));
        assertTrue(ConditionStepExecutor.evaluate("exists", 0, null));
        assertFalse(ConditionStepExecutor.evaluate("exists", null, null));
        assertTrue(ConditionStepExecutor.evaluate("regex", "order-42", "\\d+$"));
    }

    @Test
    void evaluate_UnknownOperator_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ConditionStepExecutor.evaluate("between", 1, 2));
    }

    // ========== 검증 ==========

    @Test
    void validate_MissingValue_ReportsError() {
        // Given
        StepDefinition step = StepDefinition.builder("c", StepType.CONDITION)
            .config(Map.of("condition", Map.of("field", "x", "operator", "gt")))
            .build();

        // When & Then
        assertEquals(List.of("condition.value is required for operator gt"), executor.validate(step));
    }

    @Test
    void branchTargets_UnionOfBothBranches() {
        // When & Then
        assertEquals(List.of("notify", "shared", "archive"), executor.branchTargets(config("eq", 1)));
    }
}
