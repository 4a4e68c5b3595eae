package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.step.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TransformStepExecutor 테스트.
 *
 * <ul>
 *   <li>extract, filter, format, aggregate, sort, map_values</li>
 *   <li>source_path 조회 실패, 필드 누락 시 실패 결과</li>
 *   <li>시뮬레이션 실행에서는 실패를 null 출력으로 대체</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TransformStepExecutorTest {

    private static final List<Map<String, Object>> ORDERS = List.of(
        Map.of("id", "o1", "amount", 30, "region", "eu"),
        Map.of("id", "o2", "amount", 10, "region", "us"),
        Map.of("id", "o3", "amount", 20, "region", "eu"));

    private final TransformStepExecutor executor = new TransformStepExecutor();
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        context = new ExecutionContext(ExecutionId.of("exec-1"), "p",
            Map.of("orders", ORDERS, "user", Map.of("name", "Ada", "email", "ada@example.com")), 1, false);
    }

    private Object result(Map<String, Object> config) {
        StepResult result = executor.run(StepConfig.of(config), Map.of(), context);
        assertTrue(result.success(), () -> "transform failed: " + result.error());
        return ((Map<?, ?>) result.output()).get("result");
    }

    @Test
    void run_Extract_SelectsFields() {
        // When
        Object extracted = result(Map.of("transform_type", "extract", "source_path", "user",
            "fields", List.of("name")));

        // Then
        assertEquals(Map.of("name", "Ada"), extracted);
    }

    @Test
    void run_ExtractMissingField_Fails() {
        // When
        StepResult result = executor.run(StepConfig.of(Map.of("transform_type", "extract",
            "source_path", "user", "fields", List.of("phone"))), Map.of(), context);

        // Then
        assertFalse(result.success());
        assertEquals("Field not found: phone", result.error());
    }

    @Test
    void run_Filter_KeepsMatchingItems() {
        // When
        Object filtered = result(Map.of("transform_type", "filter", "source_path", "orders",
            "filter", Map.of("field", "amount", "operator", ">=", "value", 20)));

        // Then
        assertEquals(List.of(ORDERS.get(0), ORDERS.get(2)), filtered);
    }

    @Test
    void run_Format_RendersTemplate() {
        // When
        Object formatted = result(Map.of("transform_type", "format", "source_path", "user",
            "template", "{{name}} <{{email}}>"));

        // Then
        assertEquals("Ada <ada@example.com>", formatted);
    }

    @Test
    void run_Aggregate_ComputesRequestedFunctions() {
        // When
        Object aggregated = result(Map.of("transform_type", "aggregate", "source_path", "orders",
            "field", "amount", "functions", List.of("sum", "avg", "max")));

        // Then
        assertEquals(Map.of("count", 3, "sum", 60.0, "avg", 20.0, "max", 30.0), aggregated);
    }

    @Test
    void run_SortDescending_OrdersByField() {
        // When
        Object sorted = result(Map.of("transform_type", "sort", "source_path", "orders",
            "field", "amount", "descending", true));

        // Then
        assertEquals(List.of(ORDERS.get(0), ORDERS.get(2), ORDERS.get(1)), sorted);
    }

    @Test
    void run_MapValues_RenamesKeys() {
        // When
        Object mapped = result(Map.of("transform_type", "map_values", "source_path", "user",
            "mapping", Map.of("name", "full_name")));

        // Then
        assertEquals(Map.of("full_name", "Ada", "email", "ada@example.com"), mapped);
    }

    @Test
    void run_TargetKey_UsedForOutput() {
        // When
        StepResult result = executor.run(StepConfig.of(Map.of("transform_type", "sort",
            "source_path", "orders", "field", "id", "target_key", "sorted")), Map.of(), context);

        // Then
        assertTrue(((Map<?, ?>) result.output()).containsKey("sorted"));
        assertEquals("sorted", result.metadata().get("target_key"));
    }

    @Test
    void run_MissingSourcePath_Fails() {
        // When
        StepResult result = executor.run(StepConfig.of(Map.of("transform_type", "sort",
            "source_path", "nothing")), Map.of(), context);

        // Then
        assertFalse(result.success());
        assertEquals("Source path not found: nothing", result.error());
    }

    @Test
    void dryRun_Failure_BecomesNullOutput() {
        // When
        StepResult result = executor.dryRun(StepConfig.of(Map.of("transform_type", "sort",
            "source_path", "nothing")), Map.of(), context);

        // Then
        assertTrue(result.success());
        assertTrue(((Map<?, ?>) result.output()).containsKey("result"));
        assertNull(((Map<?, ?>) result.output()).get("result"));
        assertEquals(true, result.metadata().get("dry_run"));
    }
}
