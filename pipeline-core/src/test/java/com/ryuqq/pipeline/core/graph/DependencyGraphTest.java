package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.model.Connection;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DependencyGraph 테스트.
 *
 * <ul>
 *   <li>depends_on, connection, 분기 대상이 모두 간선이 됨</li>
 *   <li>Kahn 계층은 계층 내부에서 선언 순서 유지</li>
 *   <li>순환 경로는 시작 Step으로 끝남</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DependencyGraphTest {

    private static StepDefinition step(String id, String... dependsOn) {
        return StepDefinition.builder(id, StepType.TRANSFORM).dependsOn(dependsOn).build();
    }

    private static DependencyGraph graphOf(PipelineDefinition definition) {
        return DependencyGraph.of(definition, step -> List.of());
    }

    // ========== 계층 ==========

    @Test
    void layers_Diamond_ReturnsThreeLayers() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(
            step("a"), step("c", "a"), step("b", "a"), step("d", "b", "c")));

        // When
        List<List<String>> layers = graphOf(definition).layers();

        // Then
        assertEquals(List.of(List.of("a"), List.of("c", "b"), List.of("d")), layers);
    }

    @Test
    void layers_IndependentSteps_SingleLayerInDeclaredOrder() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(step("z"), step("y"), step("x")));

        // When & Then
        assertEquals(List.of(List.of("z", "y", "x")), graphOf(definition).layers());
    }

    @Test
    void layers_Cycle_ThrowsException() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(step("a", "b"), step("b", "a")));

        // When & Then
        assertThrows(IllegalStateException.class, () -> graphOf(definition).layers());
    }

    // ========== 간선 ==========

    @Test
    void of_ConnectionsAndBranchTargets_BecomeEdges() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(
                step("gate"), step("source"), step("target"), step("branch")))
            .withConnections(List.of(new Connection("source", "text", "target", "text")));

        // When
        DependencyGraph graph = DependencyGraph.of(definition,
            step -> step.id().equals("gate") ? List.of("branch") : List.of());

        // Then
        assertEquals(Set.of("source"), graph.upstreamsOf("target"));
        assertEquals(Set.of("gate"), graph.upstreamsOf("branch"));
        assertEquals(Set.of("branch"), graph.downstreamsOf("gate"));
    }

    @Test
    void of_UnknownDependency_IsIgnored() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(step("a", "ghost")));

        // When
        DependencyGraph graph = graphOf(definition);

        // Then
        assertTrue(graph.upstreamsOf("a").isEmpty());
        assertEquals(List.of(List.of("a")), graph.layers());
    }

    @Test
    void orderOf_UnknownStep_ThrowsException() {
        // Given
        DependencyGraph graph = graphOf(PipelineDefinition.of("p", List.of(step("a"), step("b"))));

        // When & Then
        assertEquals(1, graph.orderOf("b"));
        assertThrows(IllegalArgumentException.class, () -> graph.orderOf("missing"));
    }

    // ========== 순환 ==========

    @Test
    void findCycle_ThreeStepCycle_ReturnsClosedPath() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(
            step("a", "c"), step("b", "a"), step("c", "b")));

        // When
        Optional<List<String>> cycle = graphOf(definition).findCycle();

        // Then
        assertEquals(Optional.of(List.of("a", "b", "c", "a")), cycle);
    }

    @Test
    void findCycle_Acyclic_ReturnsEmpty() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(step("a"), step("b", "a")));

        // When & Then
        assertTrue(graphOf(definition).findCycle().isEmpty());
    }

    @Test
    void findCycle_SelfDependency_Detected() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(step("a", "a")));

        // When & Then
        assertEquals(Optional.of(List.of("a", "a")), graphOf(definition).findCycle());
    }

    @Test
    void layers_ConnectionOnlyOrdering_Respected() {
        // Given
        PipelineDefinition definition = PipelineDefinition.of("p", List.of(step("late"), step("early")))
            .withConnections(List.of(new Connection("early", "out", "late", "in")));

        // When & Then
        assertEquals(List.of(List.of("early"), List.of("late")), graphOf(definition).layers());
    }
}
