package com.ryuqq.pipeline.adapter.inmemory.registry;

import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryExecutionRegistry.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryExecutionRegistryTest {

    private InMemoryExecutionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryExecutionRegistry();
    }

    private PipelineExecution register(String id) {
        PipelineExecution execution = new PipelineExecution(ExecutionId.of(id), "p", false);
        registry.register(execution);
        return execution;
    }

    @Test
    void testRegister_DuplicateId_ThrowsException() {
        // Given
        register("exec-1");

        // When & Then
        assertThrows(IllegalStateException.class, () -> register("exec-1"));
        assertEquals(1, registry.size());
    }

    @Test
    void testFind_ReturnsRegisteredExecution() {
        // Given
        PipelineExecution execution = register("exec-1");

        // When & Then
        assertSame(execution, registry.find(ExecutionId.of("exec-1")).orElseThrow());
        assertTrue(registry.find(ExecutionId.of("unknown")).isEmpty());
    }

    @Test
    void testActive_ExcludesFinished() {
        // Given
        PipelineExecution running = register("running");
        running.start();
        PipelineExecution done = register("done");
        done.start();
        done.complete(Map.of());

        // When
        List<PipelineExecution> active = registry.active();

        // Then
        assertEquals(List.of(running), active);
    }

    @Test
    void testEvictFinishedBefore_OnlyFinishedBeforeCutoff() {
        // Given
        PipelineExecution running = register("running");
        running.start();
        PipelineExecution done = register("done");
        done.start();
        done.fail("boom");

        // When
        List<ExecutionId> notYet = registry.evictFinishedBefore(done.getFinishedAt());
        List<ExecutionId> evicted = registry.evictFinishedBefore(Instant.now().plusSeconds(1));

        // Then
        assertTrue(notYet.isEmpty());
        assertEquals(List.of(ExecutionId.of("done")), evicted);
        assertEquals(1, registry.size());
        assertTrue(registry.find(ExecutionId.of("running")).isPresent());
    }

    @Test
    void testEvictFinishedBefore_NullCutoff_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> registry.evictFinishedBefore(null));
    }
}
