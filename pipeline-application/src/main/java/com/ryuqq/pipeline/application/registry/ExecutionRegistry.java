package com.ryuqq.pipeline.application.registry;

import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Arena of execution records indexed by execution id.
 *
 * <p>Owned by the engine's invoking layer. Records stay here while running and after they finish,
 * until {@link #evictFinishedBefore(Instant)} removes them.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: the engine registers, transport adapters read, the reaper evicts</li>
 *   <li>Running executions are never evicted</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionRegistry {

    /**
     * Registers a new execution.
     *
     * @param execution record to register
     * @throws IllegalStateException if the id is already registered
     */
    void register(PipelineExecution execution);

    Optional<PipelineExecution> find(ExecutionId executionId);

    /**
     * Executions that have not reached a terminal status.
     */
    List<PipelineExecution> active();

    /**
     * Removes finished executions whose finish time is before the cutoff.
     *
     * @param cutoff finish-time cutoff
     * @return ids of the evicted executions
     */
    List<ExecutionId> evictFinishedBefore(Instant cutoff);

    int size();
}
