package com.ryuqq.pipeline.adapter.inmemory.registry;

import com.ryuqq.pipeline.application.registry.ExecutionRegistry;
import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ExecutionRegistry}.
 *
 * <p>Backed by a {@link ConcurrentHashMap}. Eviction uses
 * {@link ConcurrentHashMap#remove(Object, Object)} so a record is removed only if it is still
 * the one that was inspected.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryExecutionRegistry implements ExecutionRegistry {

    private final ConcurrentHashMap<ExecutionId, PipelineExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void register(PipelineExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        PipelineExecution existing = executions.putIfAbsent(execution.getExecutionId(), execution);
        if (existing != null) {
            throw new IllegalStateException("Execution already registered: " + execution.getExecutionId().getValue());
        }
    }

    @Override
    public Optional<PipelineExecution> find(ExecutionId executionId) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<PipelineExecution> active() {
        List<PipelineExecution> active = new ArrayList<>();
        for (PipelineExecution execution : executions.values()) {
            if (!execution.isFinished()) {
                active.add(execution);
            }
        }
        return active;
    }

    @Override
    public List<ExecutionId> evictFinishedBefore(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }
        List<ExecutionId> evicted = new ArrayList<>();
        for (Map.Entry<ExecutionId, PipelineExecution> entry : executions.entrySet()) {
            PipelineExecution execution = entry.getValue();
            Instant finishedAt = execution.getFinishedAt();
            if (execution.isFinished() && finishedAt != null && finishedAt.isBefore(cutoff)
                && executions.remove(entry.getKey(), execution)) {
                evicted.add(entry.getKey());
            }
        }
        return evicted;
    }

    @Override
    public int size() {
        return executions.size();
    }
}
