package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.execution.PipelineExecution;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.spi.ExecutionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ExecutionStore} SPI.
 *
 * <p>Keeps terminal execution records in a map. Saving the same execution twice replaces
 * the earlier record.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final ConcurrentHashMap<ExecutionId, PipelineExecution> saved = new ConcurrentHashMap<>();

    @Override
    public void save(PipelineExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        if (!execution.isFinished()) {
            throw new IllegalArgumentException(
                "execution must be terminal (current: " + execution.getStatus() + ")"
            );
        }
        saved.put(execution.getExecutionId(), execution);
    }

    public Optional<PipelineExecution> find(ExecutionId executionId) {
        return Optional.ofNullable(saved.get(executionId));
    }

    public List<PipelineExecution> findAll() {
        return new ArrayList<>(saved.values());
    }

    public int size() {
        return saved.size();
    }

    /**
     * 테스트 간 상태 초기화.
     */
    public void clear() {
        saved.clear();
    }
}
