package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.execution.PipelineExecution;

/**
 * Persistence hand-off for finished executions.
 *
 * <p>The engine calls {@link #save(PipelineExecution)} exactly once per execution, after it has
 * reached a terminal status. The record includes its {@code StepExecution}s. Failures are logged
 * by the engine and never change the execution's outcome.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionStore {

    /**
     * Stores a terminal execution record.
     *
     * @param execution terminal execution
     * @throws IllegalArgumentException if execution is null or not terminal
     */
    void save(PipelineExecution execution);
}
