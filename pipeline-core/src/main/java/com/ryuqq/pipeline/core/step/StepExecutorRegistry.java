package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.model.StepType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * StepType → StepExecutor 매핑.
 *
 * <pre>
 * StepExecutorRegistry registry = new StepExecutorRegistry()
 *     .register(new TransformStepExecutor())
 *     .register(new ConditionStepExecutor());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepExecutorRegistry {

    private final Map<StepType, StepExecutor> executors = new EnumMap<>(StepType.class);

    /**
     * 실행기 등록. 같은 종류의 기존 실행기는 대체됩니다.
     *
     * @param executor 실행기
     * @return this
     */
    public synchronized StepExecutorRegistry register(StepExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (executor.type() == null) {
            throw new IllegalArgumentException("executor type cannot be null");
        }
        executors.put(executor.type(), executor);
        return this;
    }

    public synchronized Optional<StepExecutor> find(StepType type) {
        return Optional.ofNullable(executors.get(type));
    }

    /**
     * @throws IllegalStateException 등록되지 않은 종류인 경우
     */
    public synchronized StepExecutor get(StepType type) {
        StepExecutor executor = executors.get(type);
        if (executor == null) {
            throw new IllegalStateException("No executor registered for step type: " + type);
        }
        return executor;
    }

    public synchronized Set<StepType> registeredTypes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(executors.keySet()));
    }
}
