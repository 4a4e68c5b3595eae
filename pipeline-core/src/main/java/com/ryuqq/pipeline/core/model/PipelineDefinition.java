package com.ryuqq.pipeline.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 사용자가 작성한 파이프라인 정의 (불변 record).
 *
 * <p>엔진은 정의를 읽기만 하며, 실행이 시작된 이후에는 변경되지 않습니다.
 * {@link #steps()}의 순서는 선언 순서이며 동시 실행 한도를 넘는 ready Step의
 * 디스패치 우선순위로 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 파이프라인 ID
 * @param name 표시 이름
 * @param steps 선언 순서의 Step 목록
 * @param connections 데이터 흐름 간선
 * @param variables 선언된 변수와 기본값
 * @param settings 실행 설정
 */
public record PipelineDefinition(
    String id,
    String name,
    List<StepDefinition> steps,
    List<Connection> connections,
    Map<String, Object> variables,
    PipelineSettings settings
) {

    public PipelineDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        name = (name == null || name.isBlank()) ? id : name;
        steps = steps == null ? List.of() : List.copyOf(steps);
        connections = connections == null ? List.of() : List.copyOf(connections);
        variables = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        settings = settings == null ? new PipelineSettings() : settings;
    }

    public static PipelineDefinition of(String id, List<StepDefinition> steps) {
        return new PipelineDefinition(id, id, steps, List.of(), Map.of(), new PipelineSettings());
    }

    public Optional<StepDefinition> stepById(String stepId) {
        for (StepDefinition step : steps) {
            if (step.id().equals(stepId)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    /**
     * 선언 순서상의 위치.
     *
     * @param stepId Step ID
     * @return 0부터 시작하는 인덱스 (없으면 -1)
     */
    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) {
                return i;
            }
        }
        return -1;
    }

    public PipelineDefinition withSettings(PipelineSettings settings) {
        return new PipelineDefinition(id, name, steps, connections, variables, settings);
    }

    public PipelineDefinition withConnections(List<Connection> connections) {
        return new PipelineDefinition(id, name, steps, connections, variables, settings);
    }

    public PipelineDefinition withVariables(Map<String, Object> variables) {
        return new PipelineDefinition(id, name, steps, connections, variables, settings);
    }
}
