package com.ryuqq.pipeline.core.validation;

import com.ryuqq.pipeline.core.graph.DependencyGraph;
import com.ryuqq.pipeline.core.model.Connection;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepExecutorRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Graph Validator.
 *
 * <p>실행 전에 파이프라인 정의의 구조적 정합성을 검사합니다.
 * 정의를 변경하지 않으며 같은 정의에 대해 항상 같은 결과를 반환합니다.</p>
 *
 * <p><strong>검사 순서:</strong></p>
 * <pre>
 * 0. 빈 파이프라인, 중복 Step ID, 등록되지 않은 Step 종류
 * a. Connection과 depends_on이 존재하는 Step과 선언된 입출력 이름을 참조하는지
 * b. 의존 그래프 순환 (DFS + visiting 집합, 순환 경로의 Step 이름 보고)
 * c. Step 종류별 필수 설정 필드와 타입
 * d. Condition 분기 대상 Step 존재 여부
 * </pre>
 *
 * <p><strong>경고:</strong> 비활성화된 Step, 분기가 없는 Condition,
 * upstream이 2개 미만인 Merge, 과도한 retry_count</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PipelineValidator {

    static final int RETRY_WARNING_THRESHOLD = 10;

    private final StepExecutorRegistry registry;

    public PipelineValidator(StepExecutorRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 파이프라인 정의 검증.
     *
     * @param definition 검증할 정의
     * @return 검증 결과
     * @throws IllegalArgumentException definition이 null인 경우
     */
    public ValidationResult validate(PipelineDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // 0. 기본 구조
        if (definition.steps().isEmpty()) {
            errors.add("Pipeline must contain at least one step");
            return ValidationResult.of(errors, warnings);
        }
        Map<String, StepDefinition> steps = checkIdentity(definition, errors);

        // a. 참조 무결성
        checkConnections(definition, steps, errors);
        checkDependsOn(definition, steps, errors);

        // b. 순환
        DependencyGraph graph = DependencyGraph.of(definition, this::safeBranchTargets);
        graph.findCycle().ifPresent(cycle -> errors.add("Cycle detected: " + cycle.stream()
            .map(id -> steps.get(id).name())
            .collect(Collectors.joining(" -> "))));

        // c. Step 종류별 설정
        for (StepDefinition step : definition.steps()) {
            Optional<StepExecutor> executor = registry.find(step.type());
            if (executor.isPresent()) {
                for (String error : executor.get().validate(step)) {
                    errors.add("Step '" + step.name() + "': " + error);
                }
            }
        }

        // d. 분기 대상
        checkBranchTargets(definition, steps, errors);

        collectWarnings(definition, graph, warnings);
        return ValidationResult.of(errors, warnings);
    }

    private Map<String, StepDefinition> checkIdentity(PipelineDefinition definition, List<String> errors) {
        Map<String, StepDefinition> steps = new LinkedHashMap<>();
        for (StepDefinition step : definition.steps()) {
            if (steps.putIfAbsent(step.id(), step) != null) {
                errors.add("Duplicate step id: " + step.id());
            }
            if (registry.find(step.type()).isEmpty()) {
                errors.add("Step '" + step.name() + "': No executor registered for step type: " + step.type().wireName());
            }
        }
        return steps;
    }

    private void checkConnections(PipelineDefinition definition, Map<String, StepDefinition> steps, List<String> errors) {
        for (Connection connection : definition.connections()) {
            StepDefinition source = steps.get(connection.sourceStepId());
            StepDefinition target = steps.get(connection.targetStepId());
            if (source == null) {
                errors.add("Connection references unknown source step: " + connection.sourceStepId());
            } else if (!source.outputs().contains(connection.sourceOutput())) {
                errors.add("Connection source step '" + source.name() + "' does not declare output '"
                    + connection.sourceOutput() + "'");
            }
            if (target == null) {
                errors.add("Connection references unknown target step: " + connection.targetStepId());
            } else if (!target.inputs().contains(connection.targetInput())) {
                errors.add("Connection target step '" + target.name() + "' does not declare input '"
                    + connection.targetInput() + "'");
            }
        }
    }

    private void checkDependsOn(PipelineDefinition definition, Map<String, StepDefinition> steps, List<String> errors) {
        for (StepDefinition step : definition.steps()) {
            for (String dependency : step.dependsOn()) {
                if (!steps.containsKey(dependency)) {
                    errors.add("Step '" + step.name() + "' depends on unknown step: " + dependency);
                }
            }
        }
    }

    private void checkBranchTargets(PipelineDefinition definition, Map<String, StepDefinition> steps, List<String> errors) {
        for (StepDefinition step : definition.steps()) {
            if (step.type() != StepType.CONDITION) {
                continue;
            }
            for (String target : safeBranchTargets(step)) {
                if (!steps.containsKey(target)) {
                    errors.add("Condition step '" + step.name() + "' references unknown branch target: " + target);
                } else if (target.equals(step.id())) {
                    errors.add("Condition step '" + step.name() + "' cannot branch to itself");
                }
            }
        }
    }

    private void collectWarnings(PipelineDefinition definition, DependencyGraph graph, List<String> warnings) {
        for (StepDefinition step : definition.steps()) {
            if (!step.enabled()) {
                warnings.add("Step '" + step.name() + "' is disabled and will be skipped");
            }
            if (step.retryCount() > RETRY_WARNING_THRESHOLD) {
                warnings.add("Step '" + step.name() + "' has a high retry_count (" + step.retryCount() + ")");
            }
            if (step.type() == StepType.CONDITION && safeBranchTargets(step).isEmpty()) {
                warnings.add("Condition step '" + step.name() + "' has no true_branch or false_branch");
            }
            if (step.type() == StepType.MERGE) {
                if (graph.upstreamsOf(step.id()).size() < 2) {
                    warnings.add("Merge step '" + step.name() + "' has fewer than two upstream steps");
                }
            }
        }
    }

    private List<String> safeBranchTargets(StepDefinition step) {
        Optional<StepExecutor> executor = registry.find(step.type());
        if (executor.isEmpty()) {
            return List.of();
        }
        try {
            return executor.get().branchTargets(step.config());
        } catch (IllegalArgumentException e) {
            // 잘못된 분기 설정은 c 단계에서 보고
            return List.of();
        }
    }
}
