package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Merge Step 실행기.
 *
 * <p>여러 upstream 분기의 출력을 하나로 결합합니다. 입력에는 COMPLETED 상태인
 * upstream의 출력만 Step ID 키로 들어오며, SKIPPED 분기는 아무것도 기여하지 않습니다.</p>
 *
 * <p><strong>strategy:</strong></p>
 * <ul>
 *   <li>object (기본): 객체 출력은 얕게 병합, 그 외 출력은 Step ID 키로 보관</li>
 *   <li>array: 출력 목록</li>
 *   <li>first: 첫 번째 null이 아닌 출력</li>
 *   <li>concat: 문자열로 이어 붙임 ({@code separator}, 기본 줄바꿈)</li>
 * </ul>
 *
 * <p>{@code sources}를 지정하면 해당 Step ID의 입력만 순서대로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MergeStepExecutor implements StepExecutor {

    static final String DEFAULT_STRATEGY = "object";
    private static final Set<String> STRATEGIES = Set.of("object", "array", "first", "concat");

    @Override
    public StepType type() {
        return StepType.MERGE;
    }

    @Override
    public List<String> validate(StepDefinition step) {
        List<String> errors = new ArrayList<>();
        String strategy = step.config().getString("strategy", DEFAULT_STRATEGY);
        if (!STRATEGIES.contains(strategy)) {
            errors.add("Unknown merge strategy: " + strategy);
        }
        try {
            step.config().getList("sources");
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    @Override
    public StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        String strategy = config.getString("strategy", DEFAULT_STRATEGY);
        Map<String, Object> sources = selectSources(config.getStringList("sources"), inputs);

        Object merged = switch (strategy) {
            case "array" -> new ArrayList<>(sources.values());
            case "first" -> first(sources);
            case "concat" -> concat(sources, config.getString("separator", "\n"));
            case "object" -> mergeObjects(sources);
            default -> null;
        };
        if (merged == null && !"first".equals(strategy)) {
            return StepResult.failure("Unknown merge strategy: " + strategy);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("strategy", strategy);
        metadata.put("merged_sources", new ArrayList<>(sources.keySet()));
        return StepResult.success(merged, 0.0, 0, metadata);
    }

    private static Map<String, Object> selectSources(List<String> sourceIds, Map<String, Object> inputs) {
        if (sourceIds.isEmpty()) {
            return inputs;
        }
        Map<String, Object> selected = new LinkedHashMap<>();
        for (String sourceId : sourceIds) {
            if (inputs.containsKey(sourceId)) {
                selected.put(sourceId, inputs.get(sourceId));
            }
        }
        return selected;
    }

    private static Object first(Map<String, Object> sources) {
        for (Object value : sources.values()) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String concat(Map<String, Object> sources, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (Object value : sources.values()) {
            if (value != null) {
                joiner.add(String.valueOf(value));
            }
        }
        return joiner.toString();
    }

    private static Map<String, Object> mergeObjects(Map<String, Object> sources) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : sources.entrySet()) {
            if (entry.getValue() instanceof Map) {
                for (Map.Entry<?, ?> field : ((Map<?, ?>) entry.getValue()).entrySet()) {
                    merged.put(String.valueOf(field.getKey()), field.getValue());
                }
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return merged;
    }
}
