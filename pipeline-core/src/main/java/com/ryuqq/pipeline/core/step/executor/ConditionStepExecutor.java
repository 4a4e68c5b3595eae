package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.InputBindingException;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Condition Step 실행기.
 *
 * <p>단일 비교식을 평가하고 선택되지 않은 분기의 Step들을
 * {@link StepResult#skipSteps()}로 반환합니다. Orchestrator는 이 Step들을 SKIPPED로 처리합니다.</p>
 *
 * <p><strong>설정:</strong></p>
 * <pre>
 * {
 *   "condition": {"field": "score", "operator": "gt", "value": 5},
 *   "true_branch": ["notify"],
 *   "false_branch": ["archive"]
 * }
 * </pre>
 *
 * <p><strong>연산자:</strong> eq, ne, gt, lt, gte, lte, in, contains, exists, regex.
 * exists를 제외한 연산자는 value가 필요합니다. 숫자 비교는 양쪽이 숫자로 해석될 때만 참이 될 수 있습니다.</p>
 *
 * <p>출력: {@code {condition_result, branch}} (branch는 "true" 또는 "false")</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConditionStepExecutor implements StepExecutor {

    static final Set<String> OPERATORS =
        Set.of("eq", "ne", "gt", "lt", "gte", "lte", "in", "contains", "exists", "regex");

    @Override
    public StepType type() {
        return StepType.CONDITION;
    }

    @Override
    public List<String> validate(StepDefinition step) {
        List<String> errors = new ArrayList<>();
        StepConfig config = step.config();

        try {
            Map<String, Object> condition = config.getMap("condition");
            if (condition.isEmpty()) {
                errors.add("condition is required");
            } else {
                if (condition.get("field") == null) {
                    errors.add("condition.field is required");
                }
                Object operator = condition.getOrDefault("operator", "eq");
                if (!OPERATORS.contains(String.valueOf(operator))) {
                    errors.add("Unknown operator: " + operator);
                } else if (!"exists".equals(operator) && !condition.containsKey("value")) {
                    errors.add("condition.value is required for operator " + operator);
                }
            }
            config.getList("true_branch");
            config.getList("false_branch");
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    @Override
    public StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        Map<String, Object> condition = config.getMap("condition");
        if (condition.isEmpty()) {
            return StepResult.failure("Condition configuration is required");
        }

        try {
            String field = String.valueOf(condition.get("field"));
            String operator = String.valueOf(condition.getOrDefault("operator", "eq"));
            Object expected = context.interpolate(condition.get("value"), inputs);
            Optional<Object> actual = context.lookup(field, inputs);

            boolean outcome = evaluate(operator, actual.orElse(null), expected);

            // 선택되지 않은 분기 중 선택된 분기에도 속한 Step은 제외
            List<String> selected = config.getStringList(outcome ? "true_branch" : "false_branch");
            Set<String> skipped = new LinkedHashSet<>(config.getStringList(outcome ? "false_branch" : "true_branch"));
            skipped.removeAll(selected);

            Map<String, Object> output = new LinkedHashMap<>();
            output.put("condition_result", outcome);
            output.put("branch", outcome ? "true" : "false");

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("field", field);
            metadata.put("operator", operator);
            metadata.put("evaluation_result", outcome);

            return StepResult.success(output, 0.0, 0, metadata).withSkipSteps(new ArrayList<>(skipped));

        } catch (InputBindingException | IllegalArgumentException e) {
            return StepResult.failure(e.getMessage());
        }
    }

    @Override
    public List<String> branchTargets(StepConfig config) {
        Set<String> targets = new LinkedHashSet<>(config.getStringList("true_branch"));
        targets.addAll(config.getStringList("false_branch"));
        return new ArrayList<>(targets);
    }

    static boolean evaluate(String operator, Object actual, Object expected) {
        return switch (operator) {
            case "eq" -> ValueComparisons.equalsLoosely(actual, expected);
            case "ne" -> !ValueComparisons.equalsLoosely(actual, expected);
            case "gt" -> ValueComparisons.compareNumbers(actual, expected, c -> c > 0);
            case "lt" -> ValueComparisons.compareNumbers(actual, expected, c -> c < 0);
            case "gte" -> ValueComparisons.compareNumbers(actual, expected, c -> c >= 0);
            case "lte" -> ValueComparisons.compareNumbers(actual, expected, c -> c <= 0);
            case "in" -> ValueComparisons.in(actual, expected);
            case "contains" -> ValueComparisons.contains(actual, expected);
            case "exists" -> actual != null;
            case "regex" -> ValueComparisons.matches(actual, expected);
            default -> throw new IllegalArgumentException("Unknown operator: " + operator);
        };
    }
}
