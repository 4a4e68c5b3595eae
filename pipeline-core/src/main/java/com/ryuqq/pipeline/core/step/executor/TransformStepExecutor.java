package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.context.PathLookup;
import com.ryuqq.pipeline.core.context.TemplateResolver;
import com.ryuqq.pipeline.core.error.InputBindingException;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Transform Step 실행기.
 *
 * <p>외부 I/O 없이 동기적으로 데이터를 재구성합니다. 실패는 입력이 잘못된 경우
 * (경로 없음, 목록이 아닌 데이터 등)에만 발생합니다.</p>
 *
 * <p><strong>변환 종류 (transform_type):</strong></p>
 * <ul>
 *   <li>extract: {@code fields}의 경로 값을 추출</li>
 *   <li>filter: 목록에서 {@code filter {field, operator, value}}를 만족하는 항목만 남김</li>
 *   <li>format: {@code template}에 데이터를 채운 문자열</li>
 *   <li>aggregate: count와 {@code functions}(sum, avg, min, max)의 {@code field} 집계</li>
 *   <li>sort: {@code field} 기준 정렬, {@code descending}</li>
 *   <li>map_values: {@code mapping}으로 키(객체) 또는 값(스칼라) 치환</li>
 * </ul>
 *
 * <p>원본 데이터는 {@code source_path}로 지정하며(입력 → 컨텍스트 순으로 조회),
 * 없으면 바인딩된 입력 전체입니다. 출력은 {@code {target_key: 결과}}이며 target_key 기본값은 "result"입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransformStepExecutor implements StepExecutor {

    static final String DEFAULT_TARGET_KEY = "result";

    private static final Set<String> TRANSFORM_TYPES =
        Set.of("extract", "filter", "format", "aggregate", "sort", "map_values");
    private static final Set<String> FILTER_OPERATORS =
        Set.of("==", "!=", "<", "<=", ">", ">=", "contains", "starts_with", "ends_with");
    private static final Set<String> AGGREGATE_FUNCTIONS = Set.of("count", "sum", "avg", "min", "max");

    @Override
    public StepType type() {
        return StepType.TRANSFORM;
    }

    @Override
    public List<String> validate(StepDefinition step) {
        List<String> errors = new ArrayList<>();
        StepConfig config = step.config();

        String transformType = transformType(config);
        if (transformType == null) {
            errors.add("transform_type is required");
            return errors;
        }
        if (!TRANSFORM_TYPES.contains(transformType)) {
            errors.add("Unknown transform type: " + transformType);
            return errors;
        }

        try {
            switch (transformType) {
                case "extract" -> {
                    if (config.getStringList("fields").isEmpty()) {
                        errors.add("fields is required for extract");
                    }
                }
                case "filter" -> {
                    Map<String, Object> filter = config.getMap("filter");
                    if (filter.get("field") == null) {
                        errors.add("filter.field is required");
                    }
                    Object operator = filter.getOrDefault("operator", "==");
                    if (!FILTER_OPERATORS.contains(String.valueOf(operator))) {
                        errors.add("Unknown filter operator: " + operator);
                    }
                }
                case "format" -> {
                    if (!config.contains("template")) {
                        errors.add("template is required for format");
                    }
                }
                case "aggregate" -> {
                    for (String function : config.getStringList("functions")) {
                        if (!AGGREGATE_FUNCTIONS.contains(function)) {
                            errors.add("Unknown aggregate function: " + function);
                        }
                    }
                }
                case "map_values" -> {
                    if (config.getMap("mapping").isEmpty()) {
                        errors.add("mapping is required for map_values");
                    }
                }
                default -> {
                    // sort: field는 선택
                }
            }
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    @Override
    public StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        String transformType = transformType(config);
        String sourcePath = config.getString("source_path");
        String targetKey = config.getString("target_key", DEFAULT_TARGET_KEY);

        try {
            // 1. 원본 데이터 조회
            Object data;
            if (sourcePath == null || sourcePath.isBlank()) {
                data = inputs;
            } else {
                data = context.lookup(sourcePath, inputs)
                    .orElseThrow(() -> new MalformedInputException("Source path not found: " + sourcePath));
            }

            // 2. 변환
            Object result = apply(transformType, data, config);

            Map<String, Object> output = new LinkedHashMap<>();
            output.put(targetKey, result);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("transform_type", transformType);
            if (sourcePath != null) {
                metadata.put("source_path", sourcePath);
            }
            metadata.put("target_key", targetKey);
            return StepResult.success(output, 0.0, 0, metadata);

        } catch (MalformedInputException | InputBindingException e) {
            return StepResult.failure(e.getMessage());
        }
    }

    /**
     * 시뮬레이션 실행에서는 upstream 출력이 가짜 값이므로 잘못된 입력을 실패로 보지 않습니다.
     */
    @Override
    public StepResult dryRun(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        StepResult result = run(config, inputs, context);
        if (result.success()) {
            return result;
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put(config.getString("target_key", DEFAULT_TARGET_KEY), null);
        return StepResult.success(output, 0.0, 0, Map.of("dry_run", true, "skipped_error", result.error()));
    }

    private Object apply(String transformType, Object data, StepConfig config) {
        return switch (transformType) {
            case "extract" -> extract(data, config.getStringList("fields"));
            case "filter" -> filter(data, config.getMap("filter"));
            case "format" -> format(data, config.getString("template"));
            case "aggregate" -> aggregate(data, config.getString("field"), config.getStringList("functions"));
            case "sort" -> sort(data, config.getString("field"), config.getBoolean("descending", false));
            case "map_values" -> mapValues(data, config.getMap("mapping"));
            default -> throw new MalformedInputException("Unknown transform type: " + transformType);
        };
    }

    private Object extract(Object data, List<String> fields) {
        if (data instanceof List) {
            List<Object> rows = new ArrayList<>();
            for (Object item : (List<?>) data) {
                rows.add(extract(item, fields));
            }
            return rows;
        }
        if (!(data instanceof Map)) {
            throw new MalformedInputException("extract requires an object or a list of objects");
        }
        Map<String, Object> extracted = new LinkedHashMap<>();
        for (String field : fields) {
            Object value = PathLookup.find(data, field)
                .orElseThrow(() -> new MalformedInputException("Field not found: " + field));
            extracted.put(field, value);
        }
        return extracted;
    }

    private List<Object> filter(Object data, Map<String, Object> filter) {
        List<?> items = requireList(data, "filter");
        String field = String.valueOf(filter.get("field"));
        String operator = String.valueOf(filter.getOrDefault("operator", "=="));
        Object expected = filter.get("value");

        List<Object> kept = new ArrayList<>();
        for (Object item : items) {
            Optional<Object> actual = PathLookup.find(item, field);
            if (actual.isPresent() && matches(actual.get(), operator, expected)) {
                kept.add(item);
            }
        }
        return kept;
    }

    private static boolean matches(Object actual, String operator, Object expected) {
        return switch (operator) {
            case "==" -> ValueComparisons.equalsLoosely(actual, expected);
            case "!=" -> !ValueComparisons.equalsLoosely(actual, expected);
            case "<" -> ValueComparisons.compareNumbers(actual, expected, c -> c < 0);
            case "<=" -> ValueComparisons.compareNumbers(actual, expected, c -> c <= 0);
            case ">" -> ValueComparisons.compareNumbers(actual, expected, c -> c > 0);
            case ">=" -> ValueComparisons.compareNumbers(actual, expected, c -> c >= 0);
            case "contains" -> ValueComparisons.contains(actual, expected);
            case "starts_with" -> expected != null && String.valueOf(actual).startsWith(String.valueOf(expected));
            case "ends_with" -> expected != null && String.valueOf(actual).endsWith(String.valueOf(expected));
            default -> throw new MalformedInputException("Unknown filter operator: " + operator);
        };
    }

    private String format(Object data, String template) {
        Object scope = data instanceof Map ? data : Map.of("data", data == null ? "" : data);
        try {
            return TemplateResolver.resolveToString(template, path -> PathLookup.match(scope, path));
        } catch (InputBindingException e) {
            throw new MalformedInputException("format " + e.getMessage());
        }
    }

    private Map<String, Object> aggregate(Object data, String field, List<String> functions) {
        List<?> items = requireList(data, "aggregate");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", items.size());
        if (field == null) {
            return result;
        }

        List<Double> values = new ArrayList<>();
        for (Object item : items) {
            Optional<Object> value = PathLookup.find(item, field);
            if (value.isPresent() && value.get() instanceof Number) {
                values.add(((Number) value.get()).doubleValue());
            }
        }
        if (values.isEmpty()) {
            return result;
        }

        double sum = values.stream().mapToDouble(Double::doubleValue).sum();
        if (functions.contains("sum")) {
            result.put("sum", sum);
        }
        if (functions.contains("avg")) {
            result.put("avg", sum / values.size());
        }
        if (functions.contains("min")) {
            result.put("min", values.stream().mapToDouble(Double::doubleValue).min().orElse(0));
        }
        if (functions.contains("max")) {
            result.put("max", values.stream().mapToDouble(Double::doubleValue).max().orElse(0));
        }
        return result;
    }

    private List<Object> sort(Object data, String field, boolean descending) {
        List<Object> sorted = new ArrayList<>(requireList(data, "sort"));
        Comparator<Object> comparator = (left, right) -> ValueComparisons.compareForSort(
            field == null ? left : PathLookup.find(left, field).orElse(null),
            field == null ? right : PathLookup.find(right, field).orElse(null)
        );
        sorted.sort(descending ? comparator.reversed() : comparator);
        return sorted;
    }

    private Object mapValues(Object data, Map<String, Object> mapping) {
        if (data instanceof Map) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
                String key = String.valueOf(entry.getKey());
                Object newKey = mapping.getOrDefault(key, key);
                renamed.put(String.valueOf(newKey), entry.getValue());
            }
            return renamed;
        }
        if (data instanceof List) {
            List<Object> mapped = new ArrayList<>();
            for (Object item : (List<?>) data) {
                mapped.add(mapValues(item, mapping));
            }
            return mapped;
        }
        return mapping.getOrDefault(String.valueOf(data), data);
    }

    private static List<?> requireList(Object data, String transformType) {
        if (!(data instanceof List)) {
            throw new MalformedInputException(transformType + " requires list data");
        }
        return (List<?>) data;
    }

    private static String transformType(StepConfig config) {
        return config.getString("transform_type", config.getString("type"));
    }

    /**
     * 입력 형식 오류. 실행기 내부에서만 쓰이며 실패 결과로 변환됩니다.
     */
    private static final class MalformedInputException extends RuntimeException {

        MalformedInputException(String message) {
            super(message);
        }
    }
}
