package com.ryuqq.pipeline.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Step 종류별 설정에 대한 불변 타입 뷰.
 *
 * <p>정의 문서의 {@code config} 객체를 그대로 보관하며, 실행기는 타입이 지정된
 * getter로 필드를 읽습니다. 값의 타입이 맞지 않으면 {@link IllegalArgumentException}이
 * 발생하고, 누락된 필드는 기본값으로 대체됩니다.</p>
 *
 * <pre>
 * StepConfig config = StepConfig.of(Map.of("model_id", "llama3", "max_tokens", 512));
 * int maxTokens = config.getInt("max_tokens", 2048);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepConfig {

    private static final StepConfig EMPTY = new StepConfig(Map.of());

    private final Map<String, Object> values;

    private StepConfig(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static StepConfig of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return new StepConfig(new LinkedHashMap<>(values));
    }

    public static StepConfig empty() {
        return EMPTY;
    }

    public boolean contains(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw typeMismatch(key, "an integer", value);
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw typeMismatch(key, "a number", value);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * 중첩 객체 필드 조회.
     *
     * @param key 필드 이름
     * @return 필드 값 (없으면 빈 Map)
     * @throws IllegalArgumentException 값이 객체가 아닌 경우
     */
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw typeMismatch(key, "an object", value);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 목록 필드 조회.
     *
     * @param key 필드 이름
     * @return 필드 값 (없으면 빈 List)
     * @throws IllegalArgumentException 값이 목록이 아닌 경우
     */
    public List<Object> getList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw typeMismatch(key, "a list", value);
        }
        return Collections.unmodifiableList(new ArrayList<Object>((List<?>) value));
    }

    public List<String> getStringList(String key) {
        List<String> result = new ArrayList<>();
        for (Object item : getList(key)) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return Collections.unmodifiableList(result);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static IllegalArgumentException typeMismatch(String key, String expected, Object actual) {
        return new IllegalArgumentException(
            "Config field '" + key + "' must be " + expected + " (current: " + actual + ")"
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((StepConfig) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StepConfig" + values;
    }
}
