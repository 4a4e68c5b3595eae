package com.ryuqq.pipeline.core.context;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 점(.)으로 구분된 경로로 중첩 값 조회.
 *
 * <p>각 세그먼트는 Map의 키 또는 List의 인덱스로 해석됩니다.
 * 중간 값이 없거나 null이면 결과는 비어 있습니다. 명시적으로 null이 저장된 키와 없는 키를
 * 구분해야 하면 {@link #match(Object, String)}를 사용합니다.</p>
 *
 * <pre>
 * PathLookup.find(Map.of("user", Map.of("tags", List.of("a", "b"))), "user.tags.1") → Optional["b"]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PathLookup {

    private PathLookup() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Optional<Object> find(Object root, String path) {
        if (path == null || path.isBlank()) {
            return Optional.ofNullable(root);
        }
        return find(root, split(path));
    }

    public static Optional<Object> find(Object root, String[] segments) {
        Match match = match(root, segments);
        return match.found() ? Optional.ofNullable(match.value()) : Optional.empty();
    }

    public static Match match(Object root, String path) {
        if (path == null || path.isBlank()) {
            return root == null ? Match.NONE : Match.of(root);
        }
        return match(root, split(path));
    }

    /**
     * 경로 조회. 마지막 세그먼트의 키가 존재하면 값이 null이어도 찾은 것으로 봅니다.
     */
    public static Match match(Object root, String[] segments) {
        Object current = root;
        for (String segment : segments) {
            if (current == null || !has(current, segment)) {
                return Match.NONE;
            }
            current = step(current, segment);
        }
        return Match.of(current);
    }

    public static String[] split(String path) {
        return path.trim().split("\\.");
    }

    private static boolean has(Object current, String segment) {
        if (current instanceof Map) {
            return ((Map<?, ?>) current).containsKey(segment);
        }
        if (current instanceof List) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < ((List<?>) current).size();
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(segment);
        }
        if (current instanceof List) {
            List<?> list = (List<?>) current;
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * 경로 조회 결과.
     *
     * @param found 경로가 존재하는지 여부
     * @param value 조회된 값 (null 가능)
     */
    public record Match(boolean found, Object value) {

        public static final Match NONE = new Match(false, null);

        public static Match of(Object value) {
            return new Match(true, value);
        }
    }
}
