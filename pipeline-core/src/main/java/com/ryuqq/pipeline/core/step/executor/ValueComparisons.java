package com.ryuqq.pipeline.core.step.executor;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoublePredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Condition, Transform 실행기가 공유하는 값 비교 규칙.
 *
 * <p>숫자 비교는 양쪽 모두 숫자로 해석될 때만 수행되며, 그렇지 않으면 false입니다.
 * 동등 비교는 숫자끼리는 값으로, 그 외에는 {@link Objects#equals}로 판단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ValueComparisons {

    private ValueComparisons() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean equalsLoosely(Object left, Object right) {
        OptionalDouble l = asNumber(left);
        OptionalDouble r = asNumber(right);
        if (left instanceof Number && r.isPresent() || right instanceof Number && l.isPresent()) {
            return l.isPresent() && r.isPresent() && Double.compare(l.getAsDouble(), r.getAsDouble()) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * 숫자 비교.
     *
     * @param left 왼쪽 값
     * @param right 오른쪽 값
     * @param test {@code left - right}에 대한 판정
     * @return 둘 다 숫자로 해석되고 판정이 참이면 true
     */
    static boolean compareNumbers(Object left, Object right, DoublePredicate test) {
        OptionalDouble l = asNumber(left);
        OptionalDouble r = asNumber(right);
        if (l.isEmpty() || r.isEmpty()) {
            return false;
        }
        return test.test(Double.compare(l.getAsDouble(), r.getAsDouble()));
    }

    static boolean contains(Object container, Object value) {
        if (container instanceof String) {
            return value != null && ((String) container).contains(String.valueOf(value));
        }
        if (container instanceof Collection) {
            for (Object item : (Collection<?>) container) {
                if (equalsLoosely(item, value)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map) {
            return ((Map<?, ?>) container).containsKey(value);
        }
        return false;
    }

    static boolean in(Object value, Object candidates) {
        if (candidates instanceof Collection) {
            return contains(candidates, value);
        }
        if (candidates instanceof String) {
            return value != null && ((String) candidates).contains(String.valueOf(value));
        }
        return false;
    }

    static boolean matches(Object value, Object regex) {
        if (!(value instanceof String) || !(regex instanceof String)) {
            return false;
        }
        try {
            return Pattern.compile((String) regex).matcher((String) value).find();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    static OptionalDouble asNumber(Object value) {
        if (value instanceof Number) {
            return OptionalDouble.of(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            try {
                return OptionalDouble.of(Double.parseDouble(((String) value).trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    static int compareForSort(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : 1) : -1;
        }
        OptionalDouble l = asNumber(left);
        OptionalDouble r = asNumber(right);
        if (left instanceof Number && right instanceof Number && l.isPresent() && r.isPresent()) {
            return Double.compare(l.getAsDouble(), r.getAsDouble());
        }
        if (left instanceof Comparable && left.getClass() == right.getClass()) {
            return compareSameType((Comparable<?>) left, right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    /**
     * 같은 클래스의 두 값 비교 (호출 전 클래스 일치를 확인).
     */
    private static int compareSameType(Comparable<?> left, Object right) {
        Comparable<Object> comparable = (Comparable<Object>) left;
        return comparable.compareTo(right);
    }
}
