package com.ryuqq.pipeline.core.context;

import com.ryuqq.pipeline.core.error.InputBindingException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{dotted.path}}} 템플릿 해석기.
 *
 * <p><strong>문법:</strong></p>
 * <ul>
 *   <li>placeholder: {@code {{ path }}}, 앞뒤 공백 허용</li>
 *   <li>문자열 전체가 placeholder 하나이면 원래 타입의 값을 그대로 반환</li>
 *   <li>문장 중간의 placeholder는 문자열로 치환</li>
 *   <li>Map, List는 재귀적으로 해석</li>
 *   <li>값이 null로 저장된 경로: 전체 placeholder는 null, 문장 중간은 빈 문자열</li>
 * </ul>
 *
 * <p>존재하지 않는 경로는 빈 문자열로 대체하지 않고 {@link InputBindingException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    private TemplateResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 템플릿 값 해석.
     *
     * @param template 문자열, Map, List 또는 기타 값
     * @param lookup 경로 → 조회 결과 함수
     * @return 해석된 값
     * @throws InputBindingException placeholder를 해석할 수 없는 경우
     */
    public static Object resolve(Object template, Function<String, PathLookup.Match> lookup) {
        if (template instanceof String) {
            return resolveString((String) template, lookup);
        }
        if (template instanceof Map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) template).entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolve(entry.getValue(), lookup));
            }
            return resolved;
        }
        if (template instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object item : (List<?>) template) {
                resolved.add(resolve(item, lookup));
            }
            return resolved;
        }
        return template;
    }

    /**
     * 문자열 결과가 필요한 경우의 해석 (prompt, URL 등).
     */
    public static String resolveToString(String template, Function<String, PathLookup.Match> lookup) {
        Object resolved = resolveString(template, lookup);
        return resolved == null ? null : String.valueOf(resolved);
    }

    /**
     * 템플릿에 포함된 placeholder 경로 목록.
     */
    public static Set<String> placeholders(String template) {
        Set<String> paths = new LinkedHashSet<>();
        if (template == null) {
            return paths;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            paths.add(matcher.group(1));
        }
        return paths;
    }

    private static Object resolveString(String template, Function<String, PathLookup.Match> lookup) {
        Matcher matcher = PLACEHOLDER.matcher(template);

        // 1. 문자열 전체가 placeholder 하나인 경우 원래 타입 유지
        if (matcher.matches()) {
            return required(matcher.group(1), lookup);
        }

        // 2. 문장 내 placeholder 치환
        matcher.reset();
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = required(matcher.group(1), lookup);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : String.valueOf(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Object required(String path, Function<String, PathLookup.Match> lookup) {
        PathLookup.Match match = lookup.apply(path);
        if (match == null || !match.found()) {
            throw new InputBindingException(path);
        }
        return match.value();
    }
}
