package com.ryuqq.pipeline.core.context;

import com.ryuqq.pipeline.core.error.InputBindingException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TemplateResolver 테스트.
 *
 * <ul>
 *   <li>문장 내 placeholder는 문자열로 치환</li>
 *   <li>문자열 전체가 placeholder 하나이면 원래 타입 유지</li>
 *   <li>Map, List는 재귀적으로 해석</li>
 *   <li>해석 불가 placeholder는 InputBindingException</li>
 *   <li>null로 저장된 값은 해석 가능 (문장 중간은 빈 문자열)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TemplateResolverTest {

    private static final Map<String, Object> SCOPE = scope();

    private static final Function<String, PathLookup.Match> LOOKUP = path -> PathLookup.match(SCOPE, path);

    private static Map<String, Object> scope() {
        Map<String, Object> scope = new HashMap<>();
        scope.put("user", Map.of("name", "Ada", "tags", List.of("admin", "ops")));
        scope.put("count", 3);
        scope.put("note", null);
        return scope;
    }

    @Test
    void resolve_EmbeddedPlaceholders_ReplacedAsText() {
        // When
        Object resolved = TemplateResolver.resolve("Hello {{user.name}}, you have {{ count }} items", LOOKUP);

        // Then
        assertEquals("Hello Ada, you have 3 items", resolved);
    }

    @Test
    void resolve_WholeStringPlaceholder_KeepsRawType() {
        // When
        Object count = TemplateResolver.resolve("{{count}}", LOOKUP);
        Object tags = TemplateResolver.resolve("{{user.tags}}", LOOKUP);

        // Then
        assertEquals(3, count);
        assertEquals(List.of("admin", "ops"), tags);
    }

    @Test
    void resolve_ListIndexPath_Succeeds() {
        // When
        Object resolved = TemplateResolver.resolve("first={{user.tags.0}}", LOOKUP);

        // Then
        assertEquals("first=admin", resolved);
    }

    @Test
    void resolve_NestedStructures_ResolvedRecursively() {
        // Given
        Map<String, Object> template = Map.of(
            "greeting", "Hi {{user.name}}",
            "items", List.of("{{count}}", "static")
        );

        // When
        Object resolved = TemplateResolver.resolve(template, LOOKUP);

        // Then
        assertEquals(Map.of("greeting", "Hi Ada", "items", List.of(3, "static")), resolved);
    }

    @Test
    void resolve_NonTemplateValue_ReturnedAsIs() {
        // When & Then
        assertEquals(42, TemplateResolver.resolve(42, LOOKUP));
        assertEquals("plain text", TemplateResolver.resolve("plain text", LOOKUP));
    }

    @Test
    void resolve_MissingPath_ThrowsInputBindingException() {
        // When & Then
        InputBindingException exception = assertThrows(
            InputBindingException.class,
            () -> TemplateResolver.resolve("Hello {{user.email}}", LOOKUP)
        );
        assertEquals("user.email", exception.getPath());
        assertEquals("Unresolved template placeholder: {{user.email}}", exception.getMessage());
    }

    @Test
    void resolve_ExplicitNullValue_RendersEmptyInText() {
        // When
        Object resolved = TemplateResolver.resolve("note={{note}}", LOOKUP);

        // Then
        assertEquals("note=", resolved);
    }

    @Test
    void resolve_ExplicitNullValue_WholePlaceholderReturnsNull() {
        // When & Then
        assertNull(TemplateResolver.resolve("{{note}}", LOOKUP));
        assertNull(TemplateResolver.resolveToString("{{ note }}", LOOKUP));
    }

    @Test
    void resolve_PathBelowNullValue_ThrowsInputBindingException() {
        // When & Then
        assertThrows(InputBindingException.class, () -> TemplateResolver.resolve("{{note.text}}", LOOKUP));
    }

    @Test
    void resolveToString_WholePlaceholder_ReturnsText() {
        // When & Then
        assertEquals("3", TemplateResolver.resolveToString("{{count}}", LOOKUP));
    }

    @Test
    void placeholders_ReturnsDistinctPathsInOrder() {
        // When
        Set<String> paths = TemplateResolver.placeholders("{{b}} {{a}} {{ b }}");

        // Then
        assertEquals(List.of("b", "a"), List.copyOf(paths));
        assertTrue(TemplateResolver.placeholders(null).isEmpty());
    }
}
