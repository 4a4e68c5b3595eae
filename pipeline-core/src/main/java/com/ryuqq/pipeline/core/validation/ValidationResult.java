package com.ryuqq.pipeline.core.validation;

import java.util.List;

/**
 * 파이프라인 검증 결과 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param valid 오류가 없으면 true
 * @param errors 실행을 막는 오류
 * @param warnings 실행은 가능하지만 주의가 필요한 항목
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("valid result cannot carry errors: " + errors);
        }
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }
}
