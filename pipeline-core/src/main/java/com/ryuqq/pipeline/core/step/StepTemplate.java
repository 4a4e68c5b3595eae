package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.model.StepType;

import java.util.List;
import java.util.Map;

/**
 * 편집기에 제공되는 Step 종류별 템플릿.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param type Step 종류
 * @param name 표시 이름
 * @param description 설명
 * @param defaultConfig 기본 설정
 * @param requiredFields 필수 설정 필드
 * @param optionalFields 선택 설정 필드
 */
public record StepTemplate(
    StepType type,
    String name,
    String description,
    Map<String, Object> defaultConfig,
    List<String> requiredFields,
    List<String> optionalFields
) {

    public StepTemplate {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        defaultConfig = defaultConfig == null ? Map.of() : Map.copyOf(defaultConfig);
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        optionalFields = optionalFields == null ? List.of() : List.copyOf(optionalFields);
    }
}
