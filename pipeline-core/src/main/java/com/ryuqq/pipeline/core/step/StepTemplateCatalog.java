package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.model.StepType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Step 템플릿 카탈로그.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepTemplateCatalog {

    private static final List<StepTemplate> TEMPLATES = List.of(
        new StepTemplate(
            StepType.MODEL_CALL,
            "LLM Generation",
            "Generate text using a language model",
            Map.of("max_tokens", 2048, "temperature", 0.7, "top_p", 1.0, "response_format", "text"),
            List.of("model_id", "prompt"),
            List.of("system_prompt", "max_tokens", "temperature", "top_p",
                "frequency_penalty", "presence_penalty", "response_format", "provider")
        ),
        new StepTemplate(
            StepType.CODE,
            "Code Execution",
            "Execute Python or JavaScript code in a sandbox",
            Map.of("language", "python", "timeout", 30, "memory_limit", 128),
            List.of("code"),
            List.of("language", "timeout", "memory_limit", "packages")
        ),
        new StepTemplate(
            StepType.HTTP,
            "API Call",
            "Make HTTP requests to external APIs",
            Map.of("method", "GET", "timeout", 30),
            List.of("url"),
            List.of("method", "headers", "body", "auth", "timeout", "accept_status")
        ),
        new StepTemplate(
            StepType.TRANSFORM,
            "Data Transform",
            "Extract, filter, format, aggregate, sort or remap data",
            Map.of("transform_type", "extract", "target_key", "result"),
            List.of("transform_type"),
            List.of("source_path", "target_key", "fields", "filter", "template",
                "field", "functions", "descending", "mapping")
        ),
        new StepTemplate(
            StepType.CONDITION,
            "Condition",
            "Branch execution on a single comparison",
            Map.of("condition", Map.of("operator", "eq")),
            List.of("condition"),
            List.of("true_branch", "false_branch")
        ),
        new StepTemplate(
            StepType.MERGE,
            "Merge",
            "Combine the outputs of several upstream branches",
            Map.of("strategy", "object"),
            List.of(),
            List.of("strategy", "sources", "separator")
        )
    );

    private StepTemplateCatalog() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<StepTemplate> templates() {
        return TEMPLATES;
    }

    public static Optional<StepTemplate> find(StepType type) {
        return TEMPLATES.stream().filter(t -> t.type() == type).findFirst();
    }
}
