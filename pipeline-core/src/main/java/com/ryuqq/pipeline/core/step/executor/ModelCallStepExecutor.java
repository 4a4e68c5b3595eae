package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.InputBindingException;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.spi.ModelClient;
import com.ryuqq.pipeline.core.spi.ModelRequest;
import com.ryuqq.pipeline.core.spi.ModelResponse;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model-Call Step 실행기.
 *
 * <p>prompt 템플릿을 해석한 뒤 {@link ModelClient}를 호출하고, 생성된 텍스트와
 * 토큰 사용량을 반환합니다.</p>
 *
 * <p><strong>설정 필드:</strong></p>
 * <ul>
 *   <li>model_id (필수), prompt (필수, 템플릿)</li>
 *   <li>system_prompt, max_tokens (1~100000, 기본 2048), temperature (0~2, 기본 0.7)</li>
 *   <li>top_p (0~1, 기본 1.0), frequency_penalty / presence_penalty (-2~2, 기본 0)</li>
 *   <li>response_format (text | json), provider</li>
 * </ul>
 *
 * <p><strong>비용:</strong> prompt 토큰당 0.00001, completion 토큰당 0.00002.
 * 협력자가 비용을 직접 보고하면 그 값을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ModelCallStepExecutor implements StepExecutor {

    static final double PROMPT_TOKEN_PRICE = 0.00001;
    static final double COMPLETION_TOKEN_PRICE = 0.00002;
    static final int DEFAULT_MAX_TOKENS = 2048;
    static final double DEFAULT_TEMPERATURE = 0.7;
    static final double DEFAULT_TOP_P = 1.0;
    static final int DRY_RUN_COMPLETION_TOKENS = 50;

    private static final Set<String> RESPONSE_FORMATS = Set.of("text", "json");

    private final ModelClient modelClient;

    public ModelCallStepExecutor(ModelClient modelClient) {
        if (modelClient == null) {
            throw new IllegalArgumentException("modelClient cannot be null");
        }
        this.modelClient = modelClient;
    }

    @Override
    public StepType type() {
        return StepType.MODEL_CALL;
    }

    @Override
    public List<String> validate(StepDefinition step) {
        List<String> errors = new ArrayList<>();
        StepConfig config = step.config();

        if (!config.contains("model_id") || config.getString("model_id").isBlank()) {
            errors.add("model_id is required");
        }
        if (!config.contains("prompt") || config.getString("prompt").isBlank()) {
            errors.add("prompt is required");
        }
        checkRange(config, "max_tokens", 1, 100000, errors);
        checkRange(config, "temperature", 0.0, 2.0, errors);
        checkRange(config, "top_p", 0.0, 1.0, errors);
        checkRange(config, "frequency_penalty", -2.0, 2.0, errors);
        checkRange(config, "presence_penalty", -2.0, 2.0, errors);

        String format = config.getString("response_format", "text");
        if (!RESPONSE_FORMATS.contains(format)) {
            errors.add("response_format must be one of " + RESPONSE_FORMATS + " (current: " + format + ")");
        }
        return errors;
    }

    @Override
    public StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        try {
            // 1. 템플릿 해석
            String prompt = context.interpolateString(config.getString("prompt", ""), inputs);
            String systemPrompt = config.contains("system_prompt")
                ? context.interpolateString(config.getString("system_prompt"), inputs)
                : null;
            ModelRequest request = new ModelRequest(
                config.getString("model_id"),
                prompt,
                systemPrompt,
                config.getInt("max_tokens", DEFAULT_MAX_TOKENS),
                config.getDouble("temperature", DEFAULT_TEMPERATURE),
                config.getDouble("top_p", DEFAULT_TOP_P),
                config.getDouble("frequency_penalty", 0.0),
                config.getDouble("presence_penalty", 0.0),
                config.getString("response_format", "text"),
                config.getString("provider")
            );

            // 2. I/O 경계 체크포인트 후 호출
            context.checkpoint();
            ModelResponse response = modelClient.generate(request);

            // 3. 사용량 집계
            double cost = response.cost() != null
                ? response.cost()
                : response.promptTokens() * PROMPT_TOKEN_PRICE + response.completionTokens() * COMPLETION_TOKEN_PRICE;

            Map<String, Object> metadata = new LinkedHashMap<>(response.metadata());
            metadata.put("model_id", request.modelId());
            metadata.put("prompt_tokens", response.promptTokens());
            metadata.put("completion_tokens", response.completionTokens());

            Object output = request.wantsJson() && response.structured() != null
                ? response.structured()
                : response.text();
            return StepResult.success(output, cost, response.totalTokens(), metadata);

        } catch (InputBindingException | StepExecutionException e) {
            return StepResult.failure(e.getMessage());
        }
    }

    @Override
    public StepResult dryRun(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        String modelId = config.getString("model_id", "unknown");
        String prompt = config.getString("prompt", "");
        long tokens = countWords(prompt) + DRY_RUN_COMPLETION_TOKENS;
        double cost = tokens * PROMPT_TOKEN_PRICE;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model_id", modelId);
        metadata.put("dry_run", true);
        return StepResult.success("[DRY RUN] LLM Response from " + modelId, cost, tokens, metadata);
    }

    private static long countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static void checkRange(StepConfig config, String key, double min, double max, List<String> errors) {
        if (!config.contains(key)) {
            return;
        }
        try {
            double value = config.getDouble(key, min);
            if (value < min || value > max) {
                errors.add(key + " must be between " + format(min) + " and " + format(max) + " (current: " + config.get(key) + ")");
            }
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
