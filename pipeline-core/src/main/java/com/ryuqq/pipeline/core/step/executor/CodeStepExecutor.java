package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.spi.CodeOutcome;
import com.ryuqq.pipeline.core.spi.CodeRequest;
import com.ryuqq.pipeline.core.spi.CodeSandbox;
import com.ryuqq.pipeline.core.spi.SandboxSession;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Code-Execution Step 실행기.
 *
 * <p>시도마다 {@link SandboxSession}을 획득하고 try-with-resources로 반납합니다.
 * 타임아웃이나 취소로 중단되더라도 세션은 항상 닫힙니다.</p>
 *
 * <p><strong>설정 필드:</strong></p>
 * <ul>
 *   <li>code (필수)</li>
 *   <li>language: python | javascript (기본 python)</li>
 *   <li>timeout: 초 단위 wall-clock 제한 (기본 30)</li>
 *   <li>memory_limit: MB (기본 128)</li>
 *   <li>packages: 허용 패키지 목록</li>
 * </ul>
 *
 * <p>스니펫은 변수, 이전 Step 출력, 바인딩된 입력을 전역 변수로 받으며
 * {@code result}에 할당한 값이 출력이 됩니다. 할당이 없으면 stdout이 출력입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CodeStepExecutor implements StepExecutor {

    static final String DEFAULT_LANGUAGE = "python";
    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_MEMORY_LIMIT_MB = 128;

    private final CodeSandbox sandbox;

    public CodeStepExecutor(CodeSandbox sandbox) {
        if (sandbox == null) {
            throw new IllegalArgumentException("sandbox cannot be null");
        }
        this.sandbox = sandbox;
    }

    @Override
    public StepType type() {
        return StepType.CODE;
    }

    @Override
    public List<String> validate(StepDefinition step) {
        List<String> errors = new ArrayList<>();
        StepConfig config = step.config();

        if (!config.contains("code") || config.getString("code").isBlank()) {
            errors.add("code is required");
        }
        String language = config.getString("language", DEFAULT_LANGUAGE);
        if (!sandbox.supportedLanguages().contains(language)) {
            errors.add("Unsupported language: " + language);
        }
        try {
            if (config.getInt("timeout", DEFAULT_TIMEOUT_SECONDS) <= 0) {
                errors.add("timeout must be positive (current: " + config.get("timeout") + ")");
            }
            if (config.getInt("memory_limit", DEFAULT_MEMORY_LIMIT_MB) <= 0) {
                errors.add("memory_limit must be positive (current: " + config.get("memory_limit") + ")");
            }
            config.getList("packages");
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    @Override
    public StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        String language = config.getString("language", DEFAULT_LANGUAGE);
        CodeRequest request = new CodeRequest(
            language,
            config.getString("code", ""),
            sandboxGlobals(inputs, context),
            Duration.ofSeconds(config.getInt("timeout", DEFAULT_TIMEOUT_SECONDS)),
            config.getInt("memory_limit", DEFAULT_MEMORY_LIMIT_MB),
            config.getStringList("packages")
        );

        context.checkpoint();
        try (SandboxSession session = sandbox.open(language)) {
            CodeOutcome outcome = session.run(request);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("language", language);
            metadata.put("stdout", outcome.stdout());

            if (!outcome.success()) {
                String error = outcome.error() == null ? "Code execution failed" : outcome.error();
                return new StepResult(false, null, error, 0.0, 0, null, metadata, null);
            }
            Object output = outcome.result() != null ? outcome.result() : outcome.stdout();
            return StepResult.success(output, 0.0, 0, metadata);

        } catch (StepExecutionException e) {
            return StepResult.failure(e.getMessage());
        }
    }

    @Override
    public StepResult dryRun(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        return StepResult.success(
            "[DRY RUN] Code execution skipped",
            0.0,
            0,
            Map.of("language", config.getString("language", DEFAULT_LANGUAGE), "dry_run", true)
        );
    }

    private static Map<String, Object> sandboxGlobals(Map<String, Object> inputs, ExecutionContext context) {
        Map<String, Object> globals = new LinkedHashMap<>(context.stepOutputsSnapshot());
        globals.putAll(context.snapshot());
        if (inputs != null) {
            globals.putAll(inputs);
        }
        return globals;
    }
}
