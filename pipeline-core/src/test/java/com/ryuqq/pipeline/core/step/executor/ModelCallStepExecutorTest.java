package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.spi.ModelClient;
import com.ryuqq.pipeline.core.spi.ModelRequest;
import com.ryuqq.pipeline.core.spi.ModelResponse;
import com.ryuqq.pipeline.core.step.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ModelCallStepExecutor 유닛 테스트.
 *
 * <ul>
 *   <li>prompt 템플릿 해석 후 ModelClient 호출</li>
 *   <li>토큰 기반 비용 계산 (응답에 비용이 있으면 그대로 사용)</li>
 *   <li>협력자 실패는 실패 결과로 변환</li>
 *   <li>시뮬레이션 실행은 협력자를 호출하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ModelCallStepExecutorTest {

    @Mock
    private ModelClient modelClient;

    private ModelCallStepExecutor executor;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        executor = new ModelCallStepExecutor(modelClient);
        context = new ExecutionContext(ExecutionId.of("exec-1"), "p", Map.of("topic", "rust"), 1, false);
    }

    private static StepConfig config(Map<String, Object> extra) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("model_id", "gpt-test");
        values.put("prompt", "Explain {{topic}}");
        values.putAll(extra);
        return StepConfig.of(values);
    }

    // ============================================================
    // 1. 정상 호출
    // ============================================================

    @Test
    void run_prompt_템플릿을_해석하고_토큰_비용을_계산함() {
        // given
        when(modelClient.generate(any())).thenReturn(ModelResponse.of("answer", 100, 50));

        // when
        StepResult result = executor.run(config(Map.of("system_prompt", "Be brief")), Map.of(), context);

        // then
        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(modelClient).generate(captor.capture());
        assertThat(captor.getValue().prompt()).isEqualTo("Explain rust");
        assertThat(captor.getValue().systemPrompt()).isEqualTo("Be brief");
        assertThat(captor.getValue().maxTokens()).isEqualTo(2048);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("answer");
        assertThat(result.tokensUsed()).isEqualTo(150);
        assertThat(result.cost()).isCloseTo(100 * 0.00001 + 50 * 0.00002, within(1e-12));
        assertThat(result.metadata()).containsEntry("model_id", "gpt-test")
            .containsEntry("prompt_tokens", 100L)
            .containsEntry("completion_tokens", 50L);
    }

    @Test
    void run_응답에_비용이_있으면_그대로_사용함() {
        // given
        when(modelClient.generate(any()))
            .thenReturn(new ModelResponse("ok", null, 10, 10, 0.5, Map.of()));

        // when
        StepResult result = executor.run(config(Map.of()), Map.of(), context);

        // then
        assertThat(result.cost()).isEqualTo(0.5);
    }

    @Test
    void run_JSON_형식이면_구조화된_응답을_출력함() {
        // given
        Map<String, Object> structured = Map.of("score", 7);
        when(modelClient.generate(any()))
            .thenReturn(new ModelResponse("{\"score\":7}", structured, 5, 5, null, Map.of()));

        // when
        StepResult result = executor.run(config(Map.of("response_format", "json")), Map.of(), context);

        // then
        assertThat(result.output()).isEqualTo(structured);
    }

    // ============================================================
    // 2. 실패 처리
    // ============================================================

    @Test
    void run_협력자_예외는_실패_결과가_됨() {
        // given
        when(modelClient.generate(any())).thenThrow(new StepExecutionException("Model API error: 503"));

        // when
        StepResult result = executor.run(config(Map.of()), Map.of(), context);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Model API error: 503");
    }

    @Test
    void run_해석_불가_placeholder면_호출하지_않고_실패함() {
        // when
        StepResult result = executor.run(config(Map.of("prompt", "Hi {{nobody}}")), Map.of(), context);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unresolved template placeholder: {{nobody}}");
        verifyNoInteractions(modelClient);
    }

    // ============================================================
    // 3. 시뮬레이션 실행과 검증
    // ============================================================

    @Test
    void dryRun_협력자를_호출하지_않고_고정_응답을_반환함() {
        // when
        StepResult result = executor.dryRun(config(Map.of("prompt", "two words")), Map.of(), context);

        // then
        assertThat(result.output()).isEqualTo("[DRY RUN] LLM Response from gpt-test");
        assertThat(result.tokensUsed()).isEqualTo(52);
        verifyNoInteractions(modelClient);
    }

    @Test
    void validate_필수_필드와_범위를_검사함() {
        // given
        StepDefinition step = StepDefinition.builder("m", StepType.MODEL_CALL)
            .config(Map.of("temperature", 3.0))
            .build();

        // when
        List<String> errors = executor.validate(step);

        // then
        assertThat(errors).containsExactly(
            "model_id is required",
            "prompt is required",
            "temperature must be between 0 and 2 (current: 3.0)");
    }
}
