package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.model.ExecutionId;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.spi.CodeOutcome;
import com.ryuqq.pipeline.core.spi.CodeRequest;
import com.ryuqq.pipeline.core.spi.CodeSandbox;
import com.ryuqq.pipeline.core.spi.SandboxSession;
import com.ryuqq.pipeline.core.step.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CodeStepExecutor 유닛 테스트.
 *
 * <p>세션은 성공, 실패와 관계없이 항상 닫혀야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CodeStepExecutorTest {

    @Mock
    private CodeSandbox sandbox;

    @Mock
    private SandboxSession session;

    private CodeStepExecutor executor;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        executor = new CodeStepExecutor(sandbox);
        context = new ExecutionContext(ExecutionId.of("exec-1"), "p", Map.of("limit", 3), 2, false);
        context.recordStepOutput("fetch", List.of(1, 2, 3));
    }

    @Test
    void run_변수와_입력을_전역으로_전달하고_결과를_출력함() {
        // given
        when(sandbox.open("python")).thenReturn(session);
        when(session.run(any())).thenReturn(CodeOutcome.success(Map.of("total", 6), "done\n"));

        // when
        StepResult result = executor.run(StepConfig.of(Map.of("code", "result = sum(fetch)")),
            Map.of("extra", true), context);

        // then
        ArgumentCaptor<CodeRequest> captor = ArgumentCaptor.forClass(CodeRequest.class);
        verify(session).run(captor.capture());
        assertThat(captor.getValue().inputs())
            .containsEntry("fetch", List.of(1, 2, 3))
            .containsEntry("limit", 3)
            .containsEntry("extra", true);
        assertThat(captor.getValue().memoryLimitMb()).isEqualTo(128);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo(Map.of("total", 6));
        assertThat(result.metadata()).containsEntry("stdout", "done\n");
        verify(session).close();
    }

    @Test
    void run_결과가_없으면_stdout을_출력함() {
        // given
        when(sandbox.open("python")).thenReturn(session);
        when(session.run(any())).thenReturn(CodeOutcome.success(null, "printed"));

        // when
        StepResult result = executor.run(StepConfig.of(Map.of("code", "print('printed')")), Map.of(), context);

        // then
        assertThat(result.output()).isEqualTo("printed");
    }

    @Test
    void run_stdout이_null인_성공_결과도_성공으로_처리함() {
        // given
        when(sandbox.open("python")).thenReturn(session);
        when(session.run(any())).thenReturn(new CodeOutcome(true, 42, null, null));

        // when
        StepResult result = executor.run(StepConfig.of(Map.of("code", "result = 42")), Map.of(), context);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo(42);
        assertThat(result.metadata()).containsEntry("stdout", "");
        verify(session).close();
    }

    @Test
    void run_스니펫_오류는_실패_결과가_되고_세션을_닫음() {
        // given
        when(sandbox.open("javascript")).thenReturn(session);
        when(session.run(any())).thenReturn(CodeOutcome.failure("ReferenceError: x is not defined", ""));

        // when
        StepResult result = executor.run(StepConfig.of(Map.of("code", "x", "language", "javascript")),
            Map.of(), context);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("ReferenceError: x is not defined");
        verify(session).close();
    }

    @Test
    void run_샌드박스_획득_실패는_실패_결과가_됨() {
        // given
        when(sandbox.open("python")).thenThrow(new StepExecutionException("No sandbox available"));

        // when
        StepResult result = executor.run(StepConfig.of(Map.of("code", "1")), Map.of(), context);

        // then
        assertThat(result.error()).isEqualTo("No sandbox available");
    }

    @Test
    void validate_지원하지_않는_언어와_제한값을_검사함() {
        // given
        when(sandbox.supportedLanguages()).thenReturn(Set.of("python", "javascript"));
        StepDefinition step = StepDefinition.builder("c", StepType.CODE)
            .config(Map.of("code", "1", "language", "ruby", "memory_limit", 0))
            .build();

        // when
        List<String> errors = executor.validate(step);

        // then
        assertThat(errors).containsExactly("Unsupported language: ruby", "memory_limit must be positive (current: 0)");
    }

    @Test
    void dryRun_샌드박스를_사용하지_않음() {
        // when
        StepResult result = executor.dryRun(StepConfig.of(Map.of("code", "1")), Map.of(), context);

        // then
        assertThat(result.output()).isEqualTo("[DRY RUN] Code execution skipped");
        verifyNoInteractions(sandbox);
    }
}
