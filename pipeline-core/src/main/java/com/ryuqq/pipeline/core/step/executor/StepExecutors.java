package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.spi.CodeSandbox;
import com.ryuqq.pipeline.core.spi.HttpTransport;
import com.ryuqq.pipeline.core.spi.ModelClient;
import com.ryuqq.pipeline.core.step.StepExecutorRegistry;

/**
 * 기본 실행기 구성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepExecutors {

    private StepExecutors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 여섯 가지 Step 종류의 실행기를 모두 등록한 레지스트리 생성.
     *
     * @param modelClient 모델 서빙 협력자
     * @param transport HTTP 협력자
     * @param sandbox 코드 샌드박스 협력자
     * @return 레지스트리
     */
    public static StepExecutorRegistry defaultRegistry(ModelClient modelClient, HttpTransport transport, CodeSandbox sandbox) {
        return new StepExecutorRegistry()
            .register(new ModelCallStepExecutor(modelClient))
            .register(new CodeStepExecutor(sandbox))
            .register(new HttpStepExecutor(transport))
            .register(new TransformStepExecutor())
            .register(new ConditionStepExecutor())
            .register(new MergeStepExecutor());
    }
}
