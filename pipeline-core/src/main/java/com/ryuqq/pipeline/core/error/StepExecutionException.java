package com.ryuqq.pipeline.core.error;

/**
 * Step 실행기의 외부 협력자(모델, HTTP, 샌드박스)가 실패했을 때 발생.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepExecutionException extends PipelineException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "STEP_EXECUTION_ERROR";
    }
}
