package com.ryuqq.pipeline.core.error;

/**
 * 취소 요청 이후 체크포인트에 도달한 실행기가 던지는 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExecutionCancelledException extends PipelineException {

    public ExecutionCancelledException(String executionId) {
        super("Execution cancelled: " + executionId);
    }

    @Override
    public String errorCode() {
        return "CANCELLED";
    }
}
