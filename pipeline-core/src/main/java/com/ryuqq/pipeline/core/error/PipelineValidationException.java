package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.validation.ValidationResult;

/**
 * 검증에 실패한 파이프라인을 실행하려 할 때 발생.
 *
 * <p>어떤 Step도 디스패치되기 전에 던져지므로 호출자는 정의를 고친 뒤
 * 전체를 다시 요청하면 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PipelineValidationException extends PipelineException {

    private final ValidationResult result;

    public PipelineValidationException(ValidationResult result) {
        super("Pipeline validation failed: " + String.join("; ", result.errors()));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    @Override
    public String errorCode() {
        return "VALIDATION_ERROR";
    }
}
