package com.ryuqq.pipeline.core.error;

/**
 * 엔진 내부 불변식이 깨졌을 때 발생.
 *
 * <p>실행은 즉시 FAILED로 종료되고 진행 중인 Step은 취소됩니다.
 * 호출자에게는 상세 메시지 대신 {@link #GENERIC_MESSAGE}만 노출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EngineFaultException extends PipelineException {

    public static final String GENERIC_MESSAGE = "Internal engine error";

    public EngineFaultException(String message) {
        super(message);
    }

    public EngineFaultException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "ENGINE_FAULT";
    }
}
