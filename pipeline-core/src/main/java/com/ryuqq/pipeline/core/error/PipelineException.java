package com.ryuqq.pipeline.core.error;

/**
 * 파이프라인 엔진 예외의 최상위 타입.
 *
 * <p>모든 엔진 예외는 unchecked이며, 전송 계층 어댑터가 응답 코드로
 * 변환할 수 있도록 {@link #errorCode()}를 제공합니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link PipelineValidationException} - 실행 전 구조/설정 오류</li>
 *   <li>{@link InputBindingException} - 템플릿 placeholder 해석 실패</li>
 *   <li>{@link StepExecutionException} - 외부 협력자 실패</li>
 *   <li>{@link EngineFaultException} - 엔진 내부 불변식 위반</li>
 *   <li>{@link ExecutionCancelledException} - 협력적 취소 체크포인트</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 오류 분류 코드.
     *
     * @return 대문자 스네이크 케이스 코드 (예: VALIDATION_ERROR)
     */
    public abstract String errorCode();
}
