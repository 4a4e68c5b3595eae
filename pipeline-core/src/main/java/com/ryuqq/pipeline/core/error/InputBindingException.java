package com.ryuqq.pipeline.core.error;

/**
 * 템플릿 placeholder를 컨텍스트에서 찾을 수 없을 때 발생.
 *
 * <p>엔진 크래시가 아닌 Step 실패로 취급되며, 재시도 정책 안에서 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InputBindingException extends PipelineException {

    private final String path;

    public InputBindingException(String path) {
        super("Unresolved template placeholder: {{" + path + "}}");
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    @Override
    public String errorCode() {
        return "INPUT_BINDING_ERROR";
    }
}
