package com.ryuqq.pipeline.core.model;

/**
 * Step 종류.
 *
 * <p>닫힌 집합이며 각 값은 정확히 하나의 {@code StepExecutor} 구현에 대응합니다.
 * {@link #wireName()}은 정의 문서와 이벤트에서 쓰이는 소문자 태그입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StepType {

    /** 모델 서빙 협력자 호출. */
    MODEL_CALL("llm"),

    /** 샌드박스 코드 실행. */
    CODE("code"),

    /** 외부 HTTP 엔드포인트 호출. */
    HTTP("api"),

    /** 순수 데이터 변환. */
    TRANSFORM("transform"),

    /** 단일 비교식 평가 후 분기 선택. */
    CONDITION("condition"),

    /** 여러 upstream 출력 결합. */
    MERGE("merge");

    private final String wireName;

    StepType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 태그 문자열로 StepType 조회.
     *
     * @param wireName 소문자 태그 (예: "llm")
     * @return 대응하는 StepType
     * @throws IllegalArgumentException 알 수 없는 태그인 경우
     */
    public static StepType fromWireName(String wireName) {
        for (StepType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + wireName);
    }
}
