package com.ryuqq.pipeline.core.model;

import java.util.UUID;

/**
 * 파이프라인 실행(run)의 전역 고유 식별자.
 *
 * <p>이벤트 스트림 구독, 취소, 레지스트리 조회의 키로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionId {

    private final String value;

    private ExecutionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ExecutionId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ExecutionId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ExecutionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 주어진 값으로 ExecutionId 생성.
     *
     * @param value 식별자 값
     * @return ExecutionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ExecutionId of(String value) {
        return new ExecutionId(value);
    }

    /**
     * 무작위 UUID 기반 ExecutionId 생성.
     *
     * @return 새 ExecutionId
     */
    public static ExecutionId generate() {
        return new ExecutionId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionId that = (ExecutionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ExecutionId{" + value + '}';
    }
}
