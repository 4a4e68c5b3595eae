package com.ryuqq.pipeline.core.statemachine;

/**
 * 실행(run)과 Step 실행의 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING → RUNNING → COMPLETED
 *                   → FAILED
 *                   → CANCELLED
 *         ↔ PAUSED
 * PENDING → SKIPPED (Step 전용)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    /**
     * 생성됨, 아직 시작 전.
     */
    PENDING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 성공 완료 (종료 상태).
     */
    COMPLETED,

    /**
     * 실패 (종료 상태).
     */
    FAILED,

    /**
     * 취소됨 (종료 상태).
     */
    CANCELLED,

    /**
     * 일시 정지, RUNNING으로 재진입 가능.
     */
    PAUSED,

    /**
     * 선택되지 않은 분기 또는 비활성화로 의도적으로 실행하지 않음 (Step 전용 종료 상태).
     */
    SKIPPED;

    /**
     * 종료 상태 여부.
     *
     * @return COMPLETED, FAILED, CANCELLED, SKIPPED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == SKIPPED;
    }

    /**
     * 하위 Step의 의존성 게이팅을 만족하는지 여부.
     *
     * @return COMPLETED 또는 SKIPPED이면 true
     */
    public boolean satisfiesDependency() {
        return this == COMPLETED || this == SKIPPED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
