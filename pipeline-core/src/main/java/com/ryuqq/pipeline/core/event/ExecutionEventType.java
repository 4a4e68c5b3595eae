package com.ryuqq.pipeline.core.event;

/**
 * 실행 이벤트 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionEventType {

    STARTED("started"),
    STEP_STARTED("step_started"),
    STEP_COMPLETED("step_completed"),
    STEP_FAILED("step_failed"),
    STEP_SKIPPED("step_skipped"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    ExecutionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 실행 종료 이벤트 여부.
     *
     * @return COMPLETED, FAILED, CANCELLED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
