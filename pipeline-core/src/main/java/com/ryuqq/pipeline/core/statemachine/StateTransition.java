package com.ryuqq.pipeline.core.statemachine;

/**
 * 실행 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, SKIPPED, CANCELLED, FAILED</li>
 *   <li>RUNNING → COMPLETED, FAILED, CANCELLED, PAUSED</li>
 *   <li>PAUSED → RUNNING, CANCELLED</li>
 * </ul>
 *
 * <p>PENDING → FAILED는 실행 전 엔진 오류로 종료되는 경우에만 쓰입니다.
 * 종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ExecutionStatus from, ExecutionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == ExecutionStatus.RUNNING
                || to == ExecutionStatus.SKIPPED
                || to == ExecutionStatus.CANCELLED
                || to == ExecutionStatus.FAILED;
            case RUNNING -> to == ExecutionStatus.COMPLETED
                || to == ExecutionStatus.FAILED
                || to == ExecutionStatus.CANCELLED
                || to == ExecutionStatus.PAUSED;
            case PAUSED -> to == ExecutionStatus.RUNNING || to == ExecutionStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED, SKIPPED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     */
    public static ExecutionStatus transition(ExecutionStatus current, ExecutionStatus next) {
        validate(current, next);
        return next;
    }
}
