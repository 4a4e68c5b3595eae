package com.ryuqq.pipeline.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.pipeline.core.statemachine.ExecutionStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>PENDING → RUNNING → COMPLETED / FAILED / CANCELLED 정상 전이</li>
 *   <li>PENDING → SKIPPED (선택되지 않은 분기, 비활성 Step)</li>
 *   <li>종료 상태에서의 모든 전이는 IllegalStateException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToRunning_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, RUNNING));
    }

    @Test
    void validate_PendingToSkipped_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, SKIPPED));
    }

    @Test
    void validate_RunningToPaused_AndBack_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, PAUSED));
        assertDoesNotThrow(() -> StateTransition.validate(PAUSED, RUNNING));
    }

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        // Given
        ExecutionStatus state = PENDING;

        // When
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_NormalFlowToCancelled_Succeeds() {
        // Given
        ExecutionStatus state = PENDING;

        // When
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, CANCELLED);

        // Then
        assertEquals(CANCELLED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_CompletedToRunning_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(COMPLETED, RUNNING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_SkippedToRunning_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(SKIPPED, RUNNING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_PendingToCompleted_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PENDING, COMPLETED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_RunningToSkipped_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(RUNNING, SKIPPED));
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, RUNNING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(RUNNING, null));
    }

    // ========== 상태 속성 테스트 ==========

    @Test
    void satisfiesDependency_OnlyCompletedAndSkipped() {
        // When & Then
        assertTrue(COMPLETED.satisfiesDependency());
        assertTrue(SKIPPED.satisfiesDependency());
        assertFalse(FAILED.satisfiesDependency());
        assertFalse(CANCELLED.satisfiesDependency());
        assertFalse(RUNNING.satisfiesDependency());
    }

    @Test
    void wireName_IsLowerCase() {
        // When & Then
        assertEquals("skipped", SKIPPED.wireName());
        assertEquals("running", RUNNING.wireName());
    }
}
