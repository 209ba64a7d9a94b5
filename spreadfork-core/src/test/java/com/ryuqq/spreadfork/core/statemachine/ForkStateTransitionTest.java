package com.ryuqq.spreadfork.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.spreadfork.core.statemachine.ForkState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ForkStateTransition 테스트.
 *
 * <ul>
 *   <li>CREATED/MODIFIED → MODIFIED, SAVED, DISCARDED 허용</li>
 *   <li>종료 상태(SAVED, DISCARDED)에서의 전이는 IllegalStateException</li>
 *   <li>MODIFIED → CREATED 금지</li>
 * </ul>
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
class ForkStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_CreatedToModified_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> ForkStateTransition.validate(CREATED, MODIFIED));
    }

    @Test
    void validate_ModifiedToModified_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> ForkStateTransition.validate(MODIFIED, MODIFIED));
    }

    @Test
    void transition_NormalFlowToSaved_Succeeds() {
        // Given
        ForkState state = CREATED;

        // When
        state = ForkStateTransition.transition(state, MODIFIED);
        state = ForkStateTransition.transition(state, SAVED);

        // Then
        assertEquals(SAVED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_CreatedToDiscarded_Succeeds() {
        // When
        ForkState state = ForkStateTransition.transition(CREATED, DISCARDED);

        // Then
        assertTrue(state.isTerminal());
    }

    // ========== 금지된 전이 테스트 ==========

    @Test
    void validate_SavedToModified_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> ForkStateTransition.validate(SAVED, MODIFIED)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_DiscardedToSaved_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> ForkStateTransition.validate(DISCARDED, SAVED));
    }

    @Test
    void validate_ModifiedToCreated_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> ForkStateTransition.validate(MODIFIED, CREATED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ForkStateTransition.validate(null, MODIFIED));
        assertThrows(IllegalArgumentException.class, () -> ForkStateTransition.validate(CREATED, null));
    }

    @Test
    void isTerminal_OnlySavedAndDiscarded() {
        assertFalse(CREATED.isTerminal());
        assertFalse(MODIFIED.isTerminal());
        assertTrue(SAVED.isTerminal());
        assertTrue(DISCARDED.isTerminal());
    }
}
