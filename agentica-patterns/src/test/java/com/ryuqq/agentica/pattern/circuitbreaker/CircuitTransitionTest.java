package com.ryuqq.agentica.pattern.circuitbreaker;

import org.junit.jupiter.api.Test;

import static com.ryuqq.agentica.pattern.circuitbreaker.CircuitState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitTransition 테스트.
 *
 * <ul>
 *   <li>CLOSED → OPEN → HALF_OPEN → CLOSED 정상 전이</li>
 *   <li>HALF_OPEN → OPEN 재개방</li>
 *   <li>CLOSED → HALF_OPEN, OPEN → CLOSED 시도 시 IllegalStateException</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
class CircuitTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_RecoveryCycle_Succeeds() {
        // Given
        CircuitState state = CLOSED;

        // When
        state = CircuitTransition.transition(state, OPEN);
        state = CircuitTransition.transition(state, HALF_OPEN);
        state = CircuitTransition.transition(state, CLOSED);

        // Then
        assertEquals(CLOSED, state);
    }

    @Test
    void validate_HalfOpenToOpen_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> CircuitTransition.validate(HALF_OPEN, OPEN));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_ClosedToHalfOpen_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> CircuitTransition.validate(CLOSED, HALF_OPEN)
        );
        assertEquals("Invalid circuit transition: CLOSED → HALF_OPEN", exception.getMessage());
    }

    @Test
    void validate_OpenToClosed_ThrowsException() {
        // 열린 회로는 시험 호출을 거쳐야만 닫힌다
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> CircuitTransition.validate(OPEN, CLOSED)
        );
        assertTrue(exception.getMessage().contains("OPEN → CLOSED"));
    }

    @Test
    void validate_SameState_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(CLOSED, CLOSED));
        assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(OPEN, OPEN));
        assertThrows(IllegalStateException.class, () -> CircuitTransition.validate(HALF_OPEN, HALF_OPEN));
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> CircuitTransition.validate(null, OPEN));
        assertThrows(IllegalArgumentException.class, () -> CircuitTransition.validate(OPEN, null));
    }
}
