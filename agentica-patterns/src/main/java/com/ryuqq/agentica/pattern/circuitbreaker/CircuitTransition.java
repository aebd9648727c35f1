package com.ryuqq.agentica.pattern.circuitbreaker;

/**
 * Circuit 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN</li>
 *   <li>OPEN → HALF_OPEN</li>
 *   <li>HALF_OPEN → CLOSED</li>
 *   <li>HALF_OPEN → OPEN</li>
 * </ul>
 *
 * <p>수동 {@code reset()}은 전이 규칙을 거치지 않습니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class CircuitTransition {

    private CircuitTransition() {
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
    public static void validate(CircuitState from, CircuitState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case CLOSED -> to == CircuitState.OPEN;
            case OPEN -> to == CircuitState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitState.CLOSED || to == CircuitState.OPEN;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 전이.
     *
     * @return 전이된 상태 (to)
     */
    public static CircuitState transition(CircuitState from, CircuitState to) {
        validate(from, to);
        return to;
    }
}
