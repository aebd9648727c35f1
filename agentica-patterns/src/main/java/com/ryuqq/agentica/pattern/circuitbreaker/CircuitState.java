package com.ryuqq.agentica.pattern.circuitbreaker;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (primary 호출)
 *   │
 *   ▼ (연속 실패 maxFailures 도달)
 * OPEN (fallback만 호출)
 *   │
 *   ▼ (resetTimeout 경과 후 다음 호출)
 * HALF_OPEN (primary 시험 호출 1회)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public enum CircuitState {

    /**
     * 정상 상태.
     *
     * <p>primary 에이전트를 호출하고 연속 실패 수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태.
     *
     * <p>primary를 시도하지 않고 모든 호출을 fallback으로 보냅니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>한 번에 하나의 시험 호출만 primary로 보냅니다.</p>
     */
    HALF_OPEN
}
