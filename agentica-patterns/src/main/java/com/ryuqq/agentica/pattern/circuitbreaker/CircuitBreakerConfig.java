package com.ryuqq.agentica.pattern.circuitbreaker;

import com.ryuqq.agentica.core.model.AgentSpec;

import java.time.Duration;

/**
 * CircuitBreaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>primary: 기본 에이전트 명세</li>
 *   <li>fallback: 대체 에이전트 명세</li>
 *   <li>maxFailures: OPEN으로 전이하는 연속 실패 수 (기본 3)</li>
 *   <li>resetTimeout: OPEN 후 HALF_OPEN 시험까지 대기 시간 (기본 60초)</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param primary primary 명세
 * @param fallback fallback 명세
 * @param maxFailures 연속 실패 임계값 (1 이상)
 * @param resetTimeout 재시도 대기 시간 (0 이상)
 */
public record CircuitBreakerConfig(
    AgentSpec primary,
    AgentSpec fallback,
    int maxFailures,
    Duration resetTimeout
) {

    public static final int DEFAULT_MAX_FAILURES = 3;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (maxFailures <= 0) {
            throw new IllegalArgumentException("maxFailures must be positive (current: " + maxFailures + ")");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be non-negative (current: " + resetTimeout + ")");
        }
    }

    public static CircuitBreakerConfig of(String primaryPremise, String fallbackPremise) {
        return new CircuitBreakerConfig(AgentSpec.of(primaryPremise), AgentSpec.of(fallbackPremise),
            DEFAULT_MAX_FAILURES, DEFAULT_RESET_TIMEOUT);
    }

    public CircuitBreakerConfig withPrimary(AgentSpec primary) {
        return new CircuitBreakerConfig(primary, fallback, maxFailures, resetTimeout);
    }

    public CircuitBreakerConfig withFallback(AgentSpec fallback) {
        return new CircuitBreakerConfig(primary, fallback, maxFailures, resetTimeout);
    }

    public CircuitBreakerConfig withMaxFailures(int maxFailures) {
        return new CircuitBreakerConfig(primary, fallback, maxFailures, resetTimeout);
    }

    public CircuitBreakerConfig withResetTimeout(Duration resetTimeout) {
        return new CircuitBreakerConfig(primary, fallback, maxFailures, resetTimeout);
    }
}
