/**
 * CircuitBreaker 패턴: primary/fallback 에이전트와 CLOSED / OPEN / HALF_OPEN 상태 머신.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.pattern.circuitbreaker;
