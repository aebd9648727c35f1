package com.ryuqq.agentica.pattern.circuitbreaker;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * CircuitBreaker 패턴: primary 에이전트의 연속 실패를 추적하여 fallback 에이전트로 우회합니다.
 *
 * <p><strong>상태별 동작:</strong></p>
 * <ul>
 *   <li>CLOSED: primary 호출. 성공하면 실패 수 초기화, 실패하면 실패 수 증가.
 *       maxFailures에 도달하면 OPEN</li>
 *   <li>OPEN: primary를 시도하지 않고 fallback 호출. 마지막 실패 후 resetTimeout이 지나면
 *       다음 호출 전에 HALF_OPEN</li>
 *   <li>HALF_OPEN: 시험 호출 1회만 primary로. 성공하면 CLOSED, 실패하면 OPEN
 *       (다른 호출은 시험이 끝날 때까지 fallback)</li>
 * </ul>
 *
 * <p>primary가 실패한 호출은 같은 질의로 즉시 fallback을 호출하므로, fallback 자체가 실패하지 않는 한
 * 호출자는 항상 결과를 받습니다. 시간은 주입된 {@link Clock}으로 측정합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 상태 변경은 모두 인스턴스 락 안에서 일어나며,
 * 에이전트 호출은 락 밖에서 수행됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final AgentFactory factory;
    private final Clock clock;
    private final String patternId;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    private AgentHandle primary;
    private AgentHandle fallback;

    public CircuitBreaker(CircuitBreakerConfig config, AgentFactory factory) {
        this(config, factory, Clock.systemUTC());
    }

    /**
     * @param config 설정
     * @param factory 에이전트 팩토리
     * @param clock 시간 소스 (테스트에서는 수동 시계)
     */
    public CircuitBreaker(CircuitBreakerConfig config, AgentFactory factory, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.factory = factory;
        this.clock = clock;
        this.patternId = PatternIds.newId();
    }

    public String execute(String query) {
        return execute(query, ResultShape.TEXT);
    }

    /**
     * 질의 실행.
     *
     * @param query 질의
     * @param shape 결과 형태
     * @param <T> 결과 타입
     * @return primary 또는 fallback 결과
     * @throws RuntimeException fallback이 실패한 경우 그 예외
     */
    public <T> T execute(String query, ResultShape<T> shape) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }

        CircuitState admittedAs = admit();
        if (admittedAs == null) {
            log.debug("Circuit {} is {}, routing to fallback", patternId, getState());
            return fallback().invoke(shape, query);
        }

        T result;
        boolean settled = false;
        try {
            result = primary().invoke(shape, query);
            settled = true;
        } catch (RuntimeException e) {
            settled = true;
            recordFailure(admittedAs);
            log.warn("Primary agent failed in circuit {} (admitted as {}), using fallback", patternId, admittedAs, e);
            return fallback().invoke(shape, query);
        } finally {
            if (!settled) {
                abandonTrial(admittedAs);
            }
        }
        recordSuccess(admittedAs);
        return result;
    }

    /**
     * primary가 Error 등으로 결과 없이 끝난 경우 시험 호출 슬롯만 반납합니다.
     *
     * <p>상태와 실패 횟수는 바꾸지 않으므로 다음 호출이 다시 시험 호출이 됩니다.</p>
     */
    private synchronized void abandonTrial(CircuitState admittedAs) {
        if (admittedAs == CircuitState.HALF_OPEN && state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            log.warn("Circuit {} trial call ended without a result, trial slot released", patternId);
        }
    }

    /**
     * primary 호출 허용 여부 결정.
     *
     * @return primary 호출이 허용된 상태 (CLOSED 또는 HALF_OPEN), 차단이면 null
     */
    private synchronized CircuitState admit() {
        switch (state) {
            case CLOSED:
                return CircuitState.CLOSED;
            case OPEN:
                if (!resetTimeoutElapsed()) {
                    return null;
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return CircuitState.HALF_OPEN;
            case HALF_OPEN:
                if (trialInFlight) {
                    return null;
                }
                trialInFlight = true;
                return CircuitState.HALF_OPEN;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    private boolean resetTimeoutElapsed() {
        if (lastFailureTime == null) {
            return true;
        }
        Duration elapsed = Duration.between(lastFailureTime, clock.instant());
        return elapsed.compareTo(config.resetTimeout()) >= 0;
    }

    private synchronized void recordSuccess(CircuitState admittedAs) {
        if (admittedAs == CircuitState.HALF_OPEN) {
            if (state != CircuitState.HALF_OPEN) {
                // reset() 이후 도착한 시험 호출 결과
                return;
            }
            trialInFlight = false;
            failureCount = 0;
            lastFailureTime = null;
            transitionTo(CircuitState.CLOSED);
            log.info("Circuit {} closed after successful trial call", patternId);
            return;
        }
        // 이미 열린 회로는 시험 호출로만 닫힌다
        if (state == CircuitState.CLOSED) {
            failureCount = 0;
            lastFailureTime = null;
        }
    }

    private synchronized void recordFailure(CircuitState admittedAs) {
        if (admittedAs == CircuitState.HALF_OPEN) {
            if (state != CircuitState.HALF_OPEN) {
                return;
            }
            trialInFlight = false;
            failureCount++;
            lastFailureTime = clock.instant();
            transitionTo(CircuitState.OPEN);
            log.info("Circuit {} reopened after failed trial call", patternId);
            return;
        }
        if (state != CircuitState.CLOSED) {
            return;
        }
        failureCount++;
        lastFailureTime = clock.instant();
        if (failureCount >= config.maxFailures()) {
            transitionTo(CircuitState.OPEN);
            log.info("Circuit {} opened after {} consecutive failure(s)", patternId, failureCount);
        }
    }

    private void transitionTo(CircuitState next) {
        state = CircuitTransition.transition(state, next);
    }

    private synchronized AgentHandle primary() {
        if (primary == null) {
            primary = factory.spawn(config.primary(), context("primary"));
        }
        return primary;
    }

    private synchronized AgentHandle fallback() {
        if (fallback == null) {
            fallback = factory.spawn(config.fallback(), context("fallback"));
        }
        return fallback;
    }

    private SpawnContext context(String role) {
        return SpawnContext.of(PatternType.CIRCUIT_BREAKER, patternId, role)
            .with("circuit_state", state.name());
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * 마지막 primary 실패 시각 (없으면 null).
     */
    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>전이 규칙을 거치지 않습니다. 수동 복구나 테스트 목적으로 사용합니다.</p>
     */
    public synchronized void reset() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        lastFailureTime = null;
        trialInFlight = false;
        log.info("Circuit {} reset to CLOSED", patternId);
    }

    public String patternId() {
        return patternId;
    }
}
