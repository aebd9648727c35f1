package com.ryuqq.agentica.pattern.chain;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.exception.UnknownRouteException;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * ChainOfResponsibility 패턴: priority 순으로 핸들러를 검사해 처음 일치하는 핸들러의 에이전트만 호출합니다.
 *
 * <p>일치하는 핸들러가 없으면 {@link UnknownRouteException}을 던집니다.
 * 항상 처리하는 {@link Handler#catchAll(String)}을 마지막에 두는 것을 권장합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
 *     Handler.of("You fix SQL.", q -> q.contains("SQL"), 1),
 *     Handler.catchAll("You answer general questions.")), factory);
 * String answer = chain.process("Why is this SQL slow?");
 * }</pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class ChainOfResponsibility {

    private static final Logger log = LoggerFactory.getLogger(ChainOfResponsibility.class);

    private final List<Handler> handlers;
    private final AgentFactory factory;
    private final String patternId;

    /**
     * @param handlers 핸들러 목록 (1개 이상, priority 오름차순으로 안정 정렬됨)
     * @param factory 에이전트 팩토리
     */
    public ChainOfResponsibility(List<Handler> handlers, AgentFactory factory) {
        if (handlers == null || handlers.isEmpty()) {
            throw new IllegalArgumentException("handlers must not be empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        List<Handler> sorted = new ArrayList<>(handlers.size());
        for (int i = 0; i < handlers.size(); i++) {
            if (handlers.get(i) == null) {
                throw new IllegalArgumentException("handler cannot be null (index: " + i + ")");
            }
            sorted.add(handlers.get(i));
        }
        sorted.sort(Comparator.comparingInt(Handler::priority));
        this.handlers = List.copyOf(sorted);
        this.factory = factory;
        this.patternId = PatternIds.newId();
    }

    /**
     * 질의를 처리할 핸들러 조회 (에이전트를 생성하지 않음).
     *
     * @param query 질의
     * @return 처음 일치하는 핸들러
     */
    public Optional<Handler> route(String query) {
        for (Handler handler : handlers) {
            if (handler.canHandle(query)) {
                return Optional.of(handler);
            }
        }
        return Optional.empty();
    }

    public String process(String query) {
        return process(query, ResultShape.TEXT);
    }

    /**
     * 질의 처리.
     *
     * @param query 질의
     * @param shape 결과 형태
     * @param <T> 결과 타입
     * @return 일치한 핸들러 에이전트의 결과
     * @throws UnknownRouteException 일치하는 핸들러가 없는 경우
     */
    public <T> T process(String query, ResultShape<T> shape) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }

        Handler handler = route(query).orElseThrow(() -> new UnknownRouteException(
            "No handler could process the query: " + query, query, premises()));

        SpawnContext context = SpawnContext.of(PatternType.CHAIN_OF_RESPONSIBILITY, patternId, "handler")
            .with("handler_priority", handler.priority())
            .with("chain_length", handlers.size());
        AgentHandle agent = factory.spawn(handler.spec(), context);
        log.debug("Chain {} dispatching to handler with priority {}", patternId, handler.priority());
        return agent.invoke(shape, query);
    }

    private List<String> premises() {
        List<String> premises = new ArrayList<>(handlers.size());
        for (Handler handler : handlers) {
            premises.add(handler.spec().premise());
        }
        return premises;
    }

    /**
     * priority 순으로 정렬된 핸들러.
     */
    public List<Handler> handlers() {
        return handlers;
    }

    public String patternId() {
        return patternId;
    }
}
