package com.ryuqq.agentica.pattern.eventdriven;

import com.ryuqq.agentica.core.model.AgentSpec;

import java.util.Arrays;
import java.util.List;

/**
 * 이벤트 구독자 선언.
 *
 * @param spec 에이전트 명세
 * @param eventTypes 처리할 이벤트 타입 ({@value #WILDCARD}는 모든 타입)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record Subscriber(AgentSpec spec, List<String> eventTypes) {

    public static final String WILDCARD = "*";

    public Subscriber {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("eventTypes must not be empty");
        }
        for (int i = 0; i < eventTypes.size(); i++) {
            if (eventTypes.get(i) == null || eventTypes.get(i).isBlank()) {
                throw new IllegalArgumentException("event type cannot be null or blank (index: " + i + ")");
            }
        }
        eventTypes = List.copyOf(eventTypes);
    }

    public static Subscriber of(String premise, String... eventTypes) {
        return new Subscriber(AgentSpec.of(premise), eventTypes == null ? null : Arrays.asList(eventTypes));
    }

    /**
     * 이벤트 타입 일치 여부.
     *
     * @param type 이벤트 타입
     * @return 선언된 타입에 포함되거나 와일드카드를 구독하면 true
     */
    public boolean matches(String type) {
        return eventTypes.contains(WILDCARD) || (type != null && eventTypes.contains(type));
    }
}
