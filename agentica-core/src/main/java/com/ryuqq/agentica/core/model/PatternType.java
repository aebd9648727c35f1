package com.ryuqq.agentica.core.model;

/**
 * 협업 패턴 종류.
 *
 * <p>관측 싱크가 에이전트 생성을 패턴별로 분류할 때 사용하는 식별자입니다.
 * {@link #value()}는 외부 저장소/로그에 기록되는 안정적인 문자열입니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public enum PatternType {

    SWARM("swarm"),
    MAP_REDUCE("map_reduce"),
    HIERARCHICAL("hierarchical"),
    JURY("jury"),
    PIPELINE("pipeline"),
    CIRCUIT_BREAKER("circuit_breaker"),
    BLACKBOARD("blackboard"),
    CHAIN_OF_RESPONSIBILITY("chain_of_responsibility"),
    ADVERSARIAL("adversarial"),
    GENERATOR_CRITIC("generator_critic"),
    EVENT_DRIVEN("event_driven");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    /**
     * 패턴 이름 조회.
     *
     * @return snake_case 패턴 이름 (예: "map_reduce")
     */
    public String value() {
        return value;
    }
}
