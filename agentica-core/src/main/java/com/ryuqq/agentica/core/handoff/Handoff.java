package com.ryuqq.agentica.core.handoff;

/**
 * 에이전트 간 인계 기록 한 건.
 *
 * @param from 인계한 에이전트(역할) 이름
 * @param to 인계받은 에이전트(역할) 이름
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record Handoff(String from, String to) {

    public Handoff {
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from cannot be null or blank");
        }
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("to cannot be null or blank");
        }
    }
}
