package com.ryuqq.agentica.pattern.blackboard;

import com.ryuqq.agentica.core.model.AgentSpec;

import java.util.List;

/**
 * 블랙보드 specialist 선언.
 *
 * @param spec 에이전트 명세
 * @param writesTo 이 specialist가 쓰는 키 (없으면 빈 리스트, 이 경우 읽기 전용으로 프롬프트만 받고 상태에 쓰지 않음)
 * @param readsFrom 프롬프트에 포함할 키 (없으면 빈 리스트)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record Specialist(
    AgentSpec spec,
    List<String> writesTo,
    List<String> readsFrom
) {

    public Specialist {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (writesTo == null) {
            writesTo = List.of();
        } else {
            requireKeys(writesTo, "writesTo");
            writesTo = List.copyOf(writesTo);
        }
        if (readsFrom == null) {
            readsFrom = List.of();
        } else {
            requireKeys(readsFrom, "readsFrom");
            readsFrom = List.copyOf(readsFrom);
        }
    }

    public static Specialist of(String premise, List<String> writesTo, List<String> readsFrom) {
        return new Specialist(AgentSpec.of(premise), writesTo, readsFrom);
    }

    private static void requireKeys(List<String> keys, String field) {
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i) == null || keys.get(i).isBlank()) {
                throw new IllegalArgumentException(field + " key cannot be null or blank (index: " + i + ")");
            }
        }
    }
}
