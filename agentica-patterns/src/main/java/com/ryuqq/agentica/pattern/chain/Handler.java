package com.ryuqq.agentica.pattern.chain;

import com.ryuqq.agentica.core.model.AgentSpec;

import java.util.function.Predicate;

/**
 * 체인 핸들러 선언.
 *
 * <p>priority가 작을수록 먼저 검사합니다. 같은 priority는 선언 순서를 유지합니다.</p>
 *
 * @param spec 에이전트 명세
 * @param canHandle 처리 가능 여부 판단 함수
 * @param priority 우선순위 (작을수록 먼저)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record Handler(
    AgentSpec spec,
    Predicate<String> canHandle,
    int priority
) {

    public Handler {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (canHandle == null) {
            throw new IllegalArgumentException("canHandle cannot be null");
        }
    }

    public static Handler of(String premise, Predicate<String> canHandle) {
        return new Handler(AgentSpec.of(premise), canHandle, 0);
    }

    public static Handler of(String premise, Predicate<String> canHandle, int priority) {
        return new Handler(AgentSpec.of(premise), canHandle, priority);
    }

    /**
     * 모든 질의를 처리하는 마지막 핸들러.
     *
     * @param premise premise
     * @return priority {@link Integer#MAX_VALUE}의 catch-all 핸들러
     */
    public static Handler catchAll(String premise) {
        return new Handler(AgentSpec.of(premise), query -> true, Integer.MAX_VALUE);
    }

    public boolean canHandle(String query) {
        return canHandle.test(query);
    }
}
