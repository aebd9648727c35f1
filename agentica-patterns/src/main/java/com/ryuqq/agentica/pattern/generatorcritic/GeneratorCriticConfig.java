package com.ryuqq.agentica.pattern.generatorcritic;

import com.ryuqq.agentica.core.handoff.HandoffState;
import com.ryuqq.agentica.core.model.AgentSpec;

import java.util.function.Predicate;

/**
 * GeneratorCritic 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>generator, critic: 각 역할의 에이전트 명세</li>
 *   <li>maxRounds: 최대 반복 수 (기본 3, 양수)</li>
 *   <li>approval: 승인 판단 함수 (기본: nextInstruction에 "APPROVED" 포함)</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param generator generator 명세
 * @param critic critic 명세
 * @param maxRounds 최대 반복 수
 * @param approval 승인 판단 함수
 */
public record GeneratorCriticConfig(
    AgentSpec generator,
    AgentSpec critic,
    int maxRounds,
    Predicate<HandoffState> approval
) {

    public static final String APPROVAL_SENTINEL = "APPROVED";
    public static final int DEFAULT_MAX_ROUNDS = 3;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GeneratorCriticConfig {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (critic == null) {
            throw new IllegalArgumentException("critic cannot be null");
        }
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive (current: " + maxRounds + ")");
        }
        if (approval == null) {
            approval = GeneratorCriticConfig::containsSentinel;
        }
    }

    public static GeneratorCriticConfig of(String generatorPremise, String criticPremise) {
        return new GeneratorCriticConfig(AgentSpec.of(generatorPremise), AgentSpec.of(criticPremise),
            DEFAULT_MAX_ROUNDS, null);
    }

    public GeneratorCriticConfig withMaxRounds(int maxRounds) {
        return new GeneratorCriticConfig(generator, critic, maxRounds, approval);
    }

    public GeneratorCriticConfig withApproval(Predicate<HandoffState> approval) {
        return new GeneratorCriticConfig(generator, critic, maxRounds, approval);
    }

    public GeneratorCriticConfig withGenerator(AgentSpec generator) {
        return new GeneratorCriticConfig(generator, critic, maxRounds, approval);
    }

    public GeneratorCriticConfig withCritic(AgentSpec critic) {
        return new GeneratorCriticConfig(generator, critic, maxRounds, approval);
    }

    private static boolean containsSentinel(HandoffState state) {
        String instruction = state.getNextInstruction();
        return instruction != null && instruction.contains(APPROVAL_SENTINEL);
    }
}
