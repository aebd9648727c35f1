package com.ryuqq.agentica.pattern.adversarial;

import com.ryuqq.agentica.core.model.AgentSpec;

/**
 * Adversarial 설정 (불변 record).
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param advocate 찬성 측 명세
 * @param adversary 반대(비판) 측 명세
 * @param judge 판정자 명세 (null이면 판정 없음)
 * @param maxRounds 토론 라운드 수 (1 이상, 기본 3)
 */
public record AdversarialConfig(
    AgentSpec advocate,
    AgentSpec adversary,
    AgentSpec judge,
    int maxRounds
) {

    public static final int DEFAULT_MAX_ROUNDS = 3;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AdversarialConfig {
        if (advocate == null) {
            throw new IllegalArgumentException("advocate cannot be null");
        }
        if (adversary == null) {
            throw new IllegalArgumentException("adversary cannot be null");
        }
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1 (current: " + maxRounds + ")");
        }
    }

    public static AdversarialConfig of(String advocatePremise, String adversaryPremise) {
        return new AdversarialConfig(AgentSpec.of(advocatePremise), AgentSpec.of(adversaryPremise), null, DEFAULT_MAX_ROUNDS);
    }

    public AdversarialConfig withJudge(AgentSpec judge) {
        return new AdversarialConfig(advocate, adversary, judge, maxRounds);
    }

    public AdversarialConfig withJudge(String judgePremise) {
        return withJudge(AgentSpec.of(judgePremise));
    }

    public AdversarialConfig withMaxRounds(int maxRounds) {
        return new AdversarialConfig(advocate, adversary, judge, maxRounds);
    }

    public boolean hasJudge() {
        return judge != null;
    }
}
