package com.ryuqq.agentica.pattern.blackboard;

import com.ryuqq.agentica.core.model.AgentSpec;

import java.util.List;

/**
 * Blackboard 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>specialists: 선언 순서대로 실행되는 specialist (1개 이상)</li>
 *   <li>controller: 완료 여부를 판단하는 controller 명세</li>
 *   <li>maxIterations: 최대 반복 수 (기본 5)</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param specialists specialist 목록
 * @param controller controller 명세
 * @param maxIterations 최대 반복 수 (1 이상)
 */
public record BlackboardConfig(
    List<Specialist> specialists,
    AgentSpec controller,
    int maxIterations
) {

    public static final int DEFAULT_MAX_ITERATIONS = 5;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BlackboardConfig {
        if (specialists == null || specialists.isEmpty()) {
            throw new IllegalArgumentException("specialists must not be empty");
        }
        for (int i = 0; i < specialists.size(); i++) {
            if (specialists.get(i) == null) {
                throw new IllegalArgumentException("specialist cannot be null (index: " + i + ")");
            }
        }
        if (controller == null) {
            throw new IllegalArgumentException("controller cannot be null");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive (current: " + maxIterations + ")");
        }
        specialists = List.copyOf(specialists);
    }

    public static BlackboardConfig of(List<Specialist> specialists, String controllerPremise) {
        return new BlackboardConfig(specialists, AgentSpec.of(controllerPremise), DEFAULT_MAX_ITERATIONS);
    }

    public BlackboardConfig withController(AgentSpec controller) {
        return new BlackboardConfig(specialists, controller, maxIterations);
    }

    public BlackboardConfig withMaxIterations(int maxIterations) {
        return new BlackboardConfig(specialists, controller, maxIterations);
    }
}
