package com.ryuqq.agentica.core.model;

import java.util.Set;

/**
 * 에이전트 생성 명세.
 *
 * <p>하나의 에이전트 핸들은 하나의 역할 설명(premise), 선택적 모델 식별자,
 * 선택적 도구 집합에 바인딩됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * AgentSpec spec = AgentSpec.of("You are a security expert.")
 *     .withModel("sonnet")
 *     .withTools(Set.of("grep", "read_file"));
 * </pre>
 *
 * @param premise 역할 설명 (필수, blank 불가)
 * @param model 모델 식별자 (null이면 런타임 기본값)
 * @param tools 사용 가능한 도구 이름 집합 (null이면 빈 집합)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record AgentSpec(
    String premise,
    String model,
    Set<String> tools
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException premise가 null이거나 blank인 경우
     */
    public AgentSpec {
        if (premise == null || premise.isBlank()) {
            throw new IllegalArgumentException("premise cannot be null or blank");
        }
        tools = tools == null ? Set.of() : Set.copyOf(tools);
    }

    /**
     * premise만으로 명세 생성.
     *
     * @param premise 역할 설명
     * @return AgentSpec (model=null, tools=빈 집합)
     */
    public static AgentSpec of(String premise) {
        return new AgentSpec(premise, null, Set.of());
    }

    public AgentSpec withModel(String model) {
        return new AgentSpec(premise, model, tools);
    }

    public AgentSpec withTools(Set<String> tools) {
        return new AgentSpec(premise, model, tools);
    }

    /**
     * 모델이 명시되었는지 확인.
     *
     * @return model이 null이 아니고 blank가 아니면 true
     */
    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
