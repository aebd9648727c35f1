package com.ryuqq.agentica.testkit;

import com.ryuqq.agentica.core.model.ResultShape;

import java.util.Map;

/**
 * 기록된 에이전트 호출 한 건.
 *
 * @param agentId 호출된 핸들 ID
 * @param premise 핸들의 premise
 * @param shape 요청된 결과 형태
 * @param prompt 프롬프트
 * @param arguments 구조화된 인자 (없으면 빈 맵)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record AgentCall(
    String agentId,
    String premise,
    ResultShape<?> shape,
    String prompt,
    Map<String, Object> arguments
) {

    public AgentCall {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    /**
     * 인자 조회.
     *
     * @param name 인자 이름
     * @return 인자 값 또는 null
     */
    public Object argument(String name) {
        return arguments.get(name);
    }
}
