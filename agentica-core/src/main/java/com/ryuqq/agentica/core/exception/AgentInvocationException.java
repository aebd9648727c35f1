package com.ryuqq.agentica.core.exception;

/**
 * 에이전트 호출 실패.
 *
 * <p>에이전트 런타임 구현체가 호출 실패를 알리거나, 반환값이 요청한
 * {@code ResultShape}와 맞지 않을 때 발생합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class AgentInvocationException extends AgentPatternException {

    private final String agentId;

    public AgentInvocationException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public AgentInvocationException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    /**
     * 실패한 에이전트 ID 조회.
     *
     * @return 에이전트 ID (알 수 없으면 null)
     */
    public String getAgentId() {
        return agentId;
    }
}
