package com.ryuqq.agentica.core.exception;

/**
 * Agentica 런타임 예외의 최상위 타입.
 *
 * <p>패턴 실행 중 발생하는 모든 비검사 예외는 이 타입을 상속합니다.
 * 생성 시점의 설정 오류는 이 계층이 아니라 {@link IllegalArgumentException}으로 즉시 실패합니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link AgentInvocationException}: 개별 에이전트 호출 실패</li>
 *   <li>{@link UnknownRouteException}: 처리할 핸들러/전문가를 찾지 못함</li>
 *   <li>{@link InsufficientParticipantsException}: 성공한 참여자 수가 정족수 미달</li>
 *   <li>{@code ConsensusNotReachedException}: 합의 규칙 미충족</li>
 *   <li>{@code AggregationException}: 집계 입력 형태 불일치</li>
 *   <li>{@code TaskGroupException}: fail-fast 모드의 묶음 실패</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class AgentPatternException extends RuntimeException {

    public AgentPatternException(String message) {
        super(message);
    }

    public AgentPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
