package com.ryuqq.agentica.core.exception;

import java.util.List;

/**
 * 라우팅 대상 없음.
 *
 * <p>ChainOfResponsibility에서 어떤 핸들러도 쿼리를 처리하지 못하거나,
 * Hierarchical 분해 결과가 선언되지 않은 전문가를 참조할 때 발생합니다.
 * 항상 호출자/설정 버그이므로 재시도 대상이 아닙니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class UnknownRouteException extends AgentPatternException {

    private final String route;
    private final List<String> knownRoutes;

    public UnknownRouteException(String message, String route, List<String> knownRoutes) {
        super(message);
        this.route = route;
        this.knownRoutes = knownRoutes == null ? List.of() : List.copyOf(knownRoutes);
    }

    /**
     * 매칭에 실패한 라우트 (전문가 이름 또는 쿼리).
     *
     * @return 라우트
     */
    public String getRoute() {
        return route;
    }

    /**
     * 설정된 라우트 목록.
     *
     * @return 불변 리스트
     */
    public List<String> getKnownRoutes() {
        return knownRoutes;
    }
}
