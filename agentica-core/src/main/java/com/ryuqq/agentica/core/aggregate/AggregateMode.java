package com.ryuqq.agentica.core.aggregate;

/**
 * 집계 방식.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public enum AggregateMode {

    /**
     * 매핑은 얕은 병합(뒤가 우선), 리스트는 이어붙이기.
     */
    MERGE,

    /**
     * 문자열로 변환 후 구분자로 연결.
     */
    CONCAT,

    /**
     * {@code score}가 가장 높은 매핑 선택.
     */
    BEST
}
