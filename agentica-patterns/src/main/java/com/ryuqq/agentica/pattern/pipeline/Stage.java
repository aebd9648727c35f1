package com.ryuqq.agentica.pattern.pipeline;

import com.ryuqq.agentica.core.handoff.HandoffState;

/**
 * 파이프라인 단계.
 *
 * <p>상태를 받아 (변경했거나 새로 만든) 상태를 반환합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Stage {

    /**
     * 단계 실행.
     *
     * @param state 이전 단계의 상태
     * @return 다음 단계로 넘길 상태 (null 불가)
     */
    HandoffState apply(HandoffState state);

    /**
     * 파이프라인 안에서 단계 실행.
     *
     * <p>기본 구현은 위치 정보를 무시하고 {@link #apply(HandoffState)}를 호출합니다.</p>
     *
     * @param state 이전 단계의 상태
     * @param context 파이프라인 ID와 단계 위치
     * @return 다음 단계로 넘길 상태 (null 불가)
     */
    default HandoffState apply(HandoffState state, StageContext context) {
        return apply(state);
    }
}
