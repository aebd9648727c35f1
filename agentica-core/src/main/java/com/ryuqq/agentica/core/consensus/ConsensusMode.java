package com.ryuqq.agentica.core.consensus;

/**
 * 합의 규칙.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public enum ConsensusMode {

    /**
     * 가중 득표가 가장 높은 키가 승리 (동률이면 먼저 등장한 키).
     */
    MAJORITY,

    /**
     * 모든 키가 같을 때만 승리.
     */
    UNANIMOUS,

    /**
     * 선두 키의 가중 득표 비율이 임계값 이상일 때만 승리.
     */
    THRESHOLD
}
