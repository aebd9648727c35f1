package com.ryuqq.agentica.core.consensus;

import com.ryuqq.agentica.core.exception.AgentPatternException;

/**
 * 합의 규칙 미충족.
 *
 * <p>UNANIMOUS 모드에서 키가 둘 이상이거나, THRESHOLD 모드에서 선두 비율이 임계값 미만일 때 발생합니다.
 * 호출자는 MAJORITY로 재결정하거나 상위로 에스컬레이션하여 복구할 수 있습니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class ConsensusNotReachedException extends AgentPatternException {

    private final ConsensusMode mode;
    private final transient VoteTally tally;
    private final Double threshold;

    public ConsensusNotReachedException(ConsensusMode mode, VoteTally tally, Double threshold) {
        super(buildMessage(mode, tally, threshold));
        this.mode = mode;
        this.tally = tally;
        this.threshold = threshold;
    }

    public ConsensusMode getMode() {
        return mode;
    }

    /**
     * 실패 시점의 집계.
     *
     * @return 키별 가중치와 전체 가중치
     */
    public VoteTally getTally() {
        return tally;
    }

    /**
     * THRESHOLD 모드의 임계값.
     *
     * @return 임계값 (다른 모드면 null)
     */
    public Double getThreshold() {
        return threshold;
    }

    public double getWinningShare() {
        return tally.leaderShare();
    }

    private static String buildMessage(ConsensusMode mode, VoteTally tally, Double threshold) {
        if (mode == ConsensusMode.THRESHOLD) {
            return String.format("Consensus not reached: leading share %.4f below threshold %.4f (tally: %s)",
                tally.leaderShare(), threshold, tally.weightsByKey());
        }
        return String.format("Consensus not reached in %s mode: %d distinct votes (tally: %s)",
            mode, tally.distinctKeys(), tally.weightsByKey());
    }
}
