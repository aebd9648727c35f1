package com.ryuqq.agentica.core.consensus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 가중 합의 결정기.
 *
 * <p>참여자별 투표 리스트에서 하나의 승자를 결정합니다. 반환값은 비교 키가 아니라
 * 원래 투표 객체이므로 구조화된 페이로드가 투표 후에도 유지됩니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>MAJORITY: 가중 득표 최대 키, 동률이면 먼저 등장한 키. 투표가 1개 이상이면 항상 승자가 있음</li>
 *   <li>UNANIMOUS: 서로 다른 키가 정확히 1개일 때만 승리</li>
 *   <li>THRESHOLD: 선두 가중 비율이 임계값 이상(경계 포함)일 때만 승리</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Consensus consensus = Consensus.threshold(0.66);
 * Boolean verdict = consensus.decide(List.of(true, true, false));
 *
 * // 구조화된 투표는 key 함수로 비교
 * Review winner = Consensus.majority().decide(reviews, null, Review::verdict);
 * </pre>
 *
 * <p>상태가 없으므로 스레드 안전합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Consensus {

    private final ConsensusMode mode;
    private final Double threshold;

    /**
     * @param mode 합의 규칙
     * @param threshold THRESHOLD 모드의 임계값 [0, 1] (다른 모드에서는 무시)
     * @throws IllegalArgumentException mode가 null이거나, THRESHOLD 모드에서 임계값이 없거나 범위를 벗어난 경우
     */
    public Consensus(ConsensusMode mode, Double threshold) {
        validate(mode, threshold);
        this.mode = mode;
        this.threshold = mode == ConsensusMode.THRESHOLD ? threshold : null;
    }

    /**
     * 합의 규칙 검증.
     *
     * <p>Consensus를 만들지 않고 같은 규칙으로 설정값만 검사할 때 사용합니다.</p>
     *
     * @param mode 합의 규칙
     * @param threshold THRESHOLD 모드의 임계값
     * @throws IllegalArgumentException mode가 null이거나, THRESHOLD 모드에서 임계값이 없거나 범위를 벗어난 경우
     */
    public static void validate(ConsensusMode mode, Double threshold) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (mode == ConsensusMode.THRESHOLD) {
            if (threshold == null) {
                throw new IllegalArgumentException("threshold is required for THRESHOLD mode");
            }
            if (threshold.isNaN() || threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be between 0 and 1 (current: " + threshold + ")");
            }
        }
    }

    public static Consensus majority() {
        return new Consensus(ConsensusMode.MAJORITY, null);
    }

    public static Consensus unanimous() {
        return new Consensus(ConsensusMode.UNANIMOUS, null);
    }

    public static Consensus threshold(double threshold) {
        return new Consensus(ConsensusMode.THRESHOLD, threshold);
    }

    public ConsensusMode mode() {
        return mode;
    }

    public Double threshold() {
        return threshold;
    }

    /**
     * 가중치 없이 결정 (모든 가중치 1.0).
     *
     * @param votes 투표 리스트 (비어 있으면 안 됨)
     * @param <V> 투표 타입
     * @return 승리한 원래 투표
     * @throws ConsensusNotReachedException 규칙을 충족하지 못한 경우
     */
    public <V> V decide(List<V> votes) {
        return decide(votes, null, null);
    }

    public <V> V decide(List<V> votes, List<Double> weights) {
        return decide(votes, weights, null);
    }

    /**
     * 결정.
     *
     * @param votes 투표 리스트 (비어 있으면 안 됨)
     * @param weights 투표별 가중치 (null이면 모두 1.0, 길이는 votes와 같아야 함)
     * @param key 비교 키 추출 함수 (null이면 투표 자체를 키로 사용)
     * @param <V> 투표 타입
     * @return 승리한 원래 투표
     * @throws IllegalArgumentException votes가 비었거나 weights가 잘못된 경우
     * @throws ConsensusNotReachedException 규칙을 충족하지 못한 경우
     */
    public <V> V decide(List<V> votes, List<Double> weights, Function<? super V, ?> key) {
        VoteTally tally = tally(votes, weights, key);

        switch (mode) {
            case UNANIMOUS:
                if (tally.distinctKeys() != 1) {
                    throw new ConsensusNotReachedException(mode, tally, null);
                }
                break;
            case THRESHOLD:
                if (tally.leaderShare() < threshold) {
                    throw new ConsensusNotReachedException(mode, tally, threshold);
                }
                break;
            default:
                break;
        }
        return votes.get(tally.leader().firstIndex());
    }

    /**
     * 가중 득표 집계.
     *
     * <p>결정 규칙과 무관하게 진단용으로 사용할 수 있습니다.</p>
     *
     * @param votes 투표 리스트
     * @param weights 가중치 (null 허용)
     * @param key 키 추출 함수 (null 허용)
     * @param <V> 투표 타입
     * @return 집계 결과
     */
    public <V> VoteTally tally(List<V> votes, List<Double> weights, Function<? super V, ?> key) {
        validate(votes, weights);

        Map<Object, Integer> positions = new HashMap<>();
        List<Object> keys = new ArrayList<>();
        List<Double> sums = new ArrayList<>();
        List<Integer> firstIndexes = new ArrayList<>();
        double total = 0.0;

        for (int i = 0; i < votes.size(); i++) {
            V vote = votes.get(i);
            Object k = key != null ? key.apply(vote) : vote;
            double w = weights != null ? weights.get(i) : 1.0;
            total += w;

            Integer position = positions.get(k);
            if (position == null) {
                positions.put(k, keys.size());
                keys.add(k);
                sums.add(w);
                firstIndexes.add(i);
            } else {
                sums.set(position, sums.get(position) + w);
            }
        }

        List<VoteTally.Entry> entries = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            entries.add(new VoteTally.Entry(keys.get(i), sums.get(i), firstIndexes.get(i)));
        }
        return new VoteTally(entries, total);
    }

    private static void validate(List<?> votes, List<Double> weights) {
        if (votes == null || votes.isEmpty()) {
            throw new IllegalArgumentException("votes cannot be null or empty");
        }
        if (weights == null) {
            return;
        }
        if (weights.size() != votes.size()) {
            throw new IllegalArgumentException(
                "weights length must match votes (votes: " + votes.size() + ", weights: " + weights.size() + ")");
        }
        for (int i = 0; i < weights.size(); i++) {
            Double weight = weights.get(i);
            if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0.0) {
                throw new IllegalArgumentException(
                    "weight must be a finite non-negative number (index: " + i + ", current: " + weight + ")");
            }
        }
    }

    @Override
    public String toString() {
        return mode == ConsensusMode.THRESHOLD
            ? "Consensus{" + mode + ", threshold=" + threshold + '}'
            : "Consensus{" + mode + '}';
    }
}
