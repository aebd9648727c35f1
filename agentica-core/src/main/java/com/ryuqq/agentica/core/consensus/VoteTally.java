package com.ryuqq.agentica.core.consensus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 가중 득표 집계 결과.
 *
 * <p>키는 처음 등장한 순서대로 유지됩니다. 선두 키 계산 시 동률이면
 * 처음 등장한 인덱스가 더 작은 키가 선택됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class VoteTally {

    /**
     * 키 하나의 집계.
     *
     * @param key 비교 키
     * @param weight 누적 가중치
     * @param firstIndex 이 키가 처음 등장한 투표 인덱스
     */
    public record Entry(Object key, double weight, int firstIndex) {
    }

    private final List<Entry> entries;
    private final double totalWeight;

    VoteTally(List<Entry> entries, double totalWeight) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.totalWeight = totalWeight;
    }

    /**
     * 키별 집계 (처음 등장 순서).
     *
     * @return 불변 리스트
     */
    public List<Entry> entries() {
        return entries;
    }

    public double totalWeight() {
        return totalWeight;
    }

    public int distinctKeys() {
        return entries.size();
    }

    /**
     * 선두 키.
     *
     * @return 가장 높은 가중치의 엔트리 (동률이면 firstIndex가 작은 것)
     */
    public Entry leader() {
        Entry best = entries.get(0);
        for (Entry entry : entries) {
            if (entry.weight() > best.weight()) {
                best = entry;
            }
        }
        return best;
    }

    /**
     * 선두 키의 가중치 비율.
     *
     * @return leader 가중치 / 전체 가중치, 전체가 0이면 0.0
     */
    public double leaderShare() {
        return totalWeight == 0.0 ? 0.0 : leader().weight() / totalWeight;
    }

    /**
     * 키 → 누적 가중치.
     *
     * @return 삽입 순서를 유지하는 불변 맵
     */
    public Map<Object, Double> weightsByKey() {
        Map<Object, Double> result = new LinkedHashMap<>();
        for (Entry entry : entries) {
            result.put(entry.key(), entry.weight());
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "VoteTally{" + weightsByKey() + ", total=" + totalWeight + '}';
    }
}
