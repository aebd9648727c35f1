package com.ryuqq.agentica.pattern.blackboard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 블랙보드 공유 상태.
 *
 * <p>키/값 저장소와 모든 쓰기의 이력을 함께 보관합니다.
 * 한 반복 안에서 specialist가 순차 실행되므로 동기화하지 않습니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class BlackboardState {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<BlackboardChange> history = new ArrayList<>();

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * 값 기록.
     *
     * @param key 키 (blank 불가)
     * @param value 값
     * @param writer 기록 주체
     */
    public void set(String key, Object value, String writer) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        values.put(key, value);
        history.add(new BlackboardChange(key, value, writer));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * 현재 값 스냅샷 (삽입 순서 유지).
     */
    public Map<String, Object> toMap() {
        return new LinkedHashMap<>(values);
    }

    /**
     * 쓰기 이력 (시간 순서).
     */
    public List<BlackboardChange> history() {
        return List.copyOf(history);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
