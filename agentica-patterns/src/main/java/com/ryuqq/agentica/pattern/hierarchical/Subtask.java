package com.ryuqq.agentica.pattern.hierarchical;

import java.util.Map;

/**
 * coordinator가 분해한 하위 과제.
 *
 * @param specialist 담당 specialist 이름
 * @param task 하위 과제 내용
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record Subtask(String specialist, String task) {

    public Subtask {
        if (specialist == null || specialist.isBlank()) {
            throw new IllegalArgumentException("specialist cannot be null or blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
    }

    /**
     * 분해 결과 항목 변환.
     *
     * <p>{@link Subtask} 그대로, 또는 {@code specialist}/{@code task} 키를 가진 Map을 받습니다.</p>
     *
     * @param entry 분해 결과 항목
     * @return Subtask
     * @throws IllegalArgumentException 지원하지 않는 형태이거나 필수 키가 없는 경우
     */
    public static Subtask from(Object entry) {
        if (entry instanceof Subtask subtask) {
            return subtask;
        }
        if (entry instanceof Map<?, ?> map) {
            Object specialist = map.get("specialist");
            Object task = map.get("task");
            if (specialist == null || task == null) {
                throw new IllegalArgumentException("Subtask mapping requires 'specialist' and 'task' keys (got: " + map.keySet() + ")");
            }
            return new Subtask(specialist.toString(), task.toString());
        }
        throw new IllegalArgumentException("Unsupported subtask entry: "
            + (entry == null ? "null" : entry.getClass().getName()));
    }
}
