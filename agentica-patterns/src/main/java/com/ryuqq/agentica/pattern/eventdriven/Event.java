package com.ryuqq.agentica.pattern.eventdriven;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 발행 이벤트.
 *
 * @param type 이벤트 타입 (blank 불가)
 * @param payload 내용 (null이면 빈 Map)
 * @param timestamp 발생 시각 (null이면 현재 시각)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record Event(
    String type,
    Map<String, Object> payload,
    Instant timestamp
) {

    public Event {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static Event of(String type, Map<String, Object> payload) {
        return new Event(type, payload, null);
    }
}
