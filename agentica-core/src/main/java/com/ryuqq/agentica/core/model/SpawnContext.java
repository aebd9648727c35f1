package com.ryuqq.agentica.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 에이전트 생성 컨텍스트.
 *
 * <p>어떤 패턴 인스턴스가 어떤 역할로 에이전트를 생성했는지를 명시적으로 전달합니다.
 * 관측 싱크({@code AgentTracker})는 프로세스 환경변수 같은 전역 상태를 읽지 않고
 * 이 객체를 구조화된 파라미터로 받습니다.</p>
 *
 * <p><strong>속성 예시:</strong></p>
 * <ul>
 *   <li>Jury: {@code juror_index=0, total_jurors=5}</li>
 *   <li>Hierarchical: {@code hierarchy_level=1, coordinator_id=...}</li>
 *   <li>Adversarial: {@code round=2, max_rounds=3}</li>
 * </ul>
 *
 * @param patternType 패턴 종류
 * @param patternId 패턴 인스턴스(또는 실행) ID
 * @param role 에이전트 역할 (예: "juror", "coordinator")
 * @param attributes 추가 속성 (삽입 순서 유지, 불변)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record SpawnContext(
    PatternType patternType,
    String patternId,
    String role,
    Map<String, String> attributes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException patternType이 null이거나 patternId/role이 blank인 경우
     */
    public SpawnContext {
        if (patternType == null) {
            throw new IllegalArgumentException("patternType cannot be null");
        }
        if (patternId == null || patternId.isBlank()) {
            throw new IllegalArgumentException("patternId cannot be null or blank");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static SpawnContext of(PatternType patternType, String patternId, String role) {
        return new SpawnContext(patternType, patternId, role, Map.of());
    }

    /**
     * 속성 하나를 추가한 새 컨텍스트 생성.
     *
     * @param key 속성 키
     * @param value 속성 값 ({@code String.valueOf}로 변환)
     * @return 새 SpawnContext
     */
    public SpawnContext with(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("attribute key cannot be null or blank");
        }
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, String.valueOf(value));
        return new SpawnContext(patternType, patternId, role, copy);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값 또는 null
     */
    public String attribute(String key) {
        return attributes.get(key);
    }
}
