package com.ryuqq.agentica.pattern.hierarchical;

import com.ryuqq.agentica.core.aggregate.Aggregator;
import com.ryuqq.agentica.core.model.AgentSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hierarchical 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>coordinator: 분해와 종합을 맡는 coordinator 명세</li>
 *   <li>specialists: 이름 → 명세 (선언 순서 유지, 1개 이상)</li>
 *   <li>aggregator: specialist 결과 집계기 (기본 CONCAT, 구분자 "\n\n")</li>
 *   <li>failFast: specialist 하나라도 실패하면 전체 실패 (기본 false)</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param coordinator coordinator 명세
 * @param specialists specialist 이름별 명세
 * @param aggregator 결과 집계기
 * @param failFast fail-fast 여부
 */
public record HierarchicalConfig(
    AgentSpec coordinator,
    Map<String, AgentSpec> specialists,
    Aggregator aggregator,
    boolean failFast
) {

    public static final String DEFAULT_SEPARATOR = "\n\n";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HierarchicalConfig {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (specialists == null || specialists.isEmpty()) {
            throw new IllegalArgumentException("specialists must not be empty");
        }
        for (Map.Entry<String, AgentSpec> entry : specialists.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("specialist name cannot be null or blank");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("specialist spec cannot be null (name: " + entry.getKey() + ")");
            }
        }
        if (aggregator == null) {
            throw new IllegalArgumentException("aggregator cannot be null");
        }
        specialists = Collections.unmodifiableMap(new LinkedHashMap<>(specialists));
    }

    /**
     * premise만으로 설정 생성.
     *
     * @param coordinatorPremise coordinator premise
     * @param specialistPremises specialist 이름 → premise (순서 유지를 위해 LinkedHashMap 권장)
     * @return 기본 설정 (CONCAT "\n\n", partial)
     */
    public static HierarchicalConfig of(String coordinatorPremise, Map<String, String> specialistPremises) {
        if (specialistPremises == null) {
            throw new IllegalArgumentException("specialistPremises cannot be null");
        }
        Map<String, AgentSpec> specs = new LinkedHashMap<>();
        specialistPremises.forEach((name, premise) -> specs.put(name, AgentSpec.of(premise)));
        return new HierarchicalConfig(AgentSpec.of(coordinatorPremise), specs, Aggregator.concat(DEFAULT_SEPARATOR), false);
    }

    public HierarchicalConfig withCoordinator(AgentSpec coordinator) {
        return new HierarchicalConfig(coordinator, specialists, aggregator, failFast);
    }

    public HierarchicalConfig withAggregator(Aggregator aggregator) {
        return new HierarchicalConfig(coordinator, specialists, aggregator, failFast);
    }

    public HierarchicalConfig withFailFast(boolean failFast) {
        return new HierarchicalConfig(coordinator, specialists, aggregator, failFast);
    }
}
