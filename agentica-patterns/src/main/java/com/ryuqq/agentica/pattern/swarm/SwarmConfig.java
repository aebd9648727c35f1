package com.ryuqq.agentica.pattern.swarm;

import com.ryuqq.agentica.core.aggregate.AggregateMode;
import com.ryuqq.agentica.core.aggregate.Aggregator;
import com.ryuqq.agentica.core.model.ResultShape;

import java.util.List;
import java.util.Set;

/**
 * Swarm 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>perspectives: 관점별 premise (1개 이상, 관점마다 에이전트 1개)</li>
 *   <li>aggregateMode: 결과 집계 방식 (기본 MERGE)</li>
 *   <li>separator: CONCAT 구분자 (기본 " ")</li>
 *   <li>failFast: 첫 실패 시 전체 취소 여부 (기본 false, 실패한 관점은 제외)</li>
 *   <li>model, tools: 모든 관점 에이전트에 공통 적용</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param perspectives 관점별 premise
 * @param aggregateMode 집계 방식
 * @param separator CONCAT 구분자
 * @param failFast fail-fast 여부
 * @param model 모델 식별자 (null 허용)
 * @param tools 도구 집합 (null이면 빈 집합)
 */
public record SwarmConfig(
    List<String> perspectives,
    AggregateMode aggregateMode,
    String separator,
    boolean failFast,
    String model,
    Set<String> tools
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SwarmConfig {
        if (perspectives == null || perspectives.isEmpty()) {
            throw new IllegalArgumentException("perspectives must not be empty");
        }
        for (int i = 0; i < perspectives.size(); i++) {
            String perspective = perspectives.get(i);
            if (perspective == null || perspective.isBlank()) {
                throw new IllegalArgumentException("perspective cannot be null or blank (index: " + i + ")");
            }
        }
        if (aggregateMode == null) {
            throw new IllegalArgumentException("aggregateMode cannot be null");
        }
        if (separator == null) {
            throw new IllegalArgumentException("separator cannot be null");
        }
        perspectives = List.copyOf(perspectives);
        tools = tools == null ? Set.of() : Set.copyOf(tools);
    }

    /**
     * 기본값으로 설정 생성 (MERGE, " ", partial, 모델/도구 없음).
     */
    public static SwarmConfig of(List<String> perspectives) {
        return new SwarmConfig(perspectives, AggregateMode.MERGE, Aggregator.DEFAULT_SEPARATOR, false, null, Set.of());
    }

    public SwarmConfig withAggregateMode(AggregateMode aggregateMode) {
        return new SwarmConfig(perspectives, aggregateMode, separator, failFast, model, tools);
    }

    public SwarmConfig withSeparator(String separator) {
        return new SwarmConfig(perspectives, aggregateMode, separator, failFast, model, tools);
    }

    public SwarmConfig withFailFast(boolean failFast) {
        return new SwarmConfig(perspectives, aggregateMode, separator, failFast, model, tools);
    }

    public SwarmConfig withModel(String model) {
        return new SwarmConfig(perspectives, aggregateMode, separator, failFast, model, tools);
    }

    public SwarmConfig withTools(Set<String> tools) {
        return new SwarmConfig(perspectives, aggregateMode, separator, failFast, model, tools);
    }

    /**
     * 집계 방식에 따른 기본 결과 형태.
     *
     * @return CONCAT이면 TEXT, 그 외에는 MAPPING
     */
    public ResultShape<?> defaultShape() {
        return aggregateMode == AggregateMode.CONCAT ? ResultShape.TEXT : ResultShape.MAPPING;
    }

    Aggregator aggregator() {
        return new Aggregator(aggregateMode, separator, false);
    }
}
