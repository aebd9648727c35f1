package com.ryuqq.agentica.pattern.mapreduce;

import com.ryuqq.agentica.core.model.AgentSpec;

/**
 * MapReduce 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mapper: 모든 mapper가 공유하는 명세</li>
 *   <li>reducer: reducer 명세</li>
 *   <li>numMappers: mapper 슬롯 수 (기본 3, 1 이상)</li>
 *   <li>failFast: mapper 하나라도 실패하면 전체 실패 (기본 true)</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param mapper mapper 명세
 * @param reducer reducer 명세
 * @param numMappers mapper 슬롯 수
 * @param failFast fail-fast 여부
 */
public record MapReduceConfig(
    AgentSpec mapper,
    AgentSpec reducer,
    int numMappers,
    boolean failFast
) {

    public static final int DEFAULT_NUM_MAPPERS = 3;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MapReduceConfig {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (reducer == null) {
            throw new IllegalArgumentException("reducer cannot be null");
        }
        if (numMappers < 1) {
            throw new IllegalArgumentException("numMappers must be at least 1 (current: " + numMappers + ")");
        }
    }

    /**
     * premise만으로 설정 생성 (numMappers=3, failFast=true).
     */
    public static MapReduceConfig of(String mapperPremise, String reducerPremise) {
        return new MapReduceConfig(AgentSpec.of(mapperPremise), AgentSpec.of(reducerPremise), DEFAULT_NUM_MAPPERS, true);
    }

    public MapReduceConfig withMapper(AgentSpec mapper) {
        return new MapReduceConfig(mapper, reducer, numMappers, failFast);
    }

    public MapReduceConfig withReducer(AgentSpec reducer) {
        return new MapReduceConfig(mapper, reducer, numMappers, failFast);
    }

    public MapReduceConfig withNumMappers(int numMappers) {
        return new MapReduceConfig(mapper, reducer, numMappers, failFast);
    }

    public MapReduceConfig withFailFast(boolean failFast) {
        return new MapReduceConfig(mapper, reducer, numMappers, failFast);
    }
}
