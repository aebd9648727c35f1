package com.ryuqq.agentica.core.aggregate;

import com.ryuqq.agentica.core.exception.AgentPatternException;

import java.util.List;

/**
 * 집계 입력 형태 불일치.
 *
 * <p>MERGE에서 매핑과 리스트가 섞였거나, BEST에서 숫자 {@code score}가 없는 입력이 있을 때 발생합니다.
 * 호출자/데이터 버그이므로 재시도 대상이 아닙니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class AggregationException extends AgentPatternException {

    private final AggregateMode mode;
    private final List<String> inputTypes;

    public AggregationException(AggregateMode mode, List<String> inputTypes, String reason) {
        super(mode + " aggregation failed: " + reason + " (input types: " + inputTypes + ")");
        this.mode = mode;
        this.inputTypes = inputTypes == null ? List.of() : List.copyOf(inputTypes);
    }

    public AggregateMode getMode() {
        return mode;
    }

    /**
     * null을 제외한 입력들의 클래스 이름.
     *
     * @return 불변 리스트
     */
    public List<String> getInputTypes() {
        return inputTypes;
    }
}
