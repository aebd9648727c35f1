package com.ryuqq.agentica.pattern.pipeline;

import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.exception.AgentPatternException;
import com.ryuqq.agentica.core.handoff.HandoffState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Pipeline 패턴: 고정된 단계 목록에 {@link HandoffState}를 순서대로 통과시킵니다.
 *
 * <p>단계 k+1은 단계 k가 반환한 뒤에만 시작합니다. 병렬 실행과 재시도는 없으며
 * 단계 사이에 상태를 검증하지 않습니다. 단계의 예외는 그대로 전파됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final List<Stage> stages;
    private final String patternId;

    /**
     * @param stages 단계 목록 (1개 이상, null 항목 불가)
     * @throws IllegalArgumentException 단계가 없거나 null 항목이 있는 경우
     */
    public Pipeline(List<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Pipeline requires at least one stage");
        }
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i) == null) {
                throw new IllegalArgumentException("stage cannot be null (index: " + i + ")");
            }
        }
        this.stages = List.copyOf(stages);
        this.patternId = PatternIds.newId();
    }

    public static Pipeline of(Stage... stages) {
        return new Pipeline(stages == null ? null : Arrays.asList(stages));
    }

    /**
     * 파이프라인 실행.
     *
     * @param initialState 초기 상태
     * @return 마지막 단계가 반환한 상태
     * @throws AgentPatternException 단계가 null 상태를 반환한 경우
     */
    public HandoffState run(HandoffState initialState) {
        if (initialState == null) {
            throw new IllegalArgumentException("initialState cannot be null");
        }

        HandoffState state = initialState;
        for (int i = 0; i < stages.size(); i++) {
            log.debug("Pipeline {} running stage {}/{}", patternId, i + 1, stages.size());
            state = stages.get(i).apply(state, new StageContext(patternId, i, stages.size()));
            if (state == null) {
                throw new AgentPatternException("Pipeline stage returned null state (index: " + i + ")");
            }
        }
        return state;
    }

    public List<Stage> stages() {
        return stages;
    }

    public String patternId() {
        return patternId;
    }
}
