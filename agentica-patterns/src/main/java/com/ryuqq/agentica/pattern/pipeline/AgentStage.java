package com.ryuqq.agentica.pattern.pipeline;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.handoff.Handoff;
import com.ryuqq.agentica.core.handoff.HandoffState;
import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;

import java.util.List;
import java.util.Map;

/**
 * 에이전트가 처리하는 파이프라인 단계.
 *
 * <p>에이전트에게 현재 상태를 {@code state} 인자로 넘기고 {@link ResultShape#HANDOFF} 결과를 받습니다.
 * 반환된 상태에는 직전 단계에서 이 단계로의 handoff가 기록됩니다.
 * 에이전트는 처음 실행될 때 생성되어 재사용되며, 생성 시점의 파이프라인 ID와 단계 위치가
 * spawn 컨텍스트에 기록됩니다. 파이프라인 밖에서 직접 실행하면 단계 자체의 ID로 단일 단계처럼 기록됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class AgentStage implements Stage {

    static final String START = "start";

    private final String name;
    private final AgentSpec spec;
    private final AgentFactory factory;
    private final StageContext standalone;

    private AgentHandle agent;

    /**
     * @param name 단계 이름 (handoff 기록에 사용)
     * @param spec 에이전트 명세
     * @param factory 에이전트 팩토리
     */
    public AgentStage(String name, AgentSpec spec, AgentFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.name = name;
        this.spec = spec;
        this.factory = factory;
        this.standalone = new StageContext(PatternIds.newId(), 0, 1);
    }

    @Override
    public HandoffState apply(HandoffState state) {
        return apply(state, standalone);
    }

    @Override
    public HandoffState apply(HandoffState state, StageContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        AgentHandle handle = agent(context);
        HandoffState result = handle.invoke(ResultShape.HANDOFF, prompt(state), Map.of("state", state));
        if (result == null) {
            throw new AgentInvocationException(handle.agentId(), "Stage '" + name + "' returned no state");
        }
        result.recordHandoff(previousStage(state), name);
        return result;
    }

    private String prompt(HandoffState state) {
        return state.getContext()
            + "\n\nStage: " + name
            + "\nInstruction: " + state.getNextInstruction()
            + "\n\nReturn the updated HandoffState with your results in artifacts.";
    }

    private static String previousStage(HandoffState state) {
        List<Handoff> chain = state.getHandoffChain();
        return chain.isEmpty() ? START : chain.get(chain.size() - 1).to();
    }

    private synchronized AgentHandle agent(StageContext stage) {
        if (agent == null) {
            SpawnContext context = SpawnContext.of(PatternType.PIPELINE, stage.patternId(), "stage")
                .with("stage_name", name)
                .with("stage_index", stage.stageIndex())
                .with("total_stages", stage.totalStages());
            agent = factory.spawn(spec, context);
        }
        return agent;
    }

    public String name() {
        return name;
    }
}
