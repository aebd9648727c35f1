package com.ryuqq.agentica.pattern.generatorcritic;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.handoff.HandoffState;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * GeneratorCritic 패턴: generator가 만든 해법을 critic이 승인할 때까지 반복 개선합니다.
 *
 * <p><strong>라운드 흐름:</strong></p>
 * <ol>
 *   <li>generator: 이전 feedback({@code artifacts["feedback"]})을 반영해 해법 생성</li>
 *   <li>critic: 해법 검토 후 nextInstruction에 승인 표시 또는 새 feedback 기록</li>
 *   <li>승인 판단 함수가 true면 종료, 아니면 maxRounds까지 반복</li>
 * </ol>
 *
 * <p>두 에이전트 모두 현재 {@link HandoffState}를 {@code state} 인자로 받고
 * {@link ResultShape#HANDOFF} 형태로 상태를 반환해야 합니다.
 * 반환된 최종 상태의 metadata에는 {@code rounds}와 {@code approved}가 기록됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class GeneratorCritic {

    private static final Logger log = LoggerFactory.getLogger(GeneratorCritic.class);

    static final String FEEDBACK_KEY = "feedback";
    static final String STATE_ARGUMENT = "state";

    private final GeneratorCriticConfig config;
    private final AgentFactory factory;
    private final String patternId;

    private AgentHandle generator;
    private AgentHandle critic;

    public GeneratorCritic(GeneratorCriticConfig config, AgentFactory factory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.config = config;
        this.factory = factory;
        this.patternId = PatternIds.newId();
    }

    /**
     * 생성/비평 반복 실행.
     *
     * @param task 과제
     * @return 최종 상태 (승인되었거나 maxRounds에 도달)
     * @throws AgentInvocationException 에이전트가 상태를 반환하지 않은 경우
     */
    public HandoffState run(String task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        HandoffState state = new HandoffState("Task: " + task, "Generate initial solution");
        boolean approved = false;
        int round = 0;

        while (round < config.maxRounds() && !approved) {
            round++;

            AgentHandle generatorHandle = generator(round);
            state = invoke(generatorHandle, generatorPrompt(task, state), state);
            state.recordHandoff("generator", "critic");

            AgentHandle criticHandle = critic(round);
            state = invoke(criticHandle, critiquePrompt(task, state), state);

            approved = config.approval().test(state);
            if (!approved && round < config.maxRounds()) {
                state.recordHandoff("critic", "generator");
            }
            log.debug("GeneratorCritic {} round {}/{} approved={}", patternId, round, config.maxRounds(), approved);
        }

        state.putMetadata("rounds", round);
        state.putMetadata("approved", approved);
        if (approved) {
            log.info("GeneratorCritic {} approved after {} round(s)", patternId, round);
        } else {
            log.info("GeneratorCritic {} reached max rounds ({}) without approval", patternId, round);
        }
        return state;
    }

    private static HandoffState invoke(AgentHandle agent, String prompt, HandoffState state) {
        HandoffState next = agent.invoke(ResultShape.HANDOFF, prompt, Map.of(STATE_ARGUMENT, state));
        if (next == null) {
            throw new AgentInvocationException(agent.agentId(), "Agent returned no handoff state");
        }
        return next;
    }

    private static String generatorPrompt(String task, HandoffState state) {
        Object feedback = state.getArtifact(FEEDBACK_KEY);
        String feedbackText = feedback != null && !feedback.toString().isBlank()
            ? "Feedback from previous round: " + feedback
            : "First attempt.";
        return state.getContext()
            + "\n\nTask: " + task
            + "\n\n" + feedbackText
            + "\n\nGenerate your solution. Return HandoffState with artifacts.";
    }

    private static String critiquePrompt(String task, HandoffState state) {
        return "Review this solution:"
            + "\nTask: " + task
            + "\nSolution artifacts: " + state.getArtifacts()
            + "\n\nProvide feedback. If approved, set next_instruction to \""
            + GeneratorCriticConfig.APPROVAL_SENTINEL + "\"."
            + "\nOtherwise, provide constructive feedback in artifacts['" + FEEDBACK_KEY + "'].";
    }

    private synchronized AgentHandle generator(int round) {
        if (generator == null) {
            generator = factory.spawn(config.generator(), context("generator", round));
        }
        return generator;
    }

    private synchronized AgentHandle critic(int round) {
        if (critic == null) {
            critic = factory.spawn(config.critic(), context("critic", round));
        }
        return critic;
    }

    private SpawnContext context(String role, int round) {
        return SpawnContext.of(PatternType.GENERATOR_CRITIC, patternId, role)
            .with("iteration", round)
            .with("max_rounds", config.maxRounds());
    }

    public String patternId() {
        return patternId;
    }
}
