package com.ryuqq.agentica.pattern.generatorcritic;

import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.handoff.Handoff;
import com.ryuqq.agentica.core.handoff.HandoffState;
import com.ryuqq.agentica.testkit.AbstractPatternTest;
import com.ryuqq.agentica.testkit.AgentCall;
import com.ryuqq.agentica.testkit.Answers;
import com.ryuqq.agentica.testkit.ScriptedAgentRuntime;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GeneratorCritic 유닛 테스트.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
class GeneratorCriticTest extends AbstractPatternTest {

    private static final String GENERATOR = "You write Python functions.";
    private static final String CRITIC = "You review Python code.";

    private static HandoffState incoming(AgentCall call) {
        return ((HandoffState) call.argument("state")).copy();
    }

    /**
     * 호출마다 solution 버전을 올리는 generator.
     */
    private static ScriptedAgentRuntime.Behavior versionedGenerator() {
        AtomicInteger version = new AtomicInteger();
        return call -> {
            HandoffState next = incoming(call);
            next.addArtifact("solution", "v" + version.incrementAndGet());
            return next;
        };
    }

    /**
     * approveOnRound 번째 호출에서 승인하고, 그 전에는 피드백을 남기는 critic.
     */
    private static ScriptedAgentRuntime.Behavior criticApprovingOn(int approveOnRound) {
        AtomicInteger round = new AtomicInteger();
        return call -> {
            HandoffState next = incoming(call);
            if (round.incrementAndGet() >= approveOnRound) {
                next.updateInstruction(GeneratorCriticConfig.APPROVAL_SENTINEL);
            } else {
                next.addArtifact("feedback", "add type hints");
                next.updateInstruction("Revise the solution");
            }
            return next;
        };
    }

    @Test
    void run_critic이_승인하면_반복_종료() {
        // given
        runtime.on(GENERATOR, versionedGenerator());
        runtime.on(CRITIC, criticApprovingOn(2));
        GeneratorCritic loop = new GeneratorCritic(GeneratorCriticConfig.of(GENERATOR, CRITIC), factory);

        // when
        HandoffState result = loop.run("Write a fibonacci function");

        // then
        assertThat(result.getArtifact("solution")).isEqualTo("v2");
        assertThat(result.getMetadata("rounds")).isEqualTo(2);
        assertThat(result.getMetadata("approved")).isEqualTo(true);
        assertInvoked(GENERATOR, 2);
        assertInvoked(CRITIC, 2);
    }

    @Test
    void run_critic_피드백을_다음_generator_프롬프트에_전달() {
        // given
        runtime.on(GENERATOR, versionedGenerator());
        runtime.on(CRITIC, criticApprovingOn(2));
        GeneratorCritic loop = new GeneratorCritic(GeneratorCriticConfig.of(GENERATOR, CRITIC), factory);

        // when
        loop.run("Write a fibonacci function");

        // then
        List<String> generatorPrompts = runtime.promptsTo(GENERATOR);
        assertThat(generatorPrompts.get(0))
            .startsWith("Task: Write a fibonacci function")
            .contains("First attempt.");
        assertThat(generatorPrompts.get(1)).contains("Feedback from previous round: add type hints");
        assertThat(runtime.promptsTo(CRITIC).get(0))
            .contains("Solution artifacts: {solution=v1}")
            .contains("set next_instruction to \"APPROVED\"");
    }

    @Test
    void run_handoff_이력_기록() {
        runtime.on(GENERATOR, versionedGenerator());
        runtime.on(CRITIC, criticApprovingOn(2));
        GeneratorCritic loop = new GeneratorCritic(GeneratorCriticConfig.of(GENERATOR, CRITIC), factory);

        HandoffState result = loop.run("task");

        assertThat(result.getHandoffChain()).containsExactly(
            new Handoff("generator", "critic"),
            new Handoff("critic", "generator"),
            new Handoff("generator", "critic"));
    }

    @Test
    void run_승인되지_않으면_maxRounds에서_종료() {
        // given
        runtime.on(GENERATOR, versionedGenerator());
        runtime.on(CRITIC, criticApprovingOn(Integer.MAX_VALUE));
        GeneratorCritic loop = new GeneratorCritic(GeneratorCriticConfig.of(GENERATOR, CRITIC).withMaxRounds(2), factory);

        // when
        HandoffState result = loop.run("task");

        // then
        assertThat(result.getMetadata("rounds")).isEqualTo(2);
        assertThat(result.getMetadata("approved")).isEqualTo(false);
        assertThat(result.getArtifact("solution")).isEqualTo("v2");
        assertThat(result.getHandoffChain()).hasSize(3);
    }

    @Test
    void run_사용자_승인_조건() {
        // given
        runtime.on(GENERATOR, versionedGenerator());
        runtime.on(CRITIC, call -> incoming(call));
        GeneratorCriticConfig config = GeneratorCriticConfig.of(GENERATOR, CRITIC)
            .withMaxRounds(5)
            .withApproval(state -> "v3".equals(state.getArtifact("solution")));
        GeneratorCritic loop = new GeneratorCritic(config, factory);

        // when
        HandoffState result = loop.run("task");

        // then
        assertThat(result.getMetadata("rounds")).isEqualTo(3);
        assertThat(result.getMetadata("approved")).isEqualTo(true);
    }

    @Test
    void run_에이전트는_실행_간에_재사용() {
        runtime.on(GENERATOR, versionedGenerator());
        runtime.on(CRITIC, criticApprovingOn(1));
        GeneratorCritic loop = new GeneratorCritic(GeneratorCriticConfig.of(GENERATOR, CRITIC), factory);

        loop.run("a");
        loop.run("b");

        assertSpawned(GENERATOR, 1);
        assertSpawned(CRITIC, 1);
    }

    @Test
    void run_에이전트가_상태를_반환하지_않으면_AgentInvocationException() {
        runtime.on(GENERATOR, Answers.constant(null));
        GeneratorCritic loop = new GeneratorCritic(GeneratorCriticConfig.of(GENERATOR, CRITIC), factory);

        assertThatThrownBy(() -> loop.run("task"))
            .isInstanceOf(AgentInvocationException.class)
            .hasMessage("Agent returned no handoff state");
        assertInvoked(CRITIC, 0);
    }

    @Test
    void config_maxRounds가_양수가_아니면_예외() {
        assertThatThrownBy(() -> GeneratorCriticConfig.of(GENERATOR, CRITIC).withMaxRounds(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxRounds must be positive (current: 0)");
    }
}
