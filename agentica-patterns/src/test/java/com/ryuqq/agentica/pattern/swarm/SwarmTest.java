package com.ryuqq.agentica.pattern.swarm;

import com.ryuqq.agentica.adapter.inmemory.tracker.InMemoryAgentTracker;
import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.aggregate.AggregateMode;
import com.ryuqq.agentica.core.concurrent.TaskGroupException;
import com.ryuqq.agentica.core.exception.InsufficientParticipantsException;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.testkit.AbstractPatternTest;
import com.ryuqq.agentica.testkit.AgentCall;
import com.ryuqq.agentica.testkit.Answers;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Swarm 유닛 테스트.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
class SwarmTest extends AbstractPatternTest {

    private static final List<String> PERSPECTIVES = List.of(
        "You are a security expert.",
        "You are a performance expert.",
        "You are a usability expert.");

    @Test
    void execute_MERGE_모든_관점의_키를_병합() {
        // given
        runtime.on(PERSPECTIVES.get(0), Answers.constant(Map.of("security", "ok")));
        runtime.on(PERSPECTIVES.get(1), Answers.constant(Map.of("performance", "slow")));
        runtime.on(PERSPECTIVES.get(2), Answers.constant(Map.of("usability", "fine")));
        Swarm swarm = new Swarm(SwarmConfig.of(PERSPECTIVES), factory, taskGroup);

        // when
        Object result = swarm.execute("Review the login flow");

        // then
        assertThat(asMap(result)).containsOnlyKeys("security", "performance", "usability");
        for (String perspective : PERSPECTIVES) {
            assertSpawned(perspective, 1);
            assertThat(runtime.promptsTo(perspective)).containsExactly("Review the login flow");
        }
    }

    @Test
    void execute_CONCAT_관점_순서대로_이어붙이고_TEXT_형태로_호출() {
        // given
        runtime.on(PERSPECTIVES.get(0), Answers.delayed(Duration.ofMillis(100), "first"));
        runtime.on(PERSPECTIVES.get(1), Answers.constant("second"));
        runtime.on(PERSPECTIVES.get(2), Answers.constant("third"));
        SwarmConfig config = SwarmConfig.of(PERSPECTIVES)
            .withAggregateMode(AggregateMode.CONCAT)
            .withSeparator(" | ");
        Swarm swarm = new Swarm(config, factory, taskGroup);

        // when
        Object result = swarm.execute("q");

        // then
        assertThat(result).isEqualTo("first | second | third");
        assertThat(runtime.calls()).extracting(AgentCall::shape).containsOnly(ResultShape.TEXT);
    }

    @Test
    void execute_partial_실패한_관점은_제외() {
        // given
        runtime.on(PERSPECTIVES.get(0), Answers.constant(Map.of("security", "ok")));
        runtime.on(PERSPECTIVES.get(1), Answers.failing("timeout"));
        runtime.on(PERSPECTIVES.get(2), Answers.constant(Map.of("usability", "fine")));
        Swarm swarm = new Swarm(SwarmConfig.of(PERSPECTIVES), factory, taskGroup);

        // when
        Object result = swarm.execute("q");

        // then
        assertThat(asMap(result)).containsOnlyKeys("security", "usability");
    }

    @Test
    void execute_partial_null_결과는_제외하고_하나만_남으면_그대로_반환() {
        // given
        runtime.on(PERSPECTIVES.get(0), Answers.constant(null));
        runtime.on(PERSPECTIVES.get(1), Answers.constant(Map.of("performance", "slow")));
        runtime.on(PERSPECTIVES.get(2), Answers.failing("boom"));
        Swarm swarm = new Swarm(SwarmConfig.of(PERSPECTIVES), factory, taskGroup);

        // when
        Object result = swarm.execute("q");

        // then
        assertThat(result).isEqualTo(Map.of("performance", "slow"));
    }

    @Test
    void execute_partial_모두_실패하면_InsufficientParticipantsException() {
        // given
        runtime.onAny(Answers.failing("down"));
        Swarm swarm = new Swarm(SwarmConfig.of(PERSPECTIVES), factory, taskGroup);

        // when & then
        assertThatThrownBy(() -> swarm.execute("q"))
            .isInstanceOf(InsufficientParticipantsException.class)
            .satisfies(e -> {
                InsufficientParticipantsException ex = (InsufficientParticipantsException) e;
                assertThat(ex.getSucceeded()).isZero();
                assertThat(ex.getFailures()).hasSize(3);
            });
    }

    @Test
    void execute_failFast_실패하면_TaskGroupException() {
        // given
        runtime.on(PERSPECTIVES.get(0), Answers.constant(Map.of("security", "ok")));
        runtime.on(PERSPECTIVES.get(1), Answers.failing("timeout"));
        runtime.on(PERSPECTIVES.get(2), Answers.constant(Map.of("usability", "fine")));
        Swarm swarm = new Swarm(SwarmConfig.of(PERSPECTIVES).withFailFast(true), factory, taskGroup);

        // when & then
        assertThatThrownBy(() -> swarm.execute("q"))
            .isInstanceOf(TaskGroupException.class)
            .hasRootCauseMessage("timeout");
    }

    @Test
    void execute_spawn_컨텍스트에_관점_인덱스_기록() {
        // given
        InMemoryAgentTracker tracker = new InMemoryAgentTracker();
        AgentFactory trackedFactory = new AgentFactory(runtime, tracker);
        runtime.onAny(Answers.constant(Map.of("k", "v")));
        Swarm swarm = new Swarm(SwarmConfig.of(PERSPECTIVES), trackedFactory, taskGroup);

        // when
        swarm.execute("q");

        // then
        assertThat(tracker.findByPatternId(swarm.patternId()))
            .hasSize(3)
            .allSatisfy(assignment -> {
                assertThat(assignment.patternType()).isEqualTo(PatternType.SWARM);
                assertThat(assignment.role()).isEqualTo("worker");
                assertThat(assignment.attribute("total_perspectives")).isEqualTo("3");
            })
            .extracting(assignment -> assignment.attribute("perspective_index"))
            .containsExactly("0", "1", "2");
    }

    @Test
    void config_관점이_없으면_예외() {
        assertThatThrownBy(() -> SwarmConfig.of(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("perspectives");
    }

    @Test
    void config_기본_결과_형태는_집계_방식을_따름() {
        assertThat(SwarmConfig.of(PERSPECTIVES).defaultShape()).isEqualTo(ResultShape.MAPPING);
        assertThat(SwarmConfig.of(PERSPECTIVES).withAggregateMode(AggregateMode.BEST).defaultShape())
            .isEqualTo(ResultShape.MAPPING);
        assertThat(SwarmConfig.of(PERSPECTIVES).withAggregateMode(AggregateMode.CONCAT).defaultShape())
            .isEqualTo(ResultShape.TEXT);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        assertThat(value).isInstanceOf(Map.class);
        return (Map<String, Object>) value;
    }
}
