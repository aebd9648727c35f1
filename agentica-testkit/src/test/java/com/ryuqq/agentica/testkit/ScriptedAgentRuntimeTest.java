package com.ryuqq.agentica.testkit;

import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptedAgentRuntime 유닛 테스트.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
class ScriptedAgentRuntimeTest {

    @Test
    void invoke_premise별_응답과_호출_기록() {
        // given
        ScriptedAgentRuntime runtime = new ScriptedAgentRuntime()
            .on("writer", Answers.constant("draft"))
            .onAny(Answers.echo());
        AgentHandle writer = runtime.create(AgentSpec.of("writer"));
        AgentHandle other = runtime.create(AgentSpec.of("other"));

        // when
        String first = writer.invoke(ResultShape.TEXT, "write it");
        String second = other.invoke(ResultShape.TEXT, "echo me", Map.of("k", "v"));

        // then
        assertThat(first).isEqualTo("draft");
        assertThat(second).isEqualTo("echo me");
        assertThat(runtime.spawnCount()).isEqualTo(2);
        assertThat(runtime.callsTo("other")).singleElement()
            .satisfies(call -> assertThat(call.argument("k")).isEqualTo("v"));
        assertThat(writer.agentId()).isNotEqualTo(other.agentId());
    }

    @Test
    void sequence_소진되면_마지막_값_반복_예외는_던짐() {
        ScriptedAgentRuntime runtime = new ScriptedAgentRuntime()
            .on("flaky", Answers.sequence(new IllegalStateException("down"), "up"));
        AgentHandle handle = runtime.create(AgentSpec.of("flaky"));

        assertThatThrownBy(() -> handle.invoke(ResultShape.TEXT, "1"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(handle.invoke(ResultShape.TEXT, "2")).isEqualTo("up");
        assertThat(handle.invoke(ResultShape.TEXT, "3")).isEqualTo("up");
    }

    @Test
    void invoke_응답이_없거나_형태가_다르면_AgentInvocationException() {
        ScriptedAgentRuntime runtime = new ScriptedAgentRuntime().on("bool", Answers.constant("not a boolean"));

        assertThatThrownBy(() -> runtime.create(AgentSpec.of("unknown")).invoke(ResultShape.TEXT, "q"))
            .isInstanceOf(AgentInvocationException.class)
            .hasMessageContaining("unknown");
        assertThatThrownBy(() -> runtime.create(AgentSpec.of("bool")).invoke(ResultShape.BOOLEAN, "q"))
            .isInstanceOf(AgentInvocationException.class);
    }

    @Test
    void delayed_인터럽트되면_플래그를_복원하고_실패() {
        ScriptedAgentRuntime runtime = new ScriptedAgentRuntime()
            .on("slow", Answers.delayed(Duration.ofSeconds(5), "late"));
        AgentHandle handle = runtime.create(AgentSpec.of("slow"));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> handle.invoke(ResultShape.TEXT, "q"))
                .isInstanceOf(AgentInvocationException.class)
                .hasMessageContaining("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void manualClock_advance로만_전진() {
        ManualClock clock = new ManualClock();
        Instant start = clock.instant();

        clock.advance(Duration.ofSeconds(30));

        assertThat(Duration.between(start, clock.instant())).isEqualTo(Duration.ofSeconds(30));
        assertThatThrownBy(() -> clock.advance(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
