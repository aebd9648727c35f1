package com.ryuqq.agentica.pattern.chain;

import com.ryuqq.agentica.adapter.inmemory.tracker.InMemoryAgentTracker;
import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.exception.UnknownRouteException;
import com.ryuqq.agentica.testkit.AbstractPatternTest;
import com.ryuqq.agentica.testkit.Answers;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ChainOfResponsibility 유닛 테스트.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
class ChainOfResponsibilityTest extends AbstractPatternTest {

    private static final String BILLING = "You handle billing.";
    private static final String REFUND = "You handle refunds.";
    private static final String GENERAL = "You handle anything.";

    @Test
    void process_priority가_낮은_핸들러부터_검사() {
        // given
        runtime.on(BILLING, Answers.constant("billing answer"));
        runtime.on(REFUND, Answers.constant("refund answer"));
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
            Handler.of(BILLING, query -> query.contains("invoice"), 5),
            Handler.of(REFUND, query -> query.contains("refund"), 1)), factory);

        // when
        String result = chain.process("refund for my invoice");

        // then
        assertThat(result).isEqualTo("refund answer");
        assertSpawned(REFUND, 1);
        assertSpawned(BILLING, 0);
        assertThat(runtime.promptsTo(REFUND)).containsExactly("refund for my invoice");
    }

    @Test
    void 생성_같은_priority는_선언_순서_유지() {
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
            Handler.catchAll(GENERAL),
            Handler.of(BILLING, query -> true),
            Handler.of(REFUND, query -> true)), factory);

        assertThat(chain.handlers())
            .extracting(handler -> handler.spec().premise())
            .containsExactly(BILLING, REFUND, GENERAL);
    }

    @Test
    void process_일치하는_핸들러가_없으면_UnknownRouteException() {
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
            Handler.of(BILLING, query -> query.contains("invoice"))), factory);

        assertThatThrownBy(() -> chain.process("weather today"))
            .isInstanceOf(UnknownRouteException.class)
            .hasMessage("No handler could process the query: weather today")
            .satisfies(e -> {
                UnknownRouteException ex = (UnknownRouteException) e;
                assertThat(ex.getRoute()).isEqualTo("weather today");
                assertThat(ex.getKnownRoutes()).containsExactly(BILLING);
            });
        assertThat(runtime.spawnCount()).isZero();
    }

    @Test
    void process_catchAll은_마지막에_처리() {
        runtime.on(GENERAL, Answers.echo());
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
            Handler.catchAll(GENERAL),
            Handler.of(BILLING, query -> query.contains("invoice"))), factory);

        assertThat(chain.process("weather today")).isEqualTo("weather today");
        assertSpawned(BILLING, 0);
    }

    @Test
    void process_호출마다_에이전트를_새로_생성() {
        runtime.on(GENERAL, Answers.constant("ok"));
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(Handler.catchAll(GENERAL)), factory);

        chain.process("a");
        chain.process("b");

        assertSpawned(GENERAL, 2);
    }

    @Test
    void route_에이전트를_생성하지_않음() {
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
            Handler.of(BILLING, query -> query.contains("invoice")),
            Handler.catchAll(GENERAL)), factory);

        assertThat(chain.route("invoice #3")).get()
            .extracting(handler -> handler.spec().premise())
            .isEqualTo(BILLING);
        assertThat(runtime.spawnCount()).isZero();
    }

    @Test
    void process_spawn_컨텍스트에_priority_기록() {
        InMemoryAgentTracker tracker = new InMemoryAgentTracker();
        runtime.on(REFUND, Answers.constant("ok"));
        ChainOfResponsibility chain = new ChainOfResponsibility(List.of(
            Handler.of(REFUND, query -> true, 7),
            Handler.catchAll(GENERAL)), new AgentFactory(runtime, tracker));

        chain.process("q");

        assertThat(tracker.findByRole("handler")).singleElement()
            .satisfies(assignment -> {
                assertThat(assignment.attribute("handler_priority")).isEqualTo("7");
                assertThat(assignment.attribute("chain_length")).isEqualTo("2");
            });
    }

    @Test
    void 생성_핸들러가_없으면_예외() {
        assertThatThrownBy(() -> new ChainOfResponsibility(List.of(), factory))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("handlers must not be empty");
    }
}
