package com.ryuqq.agentica.pattern.eventdriven;

import com.ryuqq.agentica.adapter.inmemory.tracker.InMemoryAgentTracker;
import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.testkit.AbstractPatternTest;
import com.ryuqq.agentica.testkit.Answers;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventDriven 유닛 테스트.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
class EventDrivenTest extends AbstractPatternTest {

    private static final String WELCOMER = "You welcome new users.";
    private static final String AUDITOR = "You audit every event.";
    private static final String BILLING = "You handle payments.";

    private EventDriven eventDriven() {
        return new EventDriven(List.of(
            Subscriber.of(WELCOMER, "user.created"),
            Subscriber.of(AUDITOR, Subscriber.WILDCARD),
            Subscriber.of(BILLING, "payment.received", "payment.failed")), factory, taskGroup);
    }

    @Test
    void publish_타입이_일치하는_구독자와_와일드카드_구독자에게_전달() {
        // given
        runtime.on(WELCOMER, Answers.constant("welcome sent"));
        runtime.on(AUDITOR, Answers.constant("logged"));
        Event event = new Event("user.created", Map.of("user", "alice"), Instant.parse("2026-01-01T00:00:00Z"));

        // when
        List<EventDelivery<String>> deliveries = eventDriven().publish(event);

        // then
        assertThat(deliveries)
            .extracting(EventDelivery::value)
            .containsExactly("welcome sent", "logged");
        assertSpawned(BILLING, 0);
        assertThat(runtime.promptsTo(WELCOMER)).containsExactly(
            "Event received:\nType: user.created\nPayload: {user=alice}\nTimestamp: 2026-01-01T00:00:00Z"
                + "\n\nHandle this event according to your role.");
    }

    @Test
    void publish_여러_타입을_구독한_구독자() {
        runtime.on(AUDITOR, Answers.constant("logged"));
        runtime.on(BILLING, Answers.constant("retry scheduled"));

        List<EventDelivery<String>> deliveries = eventDriven().publish(Event.of("payment.failed", Map.of()));

        assertThat(deliveries)
            .extracting(delivery -> delivery.subscriber().spec().premise())
            .containsExactly(AUDITOR, BILLING);
    }

    @Test
    void publish_일치하는_구독자가_없으면_빈_리스트() {
        EventDriven eventDriven = new EventDriven(List.of(Subscriber.of(WELCOMER, "user.created")), factory, taskGroup);

        List<EventDelivery<String>> deliveries = eventDriven.publish(Event.of("order.shipped", Map.of()));

        assertThat(deliveries).isEmpty();
        assertThat(runtime.spawnCount()).isZero();
    }

    @Test
    void publish_구독자_실패는_다른_구독자에게_영향_없이_실패_값으로_반환() {
        // given
        runtime.on(WELCOMER, Answers.failing("mail server down"));
        runtime.on(AUDITOR, Answers.constant("logged"));

        // when
        List<EventDelivery<String>> deliveries = eventDriven().publish(Event.of("user.created", Map.of()));

        // then
        assertThat(deliveries).hasSize(2);
        assertThat(deliveries.get(0).isSuccess()).isFalse();
        assertThat(deliveries.get(0).failure()).hasMessage("mail server down");
        assertThat(deliveries.get(0).value()).isNull();
        assertThat(deliveries.get(1).isSuccess()).isTrue();
        assertThat(deliveries.get(1).value()).isEqualTo("logged");
    }

    @Test
    void publish_발행마다_구독자_에이전트를_새로_생성() {
        runtime.onAny(Answers.constant("ok"));
        EventDriven eventDriven = eventDriven();

        eventDriven.publish(Event.of("user.created", Map.of()));
        eventDriven.publish(Event.of("user.created", Map.of()));

        assertSpawned(WELCOMER, 2);
        assertSpawned(AUDITOR, 2);
    }

    @Test
    void publish_spawn_컨텍스트에_구독_타입_기록() {
        InMemoryAgentTracker tracker = new InMemoryAgentTracker();
        runtime.onAny(Answers.constant("ok"));
        EventDriven eventDriven = new EventDriven(
            List.of(Subscriber.of(BILLING, "payment.received", "payment.failed")),
            new AgentFactory(runtime, tracker), taskGroup);

        eventDriven.publish(Event.of("payment.received", Map.of()));

        assertThat(tracker.findByRole("subscriber")).singleElement()
            .satisfies(assignment -> assertThat(assignment.attribute("subscriber_event_types"))
                .isEqualTo("payment.received,payment.failed"));
    }

    @Test
    void subscriber_와일드카드는_모든_타입과_일치() {
        Subscriber subscriber = Subscriber.of(AUDITOR, Subscriber.WILDCARD);

        assertThat(subscriber.matches("anything")).isTrue();
        assertThat(Subscriber.of(WELCOMER, "user.created").matches("user.deleted")).isFalse();
    }

    @Test
    void event_timestamp가_없으면_현재_시각() {
        Instant before = Instant.now();

        Event event = Event.of("user.created", null);

        assertThat(event.timestamp()).isAfterOrEqualTo(before);
        assertThat(event.payload()).isEmpty();
    }

    @Test
    void 생성_구독_타입이_없으면_예외() {
        assertThatThrownBy(() -> Subscriber.of(WELCOMER))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("eventTypes must not be empty");
    }
}
