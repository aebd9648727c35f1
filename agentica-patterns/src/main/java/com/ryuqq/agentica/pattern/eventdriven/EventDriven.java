package com.ryuqq.agentica.pattern.eventdriven;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.concurrent.TaskGroup;
import com.ryuqq.agentica.core.concurrent.TaskResult;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * EventDriven 패턴: 이벤트 타입을 구독한 에이전트들에게 이벤트를 동시에 전달합니다.
 *
 * <p>{@code publish}마다 일치하는 구독자별로 에이전트를 하나씩 생성하고 {@link TaskGroup} PARTIAL 모드로
 * 실행합니다. 한 구독자의 실패는 다른 구독자에게 영향을 주지 않으며 {@link EventDelivery}의
 * 실패 값으로 반환됩니다. 일치하는 구독자가 없으면 아무것도 생성하지 않고 빈 리스트를 반환합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class EventDriven {

    private static final Logger log = LoggerFactory.getLogger(EventDriven.class);

    private final List<Subscriber> subscribers;
    private final AgentFactory factory;
    private final TaskGroup taskGroup;
    private final String patternId;

    public EventDriven(List<Subscriber> subscribers, AgentFactory factory) {
        this(subscribers, factory, TaskGroup.shared());
    }

    /**
     * @param subscribers 구독자 목록 (1개 이상)
     * @param factory 에이전트 팩토리
     * @param taskGroup 동시 실행 그룹
     */
    public EventDriven(List<Subscriber> subscribers, AgentFactory factory, TaskGroup taskGroup) {
        if (subscribers == null || subscribers.isEmpty()) {
            throw new IllegalArgumentException("subscribers must not be empty");
        }
        for (int i = 0; i < subscribers.size(); i++) {
            if (subscribers.get(i) == null) {
                throw new IllegalArgumentException("subscriber cannot be null (index: " + i + ")");
            }
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (taskGroup == null) {
            throw new IllegalArgumentException("taskGroup cannot be null");
        }
        this.subscribers = List.copyOf(subscribers);
        this.factory = factory;
        this.taskGroup = taskGroup;
        this.patternId = PatternIds.newId();
    }

    public List<EventDelivery<String>> publish(Event event) {
        return publish(event, ResultShape.TEXT);
    }

    /**
     * 이벤트 발행.
     *
     * @param event 이벤트
     * @param shape 구독자 결과 형태
     * @param <T> 결과 타입
     * @return 일치한 구독자별 전달 결과 (구독자 선언 순서)
     */
    public <T> List<EventDelivery<T>> publish(Event event, ResultShape<T> shape) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }

        List<Subscriber> matched = subscribersFor(event.type());
        if (matched.isEmpty()) {
            log.debug("EventDriven {} has no subscriber for event type {}", patternId, event.type());
            return List.of();
        }

        String prompt = eventPrompt(event);
        List<Callable<T>> deliveries = new ArrayList<>(matched.size());
        for (Subscriber subscriber : matched) {
            AgentHandle agent = spawn(subscriber);
            deliveries.add(() -> agent.invoke(shape, prompt));
        }
        log.debug("EventDriven {} delivering {} to {} subscriber(s)", patternId, event.type(), matched.size());

        List<TaskResult<T>> results = taskGroup.runPartial(deliveries);
        List<EventDelivery<T>> delivered = new ArrayList<>(results.size());
        for (TaskResult<T> result : results) {
            Subscriber subscriber = matched.get(result.index());
            if (result.isFailure()) {
                log.warn("Subscriber {} failed to handle {} in {}",
                    subscriber.spec().premise(), event.type(), patternId, result.failureOrNull());
            }
            delivered.add(new EventDelivery<>(subscriber, result));
        }
        return delivered;
    }

    /**
     * 이벤트 타입에 일치하는 구독자 (선언 순서).
     */
    public List<Subscriber> subscribersFor(String type) {
        List<Subscriber> matched = new ArrayList<>();
        for (Subscriber subscriber : subscribers) {
            if (subscriber.matches(type)) {
                matched.add(subscriber);
            }
        }
        return matched;
    }

    private AgentHandle spawn(Subscriber subscriber) {
        SpawnContext context = SpawnContext.of(PatternType.EVENT_DRIVEN, patternId, "subscriber")
            .with("subscriber_event_types", String.join(",", subscriber.eventTypes()));
        return factory.spawn(subscriber.spec(), context);
    }

    private static String eventPrompt(Event event) {
        return "Event received:"
            + "\nType: " + event.type()
            + "\nPayload: " + event.payload()
            + "\nTimestamp: " + event.timestamp()
            + "\n\nHandle this event according to your role.";
    }

    public String patternId() {
        return patternId;
    }
}
