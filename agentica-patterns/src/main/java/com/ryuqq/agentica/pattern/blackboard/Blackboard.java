package com.ryuqq.agentica.pattern.blackboard;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Blackboard 패턴: specialist들이 공유 상태에 순서대로 기여하고 controller가 완료를 판단합니다.
 *
 * <p><strong>반복 (최대 maxIterations):</strong></p>
 * <ol>
 *   <li>specialist를 선언 순서대로 실행 (같은 반복 안에서 앞선 specialist의 쓰기를 읽을 수 있음)</li>
 *   <li>각 specialist의 결과 중 자신이 선언한 키만 기록</li>
 *   <li>controller에게 완료 여부 질의. 승인되면 즉시 종료</li>
 * </ol>
 *
 * <p>controller가 완료를 거부하며 남긴 feedback은 다음 반복의 specialist 프롬프트에 포함됩니다.
 * 상태는 {@code query} 키에 질의를 담아 시작합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Blackboard {

    private static final Logger log = LoggerFactory.getLogger(Blackboard.class);

    static final String QUERY_KEY = "query";

    private final BlackboardConfig config;
    private final AgentFactory factory;
    private final String patternId;

    private final Map<Integer, AgentHandle> specialistHandles = new HashMap<>();
    private AgentHandle controller;

    public Blackboard(BlackboardConfig config, AgentFactory factory) {
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
     * 문제 해결.
     *
     * @param query 문제
     * @return 최종 상태, 반복 수, 완료 여부
     */
    public BlackboardResult solve(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }

        BlackboardState state = new BlackboardState();
        state.set(QUERY_KEY, query, QUERY_KEY);
        String feedback = null;

        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            List<Specialist> specialists = config.specialists();
            for (int i = 0; i < specialists.size(); i++) {
                Specialist specialist = specialists.get(i);
                Map<String, Object> contribution = specialist(i).invoke(ResultShape.MAPPING,
                    specialistPrompt(query, specialist, state, feedback));
                write(state, specialist, contribution);
            }

            Map<String, Object> completion = controller().invoke(ResultShape.MAPPING, controllerPrompt(query, state));
            if (completion != null && isComplete(completion.get("complete"))) {
                log.info("Blackboard {} completed after {} iteration(s)", patternId, iteration);
                return new BlackboardResult(state, iteration, true);
            }
            Object next = completion == null ? null : completion.get("feedback");
            feedback = next == null ? null : next.toString();
            log.debug("Blackboard {} iteration {} not complete (feedback: {})", patternId, iteration, feedback);
        }

        log.info("Blackboard {} stopped after {} iteration(s) without completion", patternId, config.maxIterations());
        return new BlackboardResult(state, config.maxIterations(), false);
    }

    /**
     * controller 응답의 {@code complete} 값 판정.
     *
     * <p>{@code true}, 0이 아닌 숫자, 대소문자 무관 {@code "true"} 문자열을 완료로 봅니다.
     * 그 밖의 문자열(예: {@code "false"}, {@code "yes"})과 null은 미완료입니다.</p>
     */
    static boolean isComplete(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        return false;
    }

    private static void write(BlackboardState state, Specialist specialist, Map<String, Object> contribution) {
        if (contribution == null) {
            return;
        }
        for (String key : specialist.writesTo()) {
            if (contribution.containsKey(key)) {
                state.set(key, contribution.get(key), specialist.spec().premise());
            }
        }
    }

    private static String specialistPrompt(String query, Specialist specialist, BlackboardState state, String feedback) {
        StringBuilder readContext = new StringBuilder();
        for (String key : specialist.readsFrom()) {
            if (state.contains(key)) {
                readContext.append('\n').append(key).append(": ").append(state.get(key));
            }
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("Task: ").append(query);
        prompt.append("\n\nYou are responsible for: ").append(specialist.writesTo());
        if (readContext.length() > 0) {
            prompt.append("\nBased on: ").append(readContext);
        }
        if (feedback != null && !feedback.isBlank()) {
            prompt.append("\n\nController feedback: ").append(feedback);
        }
        prompt.append("\n\nCurrent blackboard state: ").append(state.toMap());
        prompt.append("\n\nProvide your contribution as a dict with keys: ").append(specialist.writesTo());
        return prompt.toString();
    }

    private static String controllerPrompt(String query, BlackboardState state) {
        return "Task: " + query
            + "\n\nCurrent blackboard state: " + state.toMap()
            + "\n\nIs the solution complete and coherent?"
            + "\nReturn a dict with:"
            + "\n- 'complete': True if done, False if more work needed"
            + "\n- 'feedback': Optional guidance for next iteration";
    }

    private synchronized AgentHandle specialist(int index) {
        AgentHandle handle = specialistHandles.get(index);
        if (handle == null) {
            Specialist specialist = config.specialists().get(index);
            SpawnContext context = SpawnContext.of(PatternType.BLACKBOARD, patternId, "specialist")
                .with("writes_to", String.join(",", specialist.writesTo()))
                .with("reads_from", String.join(",", specialist.readsFrom()));
            handle = factory.spawn(specialist.spec(), context);
            specialistHandles.put(index, handle);
        }
        return handle;
    }

    private synchronized AgentHandle controller() {
        if (controller == null) {
            controller = factory.spawn(config.controller(), SpawnContext.of(PatternType.BLACKBOARD, patternId, "controller"));
        }
        return controller;
    }

    public String patternId() {
        return patternId;
    }
}
