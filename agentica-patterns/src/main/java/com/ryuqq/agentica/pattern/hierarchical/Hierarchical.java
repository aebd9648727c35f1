package com.ryuqq.agentica.pattern.hierarchical;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.concurrent.TaskGroup;
import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.exception.UnknownRouteException;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import com.ryuqq.agentica.pattern.support.PartialResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Hierarchical 패턴: coordinator가 과제를 분해하고 specialist들이 병렬 처리한 뒤 coordinator가 종합합니다.
 *
 * <p><strong>3단계 실행:</strong></p>
 * <ol>
 *   <li>분해: coordinator가 {@code {specialist, task}} 리스트 반환.
 *       빈 리스트면 coordinator가 과제에 직접 답하고 종료</li>
 *   <li>위임: 모든 항목의 specialist 이름을 먼저 검증한 뒤 {@link TaskGroup}으로 동시 실행</li>
 *   <li>종합: specialist 결과를 집계하여 coordinator에게 최종 답변 요청</li>
 * </ol>
 *
 * <p>coordinator와 specialist 핸들은 처음 사용할 때 생성되어 인스턴스 수명 동안 재사용됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Hierarchical {

    private static final Logger log = LoggerFactory.getLogger(Hierarchical.class);

    private final HierarchicalConfig config;
    private final AgentFactory factory;
    private final TaskGroup taskGroup;
    private final String patternId;

    private final Map<String, AgentHandle> specialistHandles = new HashMap<>();
    private AgentHandle coordinator;

    public Hierarchical(HierarchicalConfig config, AgentFactory factory) {
        this(config, factory, TaskGroup.shared());
    }

    public Hierarchical(HierarchicalConfig config, AgentFactory factory, TaskGroup taskGroup) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (taskGroup == null) {
            throw new IllegalArgumentException("taskGroup cannot be null");
        }
        this.config = config;
        this.factory = factory;
        this.taskGroup = taskGroup;
        this.patternId = PatternIds.newId();
    }

    public String execute(String task) {
        return execute(task, ResultShape.TEXT);
    }

    /**
     * 과제 실행.
     *
     * @param task 과제
     * @param shape 최종 답변 형태
     * @param <T> 결과 타입
     * @return coordinator의 최종 답변
     * @throws UnknownRouteException 분해 결과에 선언되지 않은 specialist가 있는 경우 (specialist 실행 전)
     * @throws AgentInvocationException 분해 결과 항목 형태가 잘못된 경우
     */
    public <T> T execute(String task, ResultShape<T> shape) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }

        AgentHandle coordinatorHandle = coordinator();
        List<Object> decomposition = coordinatorHandle.invoke(ResultShape.SEQUENCE, decomposePrompt(task));
        if (decomposition == null || decomposition.isEmpty()) {
            log.debug("Hierarchical {} answering directly, no subtasks", patternId);
            return coordinatorHandle.invoke(shape, task);
        }

        List<Subtask> subtasks = parse(decomposition, coordinatorHandle);
        List<Callable<String>> calls = new ArrayList<>(subtasks.size());
        for (Subtask subtask : subtasks) {
            AgentHandle specialist = specialist(subtask.specialist(), coordinatorHandle);
            calls.add(() -> specialist.invoke(ResultShape.TEXT, subtask.task()));
        }
        log.debug("Hierarchical {} delegating {} subtask(s)", patternId, calls.size());

        List<String> results;
        if (config.failFast()) {
            results = new ArrayList<>(taskGroup.runFailFast(calls));
            results.removeIf(result -> result == null);
        } else {
            results = PartialResults.successes(taskGroup.runPartial(calls), "specialists");
        }

        Object aggregated = config.aggregator().aggregate(results);
        return coordinatorHandle.invoke(shape, synthesisPrompt(task, String.valueOf(aggregated)));
    }

    private List<Subtask> parse(List<Object> decomposition, AgentHandle coordinatorHandle) {
        List<Subtask> subtasks = new ArrayList<>(decomposition.size());
        for (int i = 0; i < decomposition.size(); i++) {
            Subtask subtask;
            try {
                subtask = Subtask.from(decomposition.get(i));
            } catch (IllegalArgumentException e) {
                throw new AgentInvocationException(coordinatorHandle.agentId(),
                    "Invalid decomposition entry (index: " + i + "): " + e.getMessage(), e);
            }
            if (!config.specialists().containsKey(subtask.specialist())) {
                throw new UnknownRouteException("Unknown specialist: " + subtask.specialist(),
                    subtask.specialist(), List.copyOf(config.specialists().keySet()));
            }
            subtasks.add(subtask);
        }
        return subtasks;
    }

    private synchronized AgentHandle coordinator() {
        if (coordinator == null) {
            SpawnContext context = SpawnContext.of(PatternType.HIERARCHICAL, patternId, "coordinator")
                .with("hierarchy_level", 0);
            coordinator = factory.spawn(config.coordinator(), context);
        }
        return coordinator;
    }

    private synchronized AgentHandle specialist(String name, AgentHandle coordinatorHandle) {
        AgentHandle handle = specialistHandles.get(name);
        if (handle == null) {
            SpawnContext context = SpawnContext.of(PatternType.HIERARCHICAL, patternId, "specialist")
                .with("hierarchy_level", 1)
                .with("coordinator_id", coordinatorHandle.agentId())
                .with("specialist", name);
            handle = factory.spawn(config.specialists().get(name), context);
            specialistHandles.put(name, handle);
        }
        return handle;
    }

    private String decomposePrompt(String task) {
        return "Decompose this task into subtasks for specialists.\n"
            + "Task: " + task + "\n"
            + "Available specialists: " + String.join(", ", config.specialists().keySet()) + "\n"
            + "Return a list of dicts with keys: specialist, task\n"
            + "Example: [{\"specialist\": \"researcher\", \"task\": \"Find papers\"}, ...]\n"
            + "If the task is simple enough to answer directly, return an empty list.";
    }

    private static String synthesisPrompt(String task, String aggregated) {
        return "Synthesize a final answer based on specialist results.\n"
            + "Original task: " + task + "\n"
            + "Specialist results:\n" + aggregated + "\n"
            + "Provide a comprehensive final answer.";
    }

    public String patternId() {
        return patternId;
    }
}
