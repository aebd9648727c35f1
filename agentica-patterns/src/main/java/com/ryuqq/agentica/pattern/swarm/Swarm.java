package com.ryuqq.agentica.pattern.swarm;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.aggregate.Aggregator;
import com.ryuqq.agentica.core.concurrent.TaskGroup;
import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import com.ryuqq.agentica.pattern.support.PartialResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Swarm 패턴: 여러 관점의 에이전트에게 같은 질의를 동시에 던지고 결과를 집계합니다.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>관점(perspective)마다 에이전트 1개 생성</li>
 *   <li>모든 에이전트를 {@link TaskGroup}으로 동시 호출 (질의 원문 그대로)</li>
 *   <li>null 결과와 (partial 모드에서) 실패한 관점을 제외</li>
 *   <li>{@link Aggregator}로 집계</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Swarm swarm = new Swarm(SwarmConfig.of(List.of(
 *     "You are a security expert.",
 *     "You are a performance expert.")), factory);
 * Object merged = swarm.execute("Review this design");
 * }</pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Swarm {

    private static final Logger log = LoggerFactory.getLogger(Swarm.class);

    private final SwarmConfig config;
    private final AgentFactory factory;
    private final TaskGroup taskGroup;
    private final Aggregator aggregator;
    private final String patternId;

    public Swarm(SwarmConfig config, AgentFactory factory) {
        this(config, factory, TaskGroup.shared());
    }

    /**
     * @param config Swarm 설정
     * @param factory 에이전트 팩토리
     * @param taskGroup 동시 실행 그룹
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Swarm(SwarmConfig config, AgentFactory factory, TaskGroup taskGroup) {
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
        this.aggregator = config.aggregator();
        this.patternId = PatternIds.newId();
    }

    /**
     * 집계 방식의 기본 결과 형태로 실행.
     *
     * @param query 질의
     * @return 집계 결과
     */
    public Object execute(String query) {
        return execute(query, config.defaultShape());
    }

    /**
     * 지정한 결과 형태로 실행.
     *
     * @param query 질의
     * @param shape 에이전트별 기대 결과 형태
     * @param <T> 에이전트 결과 타입
     * @return 집계 결과 (입력이 하나뿐이면 그 값 그대로)
     * @throws IllegalArgumentException 모든 결과가 null인 경우 (Aggregator)
     * @throws com.ryuqq.agentica.core.concurrent.TaskGroupException fail-fast 모드에서 에이전트가 실패한 경우
     * @throws com.ryuqq.agentica.core.exception.InsufficientParticipantsException partial 모드에서 모두 실패한 경우
     */
    public <T> Object execute(String query, ResultShape<T> shape) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }

        List<String> perspectives = config.perspectives();
        List<Callable<T>> tasks = new ArrayList<>(perspectives.size());
        for (int i = 0; i < perspectives.size(); i++) {
            AgentHandle agent = spawn(perspectives.get(i), i);
            tasks.add(() -> agent.invoke(shape, query));
        }
        log.debug("Swarm {} dispatching query to {} perspective(s)", patternId, tasks.size());

        List<T> results;
        if (config.failFast()) {
            results = new ArrayList<>(taskGroup.runFailFast(tasks));
            results.removeIf(result -> result == null);
        } else {
            results = PartialResults.successes(taskGroup.runPartial(tasks), "swarm agents");
        }

        Object aggregated = aggregator.aggregate(results);
        log.debug("Swarm {} aggregated {} result(s) with {}", patternId, results.size(), aggregator.mode());
        return aggregated;
    }

    private AgentHandle spawn(String perspective, int index) {
        AgentSpec spec = new AgentSpec(perspective, config.model(), config.tools());
        SpawnContext context = SpawnContext.of(PatternType.SWARM, patternId, "worker")
            .with("perspective_index", index)
            .with("total_perspectives", config.perspectives().size());
        return factory.spawn(spec, context);
    }

    public String patternId() {
        return patternId;
    }

    public SwarmConfig config() {
        return config;
    }
}
