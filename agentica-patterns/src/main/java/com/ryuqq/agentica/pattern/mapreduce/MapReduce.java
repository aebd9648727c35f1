package com.ryuqq.agentica.pattern.mapreduce;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.concurrent.TaskGroup;
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
 * MapReduce 패턴: 청크를 mapper들에게 라운드로빈으로 나눠 병렬 처리하고 reducer가 종합합니다.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>청크 i를 슬롯 {@code i % numMappers}에 배정</li>
 *   <li>비어 있지 않은 슬롯마다 mapper 생성 후 동시 호출</li>
 *   <li>null이 아닌 mapper 결과를 reducer 프롬프트에 이어 붙여 1회 호출</li>
 * </ol>
 *
 * <p>reducer는 인스턴스 수명 동안 한 번만 생성됩니다. mapper는 실행마다 새로 생성됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class MapReduce {

    private static final Logger log = LoggerFactory.getLogger(MapReduce.class);

    private final MapReduceConfig config;
    private final AgentFactory factory;
    private final TaskGroup taskGroup;
    private final String patternId;

    private AgentHandle reducer;

    public MapReduce(MapReduceConfig config, AgentFactory factory) {
        this(config, factory, TaskGroup.shared());
    }

    public MapReduce(MapReduceConfig config, AgentFactory factory, TaskGroup taskGroup) {
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

    public String execute(String query, List<String> chunks) {
        return execute(query, chunks, ResultShape.TEXT);
    }

    /**
     * MapReduce 실행.
     *
     * @param query 원래 과제
     * @param chunks 분배할 청크 (비어 있으면 mapper 없이 reducer만 호출)
     * @param shape reducer 결과 형태
     * @param <T> 결과 타입
     * @return reducer 결과
     * @throws com.ryuqq.agentica.core.concurrent.TaskGroupException fail-fast 모드에서 mapper가 실패한 경우
     * @throws com.ryuqq.agentica.core.exception.InsufficientParticipantsException partial 모드에서 모든 mapper가 실패한 경우
     */
    public <T> T execute(String query, List<String> chunks, ResultShape<T> shape) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }

        List<List<String>> slots = distributeChunks(chunks);
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            List<String> assigned = slots.get(i);
            if (assigned.isEmpty()) {
                continue;
            }
            AgentHandle mapper = spawnMapper(i);
            String prompt = mapperPrompt(query, assigned);
            tasks.add(() -> mapper.invoke(ResultShape.TEXT, prompt));
        }
        log.debug("MapReduce {} distributed {} chunk(s) to {} mapper(s)", patternId, chunks.size(), tasks.size());

        List<String> outputs = collect(tasks);
        return reducer().invoke(shape, reducerPrompt(query, outputs));
    }

    /**
     * 청크를 라운드로빈으로 mapper 슬롯에 분배.
     *
     * @param chunks 청크 리스트
     * @return 길이 numMappers의 슬롯 리스트 (빈 슬롯 포함)
     * @throws IllegalArgumentException chunks가 null인 경우
     */
    public List<List<String>> distributeChunks(List<String> chunks) {
        if (chunks == null) {
            throw new IllegalArgumentException("chunks cannot be null");
        }
        List<List<String>> slots = new ArrayList<>(config.numMappers());
        for (int i = 0; i < config.numMappers(); i++) {
            slots.add(new ArrayList<>());
        }
        for (int i = 0; i < chunks.size(); i++) {
            slots.get(i % config.numMappers()).add(chunks.get(i));
        }
        return slots;
    }

    private List<String> collect(List<Callable<String>> tasks) {
        if (config.failFast()) {
            List<String> outputs = new ArrayList<>(taskGroup.runFailFast(tasks));
            outputs.removeIf(output -> output == null);
            return outputs;
        }
        return PartialResults.successes(taskGroup.runPartial(tasks), "mappers");
    }

    private AgentHandle spawnMapper(int index) {
        SpawnContext context = SpawnContext.of(PatternType.MAP_REDUCE, patternId, "mapper")
            .with("mapper_index", index)
            .with("total_mappers", config.numMappers());
        return factory.spawn(config.mapper(), context);
    }

    private synchronized AgentHandle reducer() {
        if (reducer == null) {
            reducer = factory.spawn(config.reducer(), SpawnContext.of(PatternType.MAP_REDUCE, patternId, "reducer"));
        }
        return reducer;
    }

    private static String mapperPrompt(String query, List<String> assigned) {
        return query
            + "\n\nYour assigned chunks:\n" + String.join("\n", assigned)
            + "\n\nProcess these chunks and return your analysis.";
    }

    private static String reducerPrompt(String query, List<String> outputs) {
        return "Original task: " + query
            + "\n\nResults from " + outputs.size() + " mappers:\n" + String.join("\n\n---\n\n", outputs)
            + "\n\nSynthesize these results into a comprehensive final answer.";
    }

    public String patternId() {
        return patternId;
    }
}
