package com.ryuqq.agentica.pattern.jury;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.concurrent.TaskGroup;
import com.ryuqq.agentica.core.concurrent.TaskResult;
import com.ryuqq.agentica.core.consensus.Consensus;
import com.ryuqq.agentica.core.exception.InsufficientParticipantsException;
import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Jury 패턴: 독립적인 배심원 에이전트들의 투표를 {@link Consensus}로 결정합니다.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>결정마다 배심원 N명 생성 (배심원별 또는 공통 premise)</li>
 *   <li>{@link TaskGroup}으로 같은 질문을 동시에 투표</li>
 *   <li>가중치와 키 추출 함수를 적용해 합의 결정</li>
 * </ol>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>strict (기본): 배심원 하나라도 실패하면 나머지를 취소하고
 *       {@link com.ryuqq.agentica.core.concurrent.TaskGroupException} 전파</li>
 *   <li>partial: 실패한 배심원을 제외하고 가중치를 성공한 배심원에 맞춰 재정렬.
 *       성공 수가 minJurors 미만이면 {@link InsufficientParticipantsException}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Jury jury = new Jury(JuryConfig.of(3).withWeights(List.of(10.0, 1.0, 1.0)), factory);
 * Boolean verdict = jury.decide(ResultShape.BOOLEAN, "Is this code safe to merge?");
 * }</pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Jury {

    private static final Logger log = LoggerFactory.getLogger(Jury.class);

    private final JuryConfig config;
    private final AgentFactory factory;
    private final TaskGroup taskGroup;
    private final Consensus consensus;
    private final String patternId;

    private volatile List<Object> lastVotes;

    public Jury(JuryConfig config, AgentFactory factory) {
        this(config, factory, TaskGroup.shared());
    }

    public Jury(JuryConfig config, AgentFactory factory, TaskGroup taskGroup) {
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
        this.consensus = config.consensus();
        this.patternId = PatternIds.newId();
    }

    public <T> T decide(ResultShape<T> shape, String question) {
        return decide(shape, question, null);
    }

    /**
     * 배심원 투표로 결정.
     *
     * @param shape 투표 형태
     * @param question 질문
     * @param key 구조화된 투표의 비교 키 추출 함수 (null이면 투표 자체)
     * @param <T> 투표 타입
     * @return 합의된 투표
     * @throws com.ryuqq.agentica.core.consensus.ConsensusNotReachedException 합의 규칙 미충족
     * @throws InsufficientParticipantsException partial 모드에서 성공한 배심원이 minJurors 미만
     * @throws com.ryuqq.agentica.core.concurrent.TaskGroupException strict 모드에서 배심원이 실패한 경우
     */
    public <T> T decide(ResultShape<T> shape, String question, Function<? super T, ?> key) {
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }
        if (question == null) {
            throw new IllegalArgumentException("question cannot be null");
        }

        List<Callable<T>> ballots = new ArrayList<>(config.numJurors());
        for (int i = 0; i < config.numJurors(); i++) {
            AgentHandle juror = spawnJuror(i);
            ballots.add(() -> juror.invoke(shape, question));
        }

        List<T> votes = new ArrayList<>(config.numJurors());
        List<Double> weights = config.weights() != null ? new ArrayList<>() : null;

        if (config.allowPartial()) {
            List<Throwable> failures = new ArrayList<>();
            for (TaskResult<T> result : taskGroup.runPartial(ballots)) {
                if (result.isFailure()) {
                    failures.add(result.failureOrNull());
                    log.warn("Juror {} failed in jury {}", result.index(), patternId, result.failureOrNull());
                    continue;
                }
                votes.add(result.valueOrNull());
                if (weights != null) {
                    weights.add(config.weightFor(result.index()));
                }
            }
            if (votes.size() < config.minJurors()) {
                throw new InsufficientParticipantsException("jurors", votes.size(), config.minJurors(), failures);
            }
        } else {
            votes.addAll(taskGroup.runFailFast(ballots));
            if (weights != null) {
                weights.addAll(config.weights());
            }
        }

        if (config.debug()) {
            lastVotes = Collections.unmodifiableList(new ArrayList<Object>(votes));
        }

        T decision = consensus.decide(votes, weights, key);
        log.info("Jury {} decided {} from {} vote(s) ({})", patternId, decision, votes.size(), consensus);
        return decision;
    }

    private AgentHandle spawnJuror(int index) {
        AgentSpec spec = new AgentSpec(config.premiseFor(index), config.model(), config.tools());
        SpawnContext context = SpawnContext.of(PatternType.JURY, patternId, "juror")
            .with("juror_index", index)
            .with("total_jurors", config.numJurors());
        return factory.spawn(spec, context);
    }

    /**
     * 마지막 결정의 투표 목록 (debug 모드에서만 기록, 그 외에는 null).
     */
    public List<Object> lastVotes() {
        return lastVotes;
    }

    public String patternId() {
        return patternId;
    }

    public JuryConfig config() {
        return config;
    }
}
