package com.ryuqq.agentica.pattern.adversarial;

import com.ryuqq.agentica.core.agent.AgentFactory;
import com.ryuqq.agentica.core.agent.PatternIds;
import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Adversarial 패턴: 찬성 측과 반대 측이 정해진 라운드 동안 논쟁하고 선택적으로 판정자가 결론을 냅니다.
 *
 * <p><strong>라운드 흐름:</strong></p>
 * <ol>
 *   <li>advocate가 입장을 제시 (2라운드부터는 직전 비판을 반영해 보강)</li>
 *   <li>adversary가 그 입장을 비판</li>
 * </ol>
 *
 * <p>advocate와 adversary 핸들은 토론마다 새로 생성되어 모든 라운드에서 재사용되므로
 * 대화 맥락이 라운드 사이에 이어집니다. 판정자 핸들은 인스턴스 수명 동안 재사용됩니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Adversarial {

    private static final Logger log = LoggerFactory.getLogger(Adversarial.class);

    private final AdversarialConfig config;
    private final AgentFactory factory;
    private final String patternId;

    private AgentHandle judge;

    public Adversarial(AdversarialConfig config, AgentFactory factory) {
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
     * 토론 실행 (판정 없음).
     *
     * @param question 토론 주제
     * @return 양측 최종 입장과 발언 이력 (verdict는 null)
     */
    public DebateResult debate(String question) {
        if (question == null) {
            throw new IllegalArgumentException("question cannot be null");
        }

        AgentHandle advocate = spawn(config.advocate(), DebateRole.ADVOCATE.value());
        AgentHandle adversary = spawn(config.adversary(), DebateRole.ADVERSARY.value());

        List<DebateTurn> history = new ArrayList<>(config.maxRounds() * 2);
        String advocatePosition = "";
        String adversaryPosition = "";

        for (int round = 1; round <= config.maxRounds(); round++) {
            String advocatePrompt = round == 1
                ? openingPrompt(question)
                : rebuttalPrompt(question, advocatePosition, adversaryPosition);
            advocatePosition = advocate.invoke(ResultShape.TEXT, advocatePrompt);
            history.add(new DebateTurn(round, DebateRole.ADVOCATE, advocatePosition));

            adversaryPosition = adversary.invoke(ResultShape.TEXT, critiquePrompt(question, advocatePosition));
            history.add(new DebateTurn(round, DebateRole.ADVERSARY, adversaryPosition));
            log.debug("Adversarial {} finished round {}/{}", patternId, round, config.maxRounds());
        }

        return new DebateResult(question, advocatePosition, adversaryPosition, history, null);
    }

    /**
     * 토론 후 판정자가 있으면 판정까지 실행.
     *
     * @param question 토론 주제
     * @return 판정이 포함된 결과 (판정자가 없으면 {@link #debate(String)}와 동일)
     */
    public DebateResult resolve(String question) {
        DebateResult result = debate(question);
        if (!config.hasJudge()) {
            return result;
        }

        String verdict = judge().invoke(ResultShape.TEXT,
            judgePrompt(question, result.advocateFinal(), result.adversaryFinal()));
        log.info("Adversarial {} resolved after {} round(s)", patternId, config.maxRounds());
        return result.withVerdict(verdict);
    }

    private AgentHandle spawn(AgentSpec spec, String role) {
        SpawnContext context = SpawnContext.of(PatternType.ADVERSARIAL, patternId, role)
            .with("round", 1)
            .with("max_rounds", config.maxRounds());
        return factory.spawn(spec, context);
    }

    private synchronized AgentHandle judge() {
        if (judge == null) {
            SpawnContext context = SpawnContext.of(PatternType.ADVERSARIAL, patternId, "judge")
                .with("round", config.maxRounds())
                .with("max_rounds", config.maxRounds());
            judge = factory.spawn(config.judge(), context);
        }
        return judge;
    }

    private static String openingPrompt(String question) {
        return "Question: " + question
            + "\n\nPresent your argument in favor. Be persuasive and thorough.";
    }

    private static String rebuttalPrompt(String question, String previous, String critique) {
        return "Question: " + question
            + "\n\nYour previous argument: " + previous
            + "\n\nAdversary's critique: " + critique
            + "\n\nRefine and strengthen your argument, addressing the critique.";
    }

    private static String critiquePrompt(String question, String argument) {
        return "Question: " + question
            + "\n\nAdvocate's argument: " + argument
            + "\n\nCritique this argument. Find flaws, weaknesses, and counterarguments.";
    }

    private static String judgePrompt(String question, String advocateFinal, String adversaryFinal) {
        return "You are judging a debate on: " + question
            + "\n\nADVOCATE'S POSITION:\n" + advocateFinal
            + "\n\nADVERSARY'S POSITION:\n" + adversaryFinal
            + "\n\nEvaluate both positions and decide which is stronger."
            + "\nProvide your verdict with reasoning.";
    }

    public String patternId() {
        return patternId;
    }
}
