package com.ryuqq.agentica.pattern.adversarial;

import java.util.List;

/**
 * 토론 결과.
 *
 * @param question 토론 주제
 * @param advocateFinal 찬성 측 최종 입장
 * @param adversaryFinal 반대 측 최종 입장
 * @param history 라운드별 발언 이력 (시간 순서)
 * @param verdict 판정 (판정자가 없거나 {@code debate}만 실행한 경우 null)
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record DebateResult(
    String question,
    String advocateFinal,
    String adversaryFinal,
    List<DebateTurn> history,
    String verdict
) {

    public DebateResult {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean hasVerdict() {
        return verdict != null;
    }

    DebateResult withVerdict(String verdict) {
        return new DebateResult(question, advocateFinal, adversaryFinal, history, verdict);
    }
}
