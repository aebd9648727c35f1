package com.ryuqq.agentica.pattern.adversarial;

/**
 * 토론 이력의 한 발언.
 *
 * @param round 라운드 (1부터)
 * @param role 발언자 역할
 * @param content 발언 내용
 */
public record DebateTurn(int round, DebateRole role, String content) {
}
