package com.ryuqq.agentica.pattern.blackboard;

/**
 * 블랙보드 실행 결과.
 *
 * @param state 최종 상태
 * @param iterations 실행한 반복 수
 * @param completed controller가 완료를 승인했는지 여부
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record BlackboardResult(BlackboardState state, int iterations, boolean completed) {
}
