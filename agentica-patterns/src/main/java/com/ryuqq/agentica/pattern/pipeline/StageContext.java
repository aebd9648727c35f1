package com.ryuqq.agentica.pattern.pipeline;

/**
 * 파이프라인이 단계에 넘기는 실행 위치 정보.
 *
 * @param patternId 파이프라인 인스턴스 ID
 * @param stageIndex 단계 인덱스 (0부터)
 * @param totalStages 전체 단계 수
 * @author Agentica Team
 * @since 1.0.0
 */
public record StageContext(String patternId, int stageIndex, int totalStages) {

    public StageContext {
        if (patternId == null || patternId.isBlank()) {
            throw new IllegalArgumentException("patternId cannot be null or blank");
        }
        if (totalStages < 1) {
            throw new IllegalArgumentException("totalStages must be at least 1 (current: " + totalStages + ")");
        }
        if (stageIndex < 0 || stageIndex >= totalStages) {
            throw new IllegalArgumentException(
                "stageIndex out of range (current: " + stageIndex + ", totalStages: " + totalStages + ")");
        }
    }
}
