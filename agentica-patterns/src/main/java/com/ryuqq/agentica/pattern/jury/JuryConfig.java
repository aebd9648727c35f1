package com.ryuqq.agentica.pattern.jury;

import com.ryuqq.agentica.core.consensus.Consensus;
import com.ryuqq.agentica.core.consensus.ConsensusMode;

import java.util.List;
import java.util.Set;

/**
 * Jury 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>numJurors: 배심원 수 (1 이상)</li>
 *   <li>mode, threshold: 합의 규칙 (THRESHOLD 모드는 [0, 1] 임계값 필수)</li>
 *   <li>premise: 공통 premise (premises가 없을 때 사용)</li>
 *   <li>premises: 배심원별 premise (null 허용, 길이 = numJurors)</li>
 *   <li>weights: 배심원별 가중치 (null 허용, 길이 = numJurors, 유한한 0 이상의 값)</li>
 *   <li>allowPartial: 일부 배심원 실패 허용 (기본 false)</li>
 *   <li>minJurors: partial 모드 최소 성공 배심원 수 (기본 numJurors)</li>
 *   <li>debug: 마지막 투표 목록 보관 여부</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 * @param numJurors 배심원 수
 * @param mode 합의 규칙
 * @param threshold THRESHOLD 모드 임계값
 * @param premise 공통 premise
 * @param premises 배심원별 premise
 * @param weights 배심원별 가중치
 * @param allowPartial partial 모드 여부
 * @param minJurors 최소 성공 배심원 수
 * @param debug 투표 보관 여부
 * @param model 모델 식별자 (null 허용)
 * @param tools 도구 집합
 */
public record JuryConfig(
    int numJurors,
    ConsensusMode mode,
    Double threshold,
    String premise,
    List<String> premises,
    List<Double> weights,
    boolean allowPartial,
    int minJurors,
    boolean debug,
    String model,
    Set<String> tools
) {

    public static final String DEFAULT_PREMISE = "You are an expert evaluator. Provide your honest assessment.";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JuryConfig {
        if (numJurors < 1) {
            throw new IllegalArgumentException("numJurors must be at least 1 (current: " + numJurors + ")");
        }
        Consensus.validate(mode, threshold);

        if (premise == null || premise.isBlank()) {
            throw new IllegalArgumentException("premise cannot be null or blank");
        }
        if (premises != null) {
            if (premises.size() != numJurors) {
                throw new IllegalArgumentException(
                    "premises length must match numJurors (numJurors: " + numJurors + ", premises: " + premises.size() + ")");
            }
            for (int i = 0; i < premises.size(); i++) {
                if (premises.get(i) == null || premises.get(i).isBlank()) {
                    throw new IllegalArgumentException("premise cannot be null or blank (index: " + i + ")");
                }
            }
            premises = List.copyOf(premises);
        }
        if (weights != null) {
            if (weights.size() != numJurors) {
                throw new IllegalArgumentException(
                    "weights length must match numJurors (numJurors: " + numJurors + ", weights: " + weights.size() + ")");
            }
            for (int i = 0; i < weights.size(); i++) {
                Double weight = weights.get(i);
                if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0.0) {
                    throw new IllegalArgumentException(
                        "weight must be a finite non-negative number (index: " + i + ", current: " + weight + ")");
                }
            }
            weights = List.copyOf(weights);
        }
        if (minJurors < 1 || minJurors > numJurors) {
            throw new IllegalArgumentException(
                "minJurors must be between 1 and numJurors (current: " + minJurors + ", numJurors: " + numJurors + ")");
        }
        tools = tools == null ? Set.of() : Set.copyOf(tools);
    }

    /**
     * 기본값으로 설정 생성 (MAJORITY, 기본 premise, 가중치 없음, strict).
     */
    public static JuryConfig of(int numJurors) {
        return new JuryConfig(numJurors, ConsensusMode.MAJORITY, null, DEFAULT_PREMISE, null, null,
            false, numJurors, false, null, Set.of());
    }

    public JuryConfig withConsensus(ConsensusMode mode, Double threshold) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    public JuryConfig withPremise(String premise) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    public JuryConfig withPremises(List<String> premises) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    public JuryConfig withWeights(List<Double> weights) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    /**
     * partial 모드 활성화.
     *
     * @param minJurors 최소 성공 배심원 수
     */
    public JuryConfig withPartial(int minJurors) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, true, minJurors, debug, model, tools);
    }

    public JuryConfig withDebug(boolean debug) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    public JuryConfig withModel(String model) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    public JuryConfig withTools(Set<String> tools) {
        return new JuryConfig(numJurors, mode, threshold, premise, premises, weights, allowPartial, minJurors, debug, model, tools);
    }

    /**
     * 배심원 i의 premise.
     */
    public String premiseFor(int index) {
        return premises != null ? premises.get(index) : premise;
    }

    /**
     * 배심원 i의 가중치 (가중치가 없으면 1.0).
     */
    public double weightFor(int index) {
        return weights != null ? weights.get(index) : 1.0;
    }

    Consensus consensus() {
        return new Consensus(mode, threshold);
    }
}
