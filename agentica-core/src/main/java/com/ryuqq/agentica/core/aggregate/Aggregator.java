package com.ryuqq.agentica.core.aggregate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 에이전트 출력 집계기.
 *
 * <p>null 입력은 먼저 걸러지며, 남은 입력이 하나면 그대로 반환합니다.</p>
 *
 * <p><strong>모드별 동작:</strong></p>
 * <ul>
 *   <li>MERGE: 모두 {@link Map}이면 왼쪽부터 얕은 병합(뒤가 우선),
 *       모두 {@link List}이면 이어붙이기(deduplicate면 처음 등장 순서로 중복 제거),
 *       그 외 조합은 {@link AggregationException}</li>
 *   <li>CONCAT: {@code String.valueOf}로 변환 후 separator로 연결.
 *       deduplicate면 공백 기준 토큰 중복을 제거하고 공백 하나로 다시 연결</li>
 *   <li>BEST: 모두 숫자 {@code score}를 가진 Map이어야 함.
 *       최고 점수 항목의 {@code result}(없으면 항목 전체)를 반환, 동률이면 먼저 등장한 항목</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Aggregator aggregator = new Aggregator(AggregateMode.CONCAT, "\n\n", false);
 * Object combined = aggregator.aggregate(List.of("first", "second"));
 * </pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Aggregator {

    public static final String DEFAULT_SEPARATOR = " ";

    private static final String SCORE = "score";
    private static final String RESULT = "result";

    private final AggregateMode mode;
    private final String separator;
    private final boolean deduplicate;

    /**
     * 기본 구분자(공백), 중복 제거 없이 생성.
     *
     * @param mode 집계 방식
     */
    public Aggregator(AggregateMode mode) {
        this(mode, DEFAULT_SEPARATOR, false);
    }

    /**
     * @param mode 집계 방식
     * @param separator CONCAT 구분자 (null이면 공백)
     * @param deduplicate 중복 제거 여부 (MERGE 리스트, CONCAT 토큰)
     * @throws IllegalArgumentException mode가 null인 경우
     */
    public Aggregator(AggregateMode mode, String separator, boolean deduplicate) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        this.mode = mode;
        this.separator = separator != null ? separator : DEFAULT_SEPARATOR;
        this.deduplicate = deduplicate;
    }

    public static Aggregator merge() {
        return new Aggregator(AggregateMode.MERGE);
    }

    public static Aggregator concat(String separator) {
        return new Aggregator(AggregateMode.CONCAT, separator, false);
    }

    public static Aggregator best() {
        return new Aggregator(AggregateMode.BEST);
    }

    public AggregateMode mode() {
        return mode;
    }

    public String separator() {
        return separator;
    }

    public boolean deduplicate() {
        return deduplicate;
    }

    /**
     * 집계.
     *
     * @param results 에이전트 출력 리스트 (null 항목 허용)
     * @return 집계 결과
     * @throws IllegalArgumentException results가 null/빈 리스트이거나 모든 항목이 null인 경우
     * @throws AggregationException 입력 형태가 모드와 맞지 않는 경우
     */
    public Object aggregate(List<?> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("results cannot be null or empty");
        }
        List<Object> present = results.stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        if (present.isEmpty()) {
            throw new IllegalArgumentException("results contain only null values (size: " + results.size() + ")");
        }
        if (present.size() == 1) {
            return present.get(0);
        }

        switch (mode) {
            case MERGE:
                return merge(present);
            case CONCAT:
                return concat(present);
            case BEST:
                return best(present);
            default:
                throw new IllegalStateException("Unsupported mode: " + mode);
        }
    }

    private Object merge(List<Object> present) {
        if (present.stream().allMatch(Map.class::isInstance)) {
            Map<Object, Object> merged = new LinkedHashMap<>();
            for (Object result : present) {
                merged.putAll((Map<?, ?>) result);
            }
            return merged;
        }
        if (present.stream().allMatch(List.class::isInstance)) {
            List<Object> combined = new ArrayList<>();
            for (Object result : present) {
                combined.addAll((List<?>) result);
            }
            return deduplicate ? new ArrayList<>(new LinkedHashSet<>(combined)) : combined;
        }
        throw new AggregationException(mode, typeNames(present),
            "all results must be mappings or all must be sequences");
    }

    private String concat(List<Object> present) {
        if (deduplicate) {
            Set<String> tokens = new LinkedHashSet<>();
            for (Object result : present) {
                tokens.addAll(Arrays.asList(String.valueOf(result).trim().split("\\s+")));
            }
            tokens.remove("");
            return String.join(" ", tokens);
        }
        return present.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(separator));
    }

    private Object best(List<Object> present) {
        Map<?, ?> best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Object result : present) {
            if (!(result instanceof Map<?, ?> candidate)) {
                throw new AggregationException(mode, typeNames(present), "every result must be a mapping");
            }
            if (!(candidate.get(SCORE) instanceof Number score)) {
                throw new AggregationException(mode, typeNames(present),
                    "every result must carry a numeric '" + SCORE + "' field");
            }
            if (best == null || score.doubleValue() > bestScore) {
                best = candidate;
                bestScore = score.doubleValue();
            }
        }
        return best.containsKey(RESULT) ? best.get(RESULT) : best;
    }

    private static List<String> typeNames(List<Object> present) {
        return present.stream()
            .map(result -> result.getClass().getSimpleName())
            .collect(Collectors.toList());
    }
}
