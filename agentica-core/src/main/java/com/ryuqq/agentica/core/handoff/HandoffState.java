package com.ryuqq.agentica.core.handoff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 순차 단계 사이에서 전달되는 구조화된 상태.
 *
 * <p>컨텍스트, 다음 지시, 산출물(artifacts), 메타데이터, 인계 이력을 담습니다.
 * 하나의 인스턴스는 파이프라인을 따라 선형으로 흐르며, 동시에 실행되는 분기 사이에서
 * 공유되지 않습니다. 분기를 합칠 때는 {@link #merge(HandoffState)}로 새 상태를 만듭니다.</p>
 *
 * <p><strong>병합 규칙:</strong></p>
 * <ul>
 *   <li>context, nextInstruction: 나중 상태(other)의 값</li>
 *   <li>artifacts, metadata: 합집합 (키 충돌 시 나중 상태 우선)</li>
 *   <li>인계 이력: 이어붙이기</li>
 * </ul>
 *
 * <p>스레드 안전하지 않습니다. 한 시점에 하나의 단계만 상태를 변경해야 합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class HandoffState {

    private static final String CONTEXT = "context";
    private static final String NEXT_INSTRUCTION = "next_instruction";
    private static final String ARTIFACTS = "artifacts";
    private static final String METADATA = "metadata";
    private static final String HANDOFF_CHAIN = "handoff_chain";
    private static final String FROM = "from";
    private static final String TO = "to";

    private String context;
    private String nextInstruction;
    private Map<String, Object> artifacts;
    private final Map<String, Object> metadata;
    private final List<Handoff> handoffChain;

    /**
     * @param context 현재 상황/과제 컨텍스트 (null이면 빈 문자열)
     * @param nextInstruction 다음 에이전트가 할 일 (필수)
     * @throws IllegalArgumentException nextInstruction이 null인 경우
     */
    public HandoffState(String context, String nextInstruction) {
        this(context, nextInstruction, null, null, null);
    }

    public HandoffState(String context, String nextInstruction,
                        Map<String, Object> artifacts, Map<String, Object> metadata) {
        this(context, nextInstruction, artifacts, metadata, null);
    }

    private HandoffState(String context, String nextInstruction, Map<String, Object> artifacts,
                         Map<String, Object> metadata, List<Handoff> handoffChain) {
        if (nextInstruction == null) {
            throw new IllegalArgumentException("nextInstruction cannot be null");
        }
        this.context = context != null ? context : "";
        this.nextInstruction = nextInstruction;
        this.artifacts = artifacts != null ? new LinkedHashMap<>(artifacts) : new LinkedHashMap<>();
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.handoffChain = handoffChain != null ? new ArrayList<>(handoffChain) : new ArrayList<>();
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context != null ? context : "";
    }

    public String getNextInstruction() {
        return nextInstruction;
    }

    /**
     * 다음 지시 변경.
     *
     * @param instruction 새 지시
     * @throws IllegalArgumentException instruction이 null인 경우
     */
    public void updateInstruction(String instruction) {
        if (instruction == null) {
            throw new IllegalArgumentException("instruction cannot be null");
        }
        this.nextInstruction = instruction;
    }

    public void addArtifact(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("artifact key cannot be null");
        }
        artifacts.put(key, value);
    }

    /**
     * 산출물 조회.
     *
     * @param key 산출물 키
     * @return 값 또는 null
     */
    public Object getArtifact(String key) {
        return artifacts.get(key);
    }

    public boolean hasArtifact(String key) {
        return artifacts.containsKey(key);
    }

    /**
     * 산출물 전체 (읽기 전용 뷰).
     *
     * @return 불변 뷰
     */
    public Map<String, Object> getArtifacts() {
        return Collections.unmodifiableMap(artifacts);
    }

    /**
     * 산출물만 비우고 나머지 상태는 유지.
     */
    public void clearArtifacts() {
        this.artifacts = new LinkedHashMap<>();
    }

    public void putMetadata(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("metadata key cannot be null");
        }
        metadata.put(key, value);
    }

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * 인계 기록 추가.
     *
     * @param from 인계한 쪽
     * @param to 인계받은 쪽
     */
    public void recordHandoff(String from, String to) {
        handoffChain.add(new Handoff(from, to));
    }

    /**
     * 인계 이력 복사본.
     *
     * @return 호출자가 수정해도 상태에 영향이 없는 리스트
     */
    public List<Handoff> getHandoffChain() {
        return new ArrayList<>(handoffChain);
    }

    /**
     * 두 상태를 병합한 새 상태 생성.
     *
     * <p>this와 other는 변경되지 않습니다.</p>
     *
     * @param other 나중 상태
     * @return 병합된 새 상태
     */
    public HandoffState merge(HandoffState other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        Map<String, Object> mergedArtifacts = new LinkedHashMap<>(artifacts);
        mergedArtifacts.putAll(other.artifacts);
        Map<String, Object> mergedMetadata = new LinkedHashMap<>(metadata);
        mergedMetadata.putAll(other.metadata);
        List<Handoff> mergedChain = new ArrayList<>(handoffChain);
        mergedChain.addAll(other.handoffChain);

        return new HandoffState(other.context, other.nextInstruction, mergedArtifacts, mergedMetadata, mergedChain);
    }

    /**
     * 얕은 복사.
     *
     * <p>컬렉션은 새로 만들지만 산출물 값 객체는 공유합니다.</p>
     *
     * @return 복사본
     */
    public HandoffState copy() {
        return new HandoffState(context, nextInstruction, artifacts, metadata, handoffChain);
    }

    /**
     * 매핑 표현으로 변환.
     *
     * <p>키: context, next_instruction, artifacts, metadata, handoff_chain(from/to 매핑 리스트).</p>
     *
     * @return 새 LinkedHashMap
     */
    public Map<String, Object> toMap() {
        List<Map<String, String>> chain = new ArrayList<>(handoffChain.size());
        for (Handoff handoff : handoffChain) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put(FROM, handoff.from());
            entry.put(TO, handoff.to());
            chain.add(entry);
        }

        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CONTEXT, context);
        map.put(NEXT_INSTRUCTION, nextInstruction);
        map.put(ARTIFACTS, new LinkedHashMap<>(artifacts));
        map.put(METADATA, new LinkedHashMap<>(metadata));
        map.put(HANDOFF_CHAIN, chain);
        return map;
    }

    /**
     * 매핑 표현에서 복원.
     *
     * @param map {@link #toMap()} 형식의 매핑
     * @return 복원된 상태
     * @throws IllegalArgumentException 필수 키가 없거나 타입이 맞지 않는 경우
     */
    public static HandoffState fromMap(Map<String, ?> map) {
        if (map == null) {
            throw new IllegalArgumentException("map cannot be null");
        }
        if (!map.containsKey(CONTEXT) || !map.containsKey(NEXT_INSTRUCTION)) {
            throw new IllegalArgumentException("map must contain '" + CONTEXT + "' and '" + NEXT_INSTRUCTION + "'");
        }

        List<Handoff> handoffs = new ArrayList<>();
        Object chain = map.get(HANDOFF_CHAIN);
        if (chain instanceof List<?> entries) {
            for (Object entry : entries) {
                if (!(entry instanceof Map<?, ?> handoff)) {
                    throw new IllegalArgumentException("handoff_chain entries must be mappings");
                }
                handoffs.add(new Handoff(String.valueOf(handoff.get(FROM)), String.valueOf(handoff.get(TO))));
            }
        } else if (chain != null) {
            throw new IllegalArgumentException("handoff_chain must be a sequence (current: " + chain.getClass().getName() + ")");
        }

        return new HandoffState(
            text(map.get(CONTEXT), CONTEXT),
            text(map.get(NEXT_INSTRUCTION), NEXT_INSTRUCTION),
            mapping(map.get(ARTIFACTS), ARTIFACTS),
            mapping(map.get(METADATA), METADATA),
            handoffs
        );
    }

    private static String text(Object value, String field) {
        if (value != null && !(value instanceof String)) {
            throw new IllegalArgumentException(field + " must be a string (current: " + value.getClass().getName() + ")");
        }
        return (String) value;
    }

    private static Map<String, Object> mapping(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> entries)) {
            throw new IllegalArgumentException(field + " must be a mapping (current: " + value.getClass().getName() + ")");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException(field + " keys must be strings (current: " + entry.getKey() + ")");
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "HandoffState{" +
            "context='" + context + '\'' +
            ", nextInstruction='" + nextInstruction + '\'' +
            ", artifacts=" + artifacts.keySet() +
            ", metadata=" + metadata.keySet() +
            ", handoffs=" + handoffChain.size() +
            '}';
    }
}
