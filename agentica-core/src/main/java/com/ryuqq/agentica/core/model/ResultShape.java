package com.ryuqq.agentica.core.model;

import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.handoff.HandoffState;

import java.util.List;
import java.util.Map;

/**
 * 에이전트 호출 시 기대하는 결과 형태.
 *
 * <p>에이전트 런타임은 이 descriptor를 보고 응답을 해당 타입으로 구성해야 합니다.
 * 제네릭 컬렉션은 {@code Class}로 표현할 수 없으므로, 자주 쓰는 형태를 상수로 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link #TEXT}: 자유 텍스트</li>
 *   <li>{@link #MAPPING}: 키/값 매핑</li>
 *   <li>{@link #SEQUENCE}: 순서 있는 목록</li>
 *   <li>{@link #BOOLEAN}: 예/아니오 판정</li>
 *   <li>{@link #HANDOFF}: {@link HandoffState}</li>
 *   <li>{@link #ANY}: 형태 제약 없음</li>
 * </ul>
 *
 * @param <T> 결과 타입
 * @author Agentica Team
 * @since 1.0.0
 */
public final class ResultShape<T> {

    public static final ResultShape<String> TEXT = new ResultShape<>("text", String.class);

    public static final ResultShape<Map<String, Object>> MAPPING = new ResultShape<>("mapping", Map.class);

    public static final ResultShape<List<Object>> SEQUENCE = new ResultShape<>("sequence", List.class);

    public static final ResultShape<Boolean> BOOLEAN = new ResultShape<>("boolean", Boolean.class);

    public static final ResultShape<HandoffState> HANDOFF = new ResultShape<>("handoff", HandoffState.class);

    public static final ResultShape<Object> ANY = new ResultShape<>("any", Object.class);

    private final String name;
    private final Class<?> type;

    private ResultShape(String name, Class<?> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.name = name;
        this.type = type;
    }

    /**
     * 임의 클래스로 결과 형태 생성.
     *
     * @param type 결과 클래스 (예: 사용자 정의 record)
     * @param <T> 결과 타입
     * @return ResultShape
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static <T> ResultShape<T> of(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new ResultShape<>(type.getSimpleName(), type);
    }

    public String name() {
        return name;
    }

    public Class<?> type() {
        return type;
    }

    /**
     * 값이 이 형태에 속하는지 확인.
     *
     * @param value 검사할 값 (null 허용)
     * @return null이거나 타입이 일치하면 true
     */
    public boolean accepts(Object value) {
        return value == null || type.isInstance(value);
    }

    /**
     * 런타임 응답을 결과 타입으로 변환.
     *
     * <p>런타임 구현체가 응답을 반환하기 전에 호출합니다. null은 그대로 통과합니다.</p>
     *
     * @param value 에이전트 응답
     * @return 캐스팅된 값
     * @throws AgentInvocationException 응답 타입이 형태와 맞지 않는 경우
     */
    @SuppressWarnings("unchecked")
    public T cast(Object value) {
        if (!accepts(value)) {
            throw new AgentInvocationException(null,
                "Expected " + name + " result but got " + value.getClass().getName());
        }
        return (T) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultShape<?> that = (ResultShape<?>) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return "ResultShape{" + name + '}';
    }
}
