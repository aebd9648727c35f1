package com.ryuqq.agentica.core.concurrent;

/**
 * 묶음 실행 중 하나의 작업 결과.
 *
 * <p>두 가지 결과 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 값을 반환하며 완료됨 (값은 null일 수 있음)</li>
 *   <li>{@link Failed}: 예외로 종료됨</li>
 * </ul>
 *
 * <p>{@link #index()}는 입력 작업 리스트에서의 위치입니다.</p>
 *
 * @param <T> 값 타입
 * @author Agentica Team
 * @since 1.0.0
 */
public sealed interface TaskResult<T> permits TaskResult.Succeeded, TaskResult.Failed {

    /**
     * 입력 리스트에서의 위치.
     *
     * @return 0부터 시작하는 인덱스
     */
    int index();

    default boolean isSuccess() {
        return this instanceof Succeeded;
    }

    default boolean isFailure() {
        return this instanceof Failed;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공이면 값, 실패면 null
     */
    default T valueOrNull() {
        return this instanceof Succeeded<T> succeeded ? succeeded.value() : null;
    }

    /**
     * 실패 원인 조회.
     *
     * @return 실패면 원인, 성공이면 null
     */
    default Throwable failureOrNull() {
        return this instanceof Failed<T> failed ? failed.failure() : null;
    }

    /**
     * 성공 결과.
     *
     * @param index 입력 위치
     * @param value 반환값 (null 허용)
     * @param <T> 값 타입
     */
    record Succeeded<T>(int index, T value) implements TaskResult<T> {

        public Succeeded {
            if (index < 0) {
                throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
            }
        }
    }

    /**
     * 실패 결과.
     *
     * @param index 입력 위치
     * @param failure 작업이 던진 예외
     * @param <T> 값 타입
     */
    record Failed<T>(int index, Throwable failure) implements TaskResult<T> {

        public Failed {
            if (index < 0) {
                throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
            }
            if (failure == null) {
                throw new IllegalArgumentException("failure cannot be null");
            }
        }
    }
}
