package com.ryuqq.agentica.pattern.eventdriven;

import com.ryuqq.agentica.core.concurrent.TaskResult;

/**
 * 구독자 한 명에 대한 이벤트 전달 결과.
 *
 * @param subscriber 구독자
 * @param result 처리 결과 (성공 값 또는 실패)
 * @param <T> 결과 타입
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record EventDelivery<T>(Subscriber subscriber, TaskResult<T> result) {

    public boolean isSuccess() {
        return result.isSuccess();
    }

    public T value() {
        return result.valueOrNull();
    }

    public Throwable failure() {
        return result.failureOrNull();
    }
}
