package com.ryuqq.agentica.pattern.support;

import com.ryuqq.agentica.core.concurrent.TaskResult;
import com.ryuqq.agentica.core.exception.InsufficientParticipantsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * PARTIAL 모드 팬아웃 결과 수집기.
 *
 * <p>실패한 참가자는 경고 로그를 남기고 제외하며, null 결과도 제외합니다.
 * 참가자가 하나 이상 실행되었는데 모두 실패한 경우에는 빈 결과를 넘기지 않고
 * {@link InsufficientParticipantsException}을 던집니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class PartialResults {

    private static final Logger log = LoggerFactory.getLogger(PartialResults.class);

    private PartialResults() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * 성공한 non-null 값만 입력 순서대로 수집.
     *
     * @param results TaskGroup PARTIAL 실행 결과
     * @param participant 참가자 이름 (로그/예외 메시지용, 예: "mappers")
     * @param <T> 결과 타입
     * @return 성공 값 리스트
     * @throws InsufficientParticipantsException 모든 참가자가 실패한 경우
     */
    public static <T> List<T> successes(List<TaskResult<T>> results, String participant) {
        List<T> values = new ArrayList<>(results.size());
        List<Throwable> failures = new ArrayList<>();

        for (TaskResult<T> result : results) {
            if (result.isFailure()) {
                failures.add(result.failureOrNull());
                log.warn("One of the {} failed (index: {}), continuing with partial results",
                    participant, result.index(), result.failureOrNull());
                continue;
            }
            T value = result.valueOrNull();
            if (value != null) {
                values.add(value);
            }
        }

        if (!failures.isEmpty() && failures.size() == results.size()) {
            throw new InsufficientParticipantsException(participant, 0, 1, failures);
        }
        return values;
    }
}
