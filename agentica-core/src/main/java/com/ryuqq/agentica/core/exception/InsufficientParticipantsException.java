package com.ryuqq.agentica.core.exception;

import java.util.List;

/**
 * 성공한 참여자 수가 정족수에 미달.
 *
 * <p>partial-results 모드에서 실패를 허용하더라도, 최소 성공 수를 채우지 못하면
 * 기본값으로 조용히 대체하지 않고 이 예외로 명시적으로 실패합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class InsufficientParticipantsException extends AgentPatternException {

    private final int succeeded;
    private final int required;
    private final List<Throwable> failures;

    public InsufficientParticipantsException(String participant, int succeeded, int required,
                                             List<Throwable> failures) {
        super(String.format("Not enough successful %s: %d < %d", participant, succeeded, required),
            failures == null || failures.isEmpty() ? null : failures.get(0));
        this.succeeded = succeeded;
        this.required = required;
        this.failures = failures == null ? List.of() : List.copyOf(failures);
        this.failures.stream().skip(1).forEach(this::addSuppressed);
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getRequired() {
        return required;
    }

    /**
     * 수집된 참여자 실패 목록 (입력 순서).
     *
     * @return 불변 리스트
     */
    public List<Throwable> getFailures() {
        return failures;
    }
}
