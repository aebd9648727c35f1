package com.ryuqq.agentica.core.concurrent;

import com.ryuqq.agentica.core.exception.AgentPatternException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * fail-fast 묶음 실패.
 *
 * <p>첫 실패로 형제 작업이 취소되기 전까지 관측된 모든 실패를 작업 인덱스 순으로 담습니다.
 * 첫 번째 실패가 cause, 나머지는 suppressed로 연결됩니다.</p>
 *
 * <p><strong>단일 예외 호출자 호환:</strong></p>
 * <pre>
 * try {
 *     taskGroup.runFailFast(tasks);
 * } catch (TaskGroupException e) {
 *     throw e.firstFailureAsRuntime();
 * }
 * </pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class TaskGroupException extends AgentPatternException {

    private final transient List<TaskResult.Failed<?>> failures;

    public TaskGroupException(List<? extends TaskResult.Failed<?>> failures) {
        super(buildMessage(failures), firstCause(failures));
        this.failures = sorted(failures);
        this.failures.stream().skip(1).map(TaskResult.Failed::failure).forEach(this::addSuppressed);
    }

    /**
     * 실패 목록 (작업 인덱스 오름차순).
     *
     * @return 불변 리스트 (최소 1개)
     */
    public List<TaskResult.Failed<?>> getFailures() {
        return failures;
    }

    /**
     * 인덱스가 가장 작은 실패의 원인.
     *
     * @return 원인 예외
     */
    public Throwable firstFailure() {
        return failures.get(0).failure();
    }

    /**
     * 첫 실패를 비검사 예외로 반환.
     *
     * <p>원인이 이미 {@link RuntimeException}이면 그대로, 아니면 {@link AgentPatternException}으로 감쌉니다.</p>
     *
     * @return 다시 던질 예외
     */
    public RuntimeException firstFailureAsRuntime() {
        Throwable first = firstFailure();
        if (first instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new AgentPatternException(first.getMessage(), first);
    }

    private static List<TaskResult.Failed<?>> sorted(List<? extends TaskResult.Failed<?>> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        List<TaskResult.Failed<?>> copy = new ArrayList<>(failures);
        copy.sort(Comparator.comparingInt(failure -> failure.index()));
        return List.copyOf(copy);
    }

    private static Throwable firstCause(List<? extends TaskResult.Failed<?>> failures) {
        return sorted(failures).get(0).failure();
    }

    private static String buildMessage(List<? extends TaskResult.Failed<?>> failures) {
        List<TaskResult.Failed<?>> ordered = sorted(failures);
        TaskResult.Failed<?> first = ordered.get(0);
        return String.format("%d task(s) failed, first at index %d: %s",
            ordered.size(), first.index(), first.failure());
    }
}
