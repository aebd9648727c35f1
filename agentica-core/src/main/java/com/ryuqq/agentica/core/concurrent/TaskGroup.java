package com.ryuqq.agentica.core.concurrent;

import com.ryuqq.agentica.core.exception.AgentPatternException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 독립 작업 묶음을 동시에 실행하는 구조화된 실행 범위.
 *
 * <p>모든 fan-out 패턴(Swarm, MapReduce, Hierarchical, Jury, EventDriven)이 공유하는
 * 단일 동시성 구현입니다. {@link #run(List, FailureMode)}이 반환될 때 결과를 기다리지 않은
 * 작업은 남지 않습니다. 성공/실패 결과는 모두 수집되었거나, 취소되었습니다.</p>
 *
 * <p><strong>실행 모드:</strong></p>
 * <ul>
 *   <li>{@link FailureMode#FAIL_FAST}: 첫 실패 시 형제 작업을 {@code cancel(true)}로 인터럽트.
 *       취소는 협조적이므로 진행 중이던 에이전트 호출은 버려지고 결과는 소비되지 않습니다.</li>
 *   <li>{@link FailureMode#PARTIAL}: 모든 작업 완료까지 대기, 실패는 값으로 반환.</li>
 * </ul>
 *
 * <p><strong>순서 보장:</strong> 결과 리스트는 완료 순서와 무관하게 항상 입력 순서를 따릅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TaskGroup group = new TaskGroup(executorService);
 * List&lt;String&gt; answers = group.runFailFast(List.of(
 *     () -&gt; agentA.invoke(ResultShape.TEXT, query),
 *     () -&gt; agentB.invoke(ResultShape.TEXT, query)
 * ));
 * </pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class TaskGroup {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private static final class SharedHolder {
        private static final TaskGroup INSTANCE = new TaskGroup(Executors.newCachedThreadPool(new DaemonThreadFactory()));
    }

    private final ExecutorService executor;

    /**
     * @param executor 작업을 실행할 ExecutorService (호출자가 수명 관리)
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public TaskGroup(ExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 프로세스 공유 TaskGroup.
     *
     * <p>데몬 스레드("agentica-task-N")를 쓰는 cached pool 위에서 동작하므로 종료 처리가 필요 없습니다.</p>
     *
     * @return 공유 인스턴스
     */
    public static TaskGroup shared() {
        return SharedHolder.INSTANCE;
    }

    /**
     * 작업 묶음 실행.
     *
     * @param tasks 실행할 작업 (빈 리스트면 빈 결과)
     * @param mode 실패 처리 방식
     * @param <T> 결과 타입
     * @return 입력 순서와 동일한 결과 리스트
     * @throws TaskGroupException FAIL_FAST 모드에서 하나 이상의 작업이 실패한 경우
     * @throws AgentPatternException 대기 중 호출 스레드가 인터럽트된 경우 (인터럽트 플래그 복원됨)
     */
    public <T> List<TaskResult<T>> run(List<? extends Callable<? extends T>> tasks, FailureMode mode) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (tasks.isEmpty()) {
            return List.of();
        }

        BlockingQueue<Integer> completions = new LinkedBlockingQueue<>();
        List<Future<T>> futures = submitAll(tasks, completions);

        return mode == FailureMode.FAIL_FAST
            ? awaitFailFast(futures, completions)
            : awaitAll(futures);
    }

    /**
     * fail-fast 실행 후 값만 반환.
     *
     * @param tasks 실행할 작업
     * @param <T> 결과 타입
     * @return 입력 순서의 값 리스트 (값은 null일 수 있음)
     * @throws TaskGroupException 하나 이상의 작업이 실패한 경우
     */
    public <T> List<T> runFailFast(List<? extends Callable<? extends T>> tasks) {
        List<TaskResult<T>> results = run(tasks, FailureMode.FAIL_FAST);
        List<T> values = new ArrayList<>(results.size());
        for (TaskResult<T> result : results) {
            values.add(result.valueOrNull());
        }
        return values;
    }

    /**
     * partial 실행.
     *
     * @param tasks 실행할 작업
     * @param <T> 결과 타입
     * @return 입력 순서의 결과 리스트 (실패 위치는 {@link TaskResult.Failed})
     */
    public <T> List<TaskResult<T>> runPartial(List<? extends Callable<? extends T>> tasks) {
        return run(tasks, FailureMode.PARTIAL);
    }

    private <T> List<Future<T>> submitAll(List<? extends Callable<? extends T>> tasks,
                                          BlockingQueue<Integer> completions) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            int index = i;
            Callable<? extends T> task = tasks.get(i);
            if (task == null) {
                cancelAll(futures);
                throw new IllegalArgumentException("task cannot be null (index: " + index + ")");
            }
            CompletionSignallingTask<T> future = new CompletionSignallingTask<>(index, task::call, completions);
            futures.add(future);
            executor.execute(future);
        }
        return futures;
    }

    private <T> List<TaskResult<T>> awaitFailFast(List<Future<T>> futures, BlockingQueue<Integer> completions) {
        int remaining = futures.size();
        while (remaining > 0) {
            int index;
            try {
                index = completions.take();
            } catch (InterruptedException e) {
                throw interrupted(futures, e);
            }
            remaining--;

            TaskResult<T> result = collect(futures, index);
            if (result.isFailure()) {
                cancelAll(futures);
                List<TaskResult.Failed<?>> failures = observedFailures(futures);
                log.debug("Task group failed fast at index {}, {} failure(s) observed", index, failures.size());
                throw new TaskGroupException(failures);
            }
        }
        return awaitAll(futures);
    }

    private <T> List<TaskResult<T>> awaitAll(List<Future<T>> futures) {
        List<TaskResult<T>> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(collect(futures, i));
        }
        return results;
    }

    private <T> TaskResult<T> collect(List<Future<T>> futures, int index) {
        try {
            return new TaskResult.Succeeded<>(index, futures.get(index).get());
        } catch (ExecutionException e) {
            return new TaskResult.Failed<>(index, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            return new TaskResult.Failed<>(index, e);
        } catch (InterruptedException e) {
            throw interrupted(futures, e);
        }
    }

    private static <T> List<TaskResult.Failed<?>> observedFailures(List<Future<T>> futures) {
        List<TaskResult.Failed<?>> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<T> future = futures.get(i);
            if (!future.isDone() || future.isCancelled()) {
                continue;
            }
            Throwable failure = failureOf(future);
            if (failure != null) {
                failures.add(new TaskResult.Failed<>(i, failure));
            }
        }
        return failures;
    }

    private static Throwable failureOf(Future<?> future) {
        try {
            future.get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }

    private static AgentPatternException interrupted(List<? extends Future<?>> futures, InterruptedException e) {
        cancelAll(futures);
        Thread.currentThread().interrupt();
        return new AgentPatternException("Task group interrupted", e);
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    /**
     * 결과(값, 예외, 취소)가 저장된 뒤에만 완료 인덱스를 알리는 작업.
     *
     * <p>{@link FutureTask#done()}은 결과가 확정된 다음 호출되므로, 인덱스를 받은 쪽이
     * {@code cancel(true)}를 호출해도 이미 기록된 실패를 덮어쓰지 못합니다.</p>
     */
    static final class CompletionSignallingTask<T> extends FutureTask<T> {

        private final int index;
        private final BlockingQueue<Integer> completions;

        CompletionSignallingTask(int index, Callable<T> callable, BlockingQueue<Integer> completions) {
            super(callable);
            this.index = index;
            this.completions = completions;
        }

        @Override
        protected void done() {
            completions.add(index);
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agentica-task-" + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
