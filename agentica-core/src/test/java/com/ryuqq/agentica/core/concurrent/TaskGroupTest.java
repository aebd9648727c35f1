package com.ryuqq.agentica.core.concurrent;

import com.ryuqq.agentica.core.exception.AgentPatternException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskGroup 유닛 테스트.
 *
 * <p>fail-fast 취소, partial 결과 배열, 입력 순서 보장을 검증합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
@DisplayName("TaskGroup 테스트")
class TaskGroupTest {

    private ExecutorService executor;
    private TaskGroup taskGroup;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        taskGroup = new TaskGroup(executor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    // ============================================================
    // 1. 순서 보장
    // ============================================================

    @Test
    void run_완료_순서와_무관하게_입력_순서로_반환() {
        // given
        List<Callable<String>> tasks = List.of(
            () -> {
                Thread.sleep(150);
                return "slow";
            },
            () -> "fast",
            () -> {
                Thread.sleep(50);
                return "medium";
            }
        );

        // when
        List<String> results = taskGroup.runFailFast(tasks);

        // then
        assertThat(results).containsExactly("slow", "fast", "medium");
    }

    @Test
    void run_빈_작업은_빈_결과() {
        assertThat(taskGroup.runPartial(List.<Callable<String>>of())).isEmpty();
        assertThat(taskGroup.runFailFast(List.<Callable<String>>of())).isEmpty();
    }

    @Test
    void run_null_값도_성공_결과로_유지() {
        List<Callable<String>> tasks = List.of(() -> null, () -> "x");

        assertThat(taskGroup.runFailFast(tasks)).containsExactly(null, "x");
    }

    // ============================================================
    // 2. FAIL_FAST
    // ============================================================

    @Test
    void failFast_첫_실패가_지연된_형제_작업의_부수효과를_막음() throws InterruptedException {
        // given
        AtomicBoolean sideEffect = new AtomicBoolean(false);
        List<Callable<String>> tasks = List.of(
            () -> {
                throw new IllegalStateException("boom");
            },
            () -> {
                Thread.sleep(500);
                sideEffect.set(true);
                return "late";
            }
        );

        // when & then
        assertThatThrownBy(() -> taskGroup.runFailFast(tasks))
            .isInstanceOf(TaskGroupException.class)
            .satisfies(e -> {
                TaskGroupException group = (TaskGroupException) e;
                assertThat(group.firstFailure()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
                assertThat(group.getFailures()).extracting(failure -> failure.index()).containsExactly(0);
            });

        Thread.sleep(800);
        assertThat(sideEffect).isFalse();
    }

    @Test
    void failFast_이미_관측된_실패를_인덱스_순으로_묶음() {
        // given
        CountDownLatch bothFailed = new CountDownLatch(2);
        List<Callable<String>> tasks = List.of(
            () -> "ok",
            () -> {
                bothFailed.countDown();
                bothFailed.await(2, TimeUnit.SECONDS);
                throw new IllegalArgumentException("second");
            },
            () -> {
                bothFailed.countDown();
                bothFailed.await(2, TimeUnit.SECONDS);
                throw new IllegalStateException("third");
            }
        );

        // when & then
        assertThatThrownBy(() -> taskGroup.runFailFast(tasks))
            .isInstanceOf(TaskGroupException.class)
            .satisfies(e -> {
                TaskGroupException group = (TaskGroupException) e;
                assertThat(group.getFailures()).isNotEmpty();
                List<Integer> indexes = new ArrayList<>();
                group.getFailures().forEach(failure -> indexes.add(failure.index()));
                assertThat(indexes).isSorted().allMatch(index -> index == 1 || index == 2);
                assertThat(group.getCause()).isSameAs(group.firstFailure());
            });
    }

    @Test
    void failFast_firstFailureAsRuntime은_검사_예외를_감쌈() {
        List<Callable<String>> tasks = List.of(() -> {
            throw new Exception("checked");
        });

        assertThatThrownBy(() -> taskGroup.runFailFast(tasks))
            .isInstanceOf(TaskGroupException.class)
            .satisfies(e -> assertThat(((TaskGroupException) e).firstFailureAsRuntime())
                .isInstanceOf(AgentPatternException.class)
                .hasMessage("checked"));
    }

    // ============================================================
    // 3. PARTIAL
    // ============================================================

    @Test
    void partial_실패는_값으로_반환되고_길이와_순서_유지() {
        // given
        RuntimeException failure = new RuntimeException("task 2 failed");
        List<Callable<String>> tasks = List.of(
            () -> "first",
            () -> {
                throw failure;
            },
            () -> {
                Thread.sleep(100);
                return "third";
            }
        );

        // when
        List<TaskResult<String>> results = taskGroup.runPartial(tasks);

        // then
        assertThat(results).hasSize(3);
        assertThat(results.get(0).valueOrNull()).isEqualTo("first");
        assertThat(results.get(1).isFailure()).isTrue();
        assertThat(results.get(1).failureOrNull()).isSameAs(failure);
        assertThat(results.get(2).valueOrNull()).isEqualTo("third");
        assertThat(results).extracting(TaskResult::index).containsExactly(0, 1, 2);
    }

    // ============================================================
    // 4. 인터럽트
    // ============================================================

    @Test
    void 대기_중_인터럽트되면_작업을_취소하고_플래그를_복원() throws InterruptedException {
        // given
        AtomicBoolean finished = new AtomicBoolean(false);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean(false);
        List<Callable<String>> tasks = List.of(() -> {
            Thread.sleep(2_000);
            finished.set(true);
            return "never";
        });

        Thread caller = new Thread(() -> {
            try {
                taskGroup.runPartial(tasks);
            } catch (AgentPatternException e) {
                thrown.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });

        // when
        caller.start();
        Thread.sleep(100);
        caller.interrupt();
        caller.join(2_000);

        // then
        assertThat(thrown.get()).isInstanceOf(AgentPatternException.class).hasMessageContaining("interrupted");
        assertThat(interruptFlag).isTrue();
        Thread.sleep(300);
        assertThat(finished).isFalse();
    }

    // ============================================================
    // 5. 완료 신호
    // ============================================================

    @Test
    void 완료_신호를_받은_시점에는_실패가_이미_기록되어_취소로_덮어쓸_수_없음() throws Exception {
        // given
        BlockingQueue<Integer> completions = new LinkedBlockingQueue<>();
        TaskGroup.CompletionSignallingTask<String> task = new TaskGroup.CompletionSignallingTask<>(3, () -> {
            throw new IllegalStateException("juror crashed");
        }, completions);

        // when
        executor.execute(task);
        int index = completions.take();
        boolean cancelled = task.cancel(true);

        // then
        assertThat(index).isEqualTo(3);
        assertThat(cancelled).isFalse();
        assertThat(task.isCancelled()).isFalse();
        assertThatThrownBy(task::get)
            .isInstanceOf(ExecutionException.class)
            .hasRootCauseMessage("juror crashed");
    }

    @Test
    void 생성_executor가_null이면_예외() {
        assertThatThrownBy(() -> new TaskGroup(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
