package com.ryuqq.agentica.testkit;

import com.ryuqq.agentica.core.exception.AgentInvocationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 자주 쓰는 {@link ScriptedAgentRuntime.Behavior} 모음.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class Answers {

    private Answers() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ScriptedAgentRuntime.Behavior constant(Object value) {
        return call -> value;
    }

    /**
     * 호출 순서대로 값을 반환. 소진되면 마지막 값을 반복합니다.
     *
     * <p>값이 {@link Throwable}이면 반환하지 않고 던집니다.</p>
     *
     * @param values 응답 순서
     * @return Behavior
     */
    public static ScriptedAgentRuntime.Behavior sequence(Object... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        List<Object> answers = Arrays.asList(values);
        AtomicInteger next = new AtomicInteger();
        return call -> {
            int index = Math.min(next.getAndIncrement(), answers.size() - 1);
            Object answer = answers.get(index);
            if (answer instanceof Exception exception) {
                throw exception;
            }
            if (answer instanceof Error error) {
                throw error;
            }
            return answer;
        };
    }

    public static ScriptedAgentRuntime.Behavior failing(String message) {
        return call -> {
            throw new AgentInvocationException(call.agentId(), message);
        };
    }

    /**
     * 지연 후 값을 반환. 인터럽트되면 값을 반환하지 않고 실패합니다.
     *
     * @param delay 지연 시간
     * @param value 반환값
     * @return Behavior
     */
    public static ScriptedAgentRuntime.Behavior delayed(Duration delay, Object value) {
        return call -> {
            Thread.sleep(delay.toMillis());
            return value;
        };
    }

    /**
     * 프롬프트로부터 응답 생성.
     */
    public static ScriptedAgentRuntime.Behavior fromPrompt(Function<String, Object> answer) {
        return call -> answer.apply(call.prompt());
    }

    /**
     * 프롬프트를 그대로 돌려줌.
     */
    public static ScriptedAgentRuntime.Behavior echo() {
        return AgentCall::prompt;
    }
}
