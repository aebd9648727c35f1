package com.ryuqq.agentica.core.spi;

import com.ryuqq.agentica.core.model.ResultShape;

import java.util.Map;

/**
 * Handle to a single spawned agent.
 *
 * <p>A handle keeps its premise for its whole lifetime. Patterns that reuse agents across
 * rounds (Adversarial, MapReduce reducer, Hierarchical specialists) hold on to the same handle.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public interface AgentHandle {

    /**
     * Invokes the agent and returns a value of the requested shape.
     *
     * @param shape expected result shape
     * @param prompt prompt text
     * @param <T> result type
     * @return agent answer (may be null if the runtime allows it)
     * @throws com.ryuqq.agentica.core.exception.AgentInvocationException if the invocation fails
     */
    <T> T invoke(ResultShape<T> shape, String prompt);

    /**
     * Invokes the agent with additional structured arguments.
     *
     * <p>The default implementation ignores {@code arguments}. Runtimes that can pass
     * structured input (for example a {@code HandoffState}) override this method.</p>
     *
     * @param shape expected result shape
     * @param prompt prompt text
     * @param arguments structured arguments keyed by name
     * @param <T> result type
     * @return agent answer
     */
    default <T> T invoke(ResultShape<T> shape, String prompt, Map<String, Object> arguments) {
        return invoke(shape, prompt);
    }

    /**
     * Identifier used in logs and by observability sinks.
     *
     * @return agent id
     */
    default String agentId() {
        return "agent-" + Integer.toHexString(System.identityHashCode(this));
    }
}
