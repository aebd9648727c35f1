package com.ryuqq.agentica.core.spi;

import com.ryuqq.agentica.core.model.AgentSpec;

/**
 * Agent Runtime SPI.
 *
 * <p>Creates agent handles bound to a premise, an optional model and an optional tool set.
 * Every coordination pattern spawns its agents through this interface, so the patterns
 * never know which LLM backend actually answers.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: fan-out patterns call {@link #create(AgentSpec)} and
 *       {@link AgentHandle#invoke} from several worker threads concurrently</li>
 *   <li>Interruptible: long-running invocations should honour thread interruption,
 *       fail-fast task groups cancel siblings by interrupting them</li>
 *   <li>Shape-faithful: the returned value must be an instance of the requested
 *       {@link com.ryuqq.agentica.core.model.ResultShape}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * AgentHandle agent = runtime.create(AgentSpec.of("You are a code reviewer."));
 * String review = agent.invoke(ResultShape.TEXT, "Review this diff: ...");
 * </pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public interface AgentRuntime {

    /**
     * Creates a new agent handle.
     *
     * @param spec premise, model and tools of the agent
     * @return agent handle, never null
     * @throws IllegalArgumentException if spec is null
     * @throws com.ryuqq.agentica.core.exception.AgentInvocationException if the backend refuses the spec
     */
    AgentHandle create(AgentSpec spec);
}
