package com.ryuqq.agentica.core.spi;

import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.SpawnContext;

/**
 * Observability sink for agent spawns.
 *
 * <p>Receives every spawned agent together with the {@link SpawnContext} that describes
 * which pattern instance created it and in which role. Implementations may record the
 * assignment, wrap the handle (e.g. to time invocations) or both.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Must return a usable handle. Returning the input handle unchanged is valid.</li>
 *   <li>Exceptions thrown here are logged by the caller and never fail the pattern.</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public interface AgentTracker {

    /**
     * Records a spawn.
     *
     * @param context pattern/role correlation
     * @param spec spec the agent was created with
     * @param handle the freshly created handle
     * @return handle to hand to the pattern (the same or a wrapper)
     */
    AgentHandle record(SpawnContext context, AgentSpec spec, AgentHandle handle);
}
