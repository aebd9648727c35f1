package com.ryuqq.agentica.adapter.inmemory.tracker;

import com.ryuqq.agentica.core.model.PatternType;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded agent spawn.
 *
 * @param agentId id of the spawned handle
 * @param patternType pattern that spawned the agent
 * @param patternId pattern instance id
 * @param role role within the pattern
 * @param attributes spawn attributes (index, round, level, ...)
 * @param premise premise of the agent
 * @param model model identifier, or null for the runtime default
 * @param recordedAt time the spawn was recorded
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public record AgentAssignment(
    String agentId,
    PatternType patternType,
    String patternId,
    String role,
    Map<String, String> attributes,
    String premise,
    String model,
    Instant recordedAt
) {

    public AgentAssignment {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
