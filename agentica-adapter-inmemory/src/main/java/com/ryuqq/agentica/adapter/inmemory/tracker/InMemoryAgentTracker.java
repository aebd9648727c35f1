package com.ryuqq.agentica.adapter.inmemory.tracker;

import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import com.ryuqq.agentica.core.spi.AgentTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AgentTracker} for testing and inspection.
 *
 * <p>Records every spawn as an {@link AgentAssignment} and returns the handle unchanged,
 * so patterns behave identically with or without the tracker configured.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Assignments are kept in a {@link CopyOnWriteArrayList}</li>
 *   <li>Fan-out patterns record from several worker threads concurrently</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryAgentTracker tracker = new InMemoryAgentTracker();
 * AgentFactory factory = new AgentFactory(runtime, tracker);
 *
 * jury.decide(ResultShape.BOOLEAN, "Is this safe?");
 *
 * List&lt;AgentAssignment&gt; jurors = tracker.findByPatternId(jury.patternId());
 * </pre>
 *
 * <p><strong>Limitations:</strong> data is lost on process restart. Not suitable for production use.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public class InMemoryAgentTracker implements AgentTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAgentTracker.class);

    private final List<AgentAssignment> assignments = new CopyOnWriteArrayList<>();
    private final Clock clock;

    /**
     * Creates a tracker stamping assignments with the system UTC clock.
     */
    public InMemoryAgentTracker() {
        this(Clock.systemUTC());
    }

    public InMemoryAgentTracker(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns {@code handle} unchanged.</p>
     */
    @Override
    public AgentHandle record(SpawnContext context, AgentSpec spec, AgentHandle handle) {
        if (context == null || spec == null || handle == null) {
            throw new IllegalArgumentException("context, spec and handle cannot be null");
        }

        AgentAssignment assignment = new AgentAssignment(
            handle.agentId(),
            context.patternType(),
            context.patternId(),
            context.role(),
            context.attributes(),
            spec.premise(),
            spec.model(),
            clock.instant()
        );
        assignments.add(assignment);
        log.debug("Recorded {} as {} in {} {}", assignment.agentId(), assignment.role(),
            assignment.patternType().value(), assignment.patternId());
        return handle;
    }

    /**
     * All assignments in recording order.
     *
     * @return immutable snapshot
     */
    public List<AgentAssignment> getAssignments() {
        return List.copyOf(assignments);
    }

    public List<AgentAssignment> findByPatternId(String patternId) {
        return filter(assignment -> assignment.patternId().equals(patternId));
    }

    public List<AgentAssignment> findByPatternType(PatternType patternType) {
        return filter(assignment -> assignment.patternType() == patternType);
    }

    public List<AgentAssignment> findByRole(String role) {
        return filter(assignment -> assignment.role().equals(role));
    }

    public int size() {
        return assignments.size();
    }

    /**
     * Clears all recorded assignments.
     *
     * <p>Useful for test cleanup.</p>
     */
    public void clear() {
        assignments.clear();
    }

    private List<AgentAssignment> filter(Predicate<AgentAssignment> predicate) {
        return assignments.stream().filter(predicate).collect(Collectors.toList());
    }
}
