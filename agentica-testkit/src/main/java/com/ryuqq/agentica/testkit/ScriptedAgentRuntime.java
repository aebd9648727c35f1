package com.ryuqq.agentica.testkit;

import com.ryuqq.agentica.core.exception.AgentInvocationException;
import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.ResultShape;
import com.ryuqq.agentica.core.spi.AgentHandle;
import com.ryuqq.agentica.core.spi.AgentRuntime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Scripted {@link AgentRuntime} for pattern tests.
 *
 * <p>Answers are registered per premise. Every created spec and every invocation is
 * recorded so tests can assert how a pattern drove its agents.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedAgentRuntime runtime = new ScriptedAgentRuntime()
 *     .on("You are a juror.", Answers.sequence(false, false, true))
 *     .onAny(Answers.constant("fallback"));
 *
 * Jury jury = new Jury(config, new AgentFactory(runtime), taskGroup);
 * </pre>
 *
 * <p>Thread-safe. Fan-out patterns invoke handles from several worker threads.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class ScriptedAgentRuntime implements AgentRuntime {

    /**
     * Produces the answer for one invocation.
     */
    @FunctionalInterface
    public interface Behavior {

        /**
         * @param call the recorded call
         * @return answer, cast to the requested shape by the handle
         * @throws Exception any failure, surfaced to the pattern as the invocation failure
         */
        Object answer(AgentCall call) throws Exception;
    }

    private record Rule(Predicate<String> premiseMatcher, Behavior behavior) {
    }

    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<AgentSpec> specs = new CopyOnWriteArrayList<>();
    private final List<AgentCall> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private volatile Behavior fallback;

    /**
     * Registers a behavior for an exact premise.
     *
     * @param premise premise of the agents that should answer with the behavior
     * @param behavior answer behavior
     * @return this runtime
     */
    public ScriptedAgentRuntime on(String premise, Behavior behavior) {
        return onMatching(premise::equals, behavior);
    }

    /**
     * Registers a behavior for every premise containing the given fragment.
     */
    public ScriptedAgentRuntime onPremiseContaining(String fragment, Behavior behavior) {
        return onMatching(premise -> premise.contains(fragment), behavior);
    }

    public ScriptedAgentRuntime onMatching(Predicate<String> premiseMatcher, Behavior behavior) {
        if (premiseMatcher == null || behavior == null) {
            throw new IllegalArgumentException("premiseMatcher and behavior cannot be null");
        }
        rules.add(new Rule(premiseMatcher, behavior));
        return this;
    }

    /**
     * Registers the behavior used when no premise rule matches.
     */
    public ScriptedAgentRuntime onAny(Behavior behavior) {
        this.fallback = behavior;
        return this;
    }

    @Override
    public AgentHandle create(AgentSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        specs.add(spec);
        return new ScriptedHandle("scripted-" + sequence.incrementAndGet(), spec);
    }

    /**
     * All specs passed to {@link #create(AgentSpec)}, in creation order.
     */
    public List<AgentSpec> specs() {
        return List.copyOf(specs);
    }

    public int spawnCount() {
        return specs.size();
    }

    public int spawnCount(String premise) {
        return (int) specs.stream().filter(spec -> spec.premise().equals(premise)).count();
    }

    /**
     * All invocations, in the order they started.
     */
    public List<AgentCall> calls() {
        return List.copyOf(calls);
    }

    public List<AgentCall> callsTo(String premise) {
        return calls.stream()
            .filter(call -> call.premise().equals(premise))
            .collect(Collectors.toList());
    }

    public List<String> promptsTo(String premise) {
        List<String> prompts = new ArrayList<>();
        for (AgentCall call : callsTo(premise)) {
            prompts.add(call.prompt());
        }
        return prompts;
    }

    private Behavior behaviorFor(String premise) {
        for (Rule rule : rules) {
            if (rule.premiseMatcher().test(premise)) {
                return rule.behavior();
            }
        }
        return fallback;
    }

    private final class ScriptedHandle implements AgentHandle {

        private final String agentId;
        private final AgentSpec spec;

        private ScriptedHandle(String agentId, AgentSpec spec) {
            this.agentId = agentId;
            this.spec = spec;
        }

        @Override
        public <T> T invoke(ResultShape<T> shape, String prompt) {
            return invoke(shape, prompt, Map.of());
        }

        @Override
        public <T> T invoke(ResultShape<T> shape, String prompt, Map<String, Object> arguments) {
            AgentCall call = new AgentCall(agentId, spec.premise(), shape, prompt, arguments);
            calls.add(call);

            Behavior behavior = behaviorFor(spec.premise());
            if (behavior == null) {
                throw new AgentInvocationException(agentId, "No scripted answer for premise: " + spec.premise());
            }

            Object answer;
            try {
                answer = behavior.answer(call);
            } catch (RuntimeException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentInvocationException(agentId, "Scripted answer interrupted", e);
            } catch (Exception e) {
                throw new AgentInvocationException(agentId, e.getMessage(), e);
            }
            return shape.cast(answer);
        }

        @Override
        public String agentId() {
            return agentId;
        }

        @Override
        public String toString() {
            return agentId + "{" + spec.premise() + "}";
        }
    }
}
