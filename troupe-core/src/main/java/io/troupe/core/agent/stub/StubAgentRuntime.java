package io.troupe.core.agent.stub;

import io.troupe.core.agent.AgentExecutionException;
import io.troupe.core.agent.AgentInvocation;
import io.troupe.core.agent.AgentRuntime;
import io.troupe.core.agent.FatalExecutionException;
import io.troupe.core.agent.RecoverableExecutionException;
import io.troupe.core.agent.RoleOutput;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.routing.Tier;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Scriptable runtime that returns canned outputs without calling any real tooling.
 *
 * <p>Useful for exercising composition, routing and aggregation logic in tests and demos.
 *
 * <h2>Behavior resolution order</h2>
 *
 * <ol>
 *   <li>the next scripted behavior queued for the role via {@link #script}
 *   <li>a behavior registered for the role and tier via {@link #onTier}
 *   <li>the role default registered via {@link #respond}
 *   <li>a degraded {@code {"stub": true}} payload with a warning, mirroring how real runtimes
 *       report missing tooling
 * </ol>
 *
 * @implNote Thread-safe. Every invocation is recorded and can be inspected with {@link
 *     #invocations()}.
 */
public class StubAgentRuntime implements AgentRuntime {

    private static final Logger logger = Logger.getLogger(StubAgentRuntime.class.getName());

    /** One scripted reaction to an invocation. */
    @FunctionalInterface
    public interface Behavior {
        RoleOutput apply(AgentInvocation invocation) throws AgentExecutionException;
    }

    private final Map<String, Deque<Behavior>> scripts = new ConcurrentHashMap<>();
    private final Map<String, Behavior> tierBehaviors = new ConcurrentHashMap<>();
    private final Map<String, Behavior> defaults = new ConcurrentHashMap<>();
    private final List<AgentInvocation> invocations = new CopyOnWriteArrayList<>();

    /**
     * Sets the default output for a role.
     *
     * @param role role name, not null
     * @param payload payload returned on every unscripted call, not null
     * @return this runtime for chaining, never null
     */
    public StubAgentRuntime respond(String role, Map<String, Object> payload) {
        defaults.put(role, succeed(payload));
        return this;
    }

    public StubAgentRuntime respond(String role, Behavior behavior) {
        defaults.put(role, behavior);
        return this;
    }

    /**
     * Registers a behavior used whenever the role runs on the given tier.
     *
     * @param role role name, not null
     * @param tier tier, not null
     * @param behavior behavior, not null
     * @return this runtime for chaining, never null
     */
    public StubAgentRuntime onTier(String role, Tier tier, Behavior behavior) {
        tierBehaviors.put(role + "@" + tier.id(), behavior);
        return this;
    }

    /**
     * Queues behaviors consumed one per call, before any tier or default behavior applies.
     *
     * @param role role name, not null
     * @param behaviors behaviors in call order, not null
     * @return this runtime for chaining, never null
     */
    public StubAgentRuntime script(String role, Behavior... behaviors) {
        Deque<Behavior> queue = scripts.computeIfAbsent(role, r -> new ArrayDeque<>());
        synchronized (queue) {
            queue.addAll(List.of(behaviors));
        }
        return this;
    }

    @Override
    public RoleOutput run(AgentInvocation invocation) throws AgentExecutionException {
        invocations.add(invocation);
        logger.fine(
                "[STUB] "
                        + invocation.role()
                        + " on "
                        + invocation.provider()
                        + "/"
                        + invocation.tier().id());

        Behavior behavior = nextScripted(invocation.role());
        if (behavior == null) {
            behavior = tierBehaviors.get(invocation.role() + "@" + invocation.tier().id());
        }
        if (behavior == null) {
            behavior = defaults.get(invocation.role());
        }
        if (behavior == null) {
            return RoleOutput.degraded(
                    Map.of("stub", true),
                    "No stub output configured for role " + invocation.role());
        }
        return behavior.apply(invocation);
    }

    public List<AgentInvocation> invocations() {
        return List.copyOf(invocations);
    }

    public long invocationCount(String role) {
        return invocations.stream().filter(i -> i.role().equals(role)).count();
    }

    private Behavior nextScripted(String role) {
        Deque<Behavior> queue = scripts.get(role);
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    // -- Behavior factories --

    public static Behavior succeed(Map<String, Object> payload) {
        return invocation -> RoleOutput.of(payload);
    }

    public static Behavior succeed(Map<String, Object> payload, double cost) {
        return invocation -> RoleOutput.of(payload, cost);
    }

    public static Behavior fail(ErrorKind kind) {
        return invocation -> {
            String message = "stub " + kind.name().toLowerCase() + " on " + invocation.provider();
            if (kind.isRecoverable()) {
                throw new RecoverableExecutionException(kind, message);
            }
            throw new FatalExecutionException(kind, message);
        };
    }

    /**
     * Sleeps before answering; combined with a short attempt timeout this simulates a hung call.
     *
     * @param delay time to block, not null
     * @param payload payload returned after the delay, not null
     * @return behavior, never null
     */
    public static Behavior delay(Duration delay, Map<String, Object> payload) {
        return invocation -> {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RecoverableExecutionException(
                        ErrorKind.TIMEOUT, "stub call interrupted", e);
            }
            return RoleOutput.of(payload);
        };
    }
}
