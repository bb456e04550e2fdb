package io.troupe.core.agent;

/**
 * External capability that performs an agent's actual work.
 *
 * <h2>Contracts</h2>
 *
 * <ul>
 *   <li>Retrying an invocation must be safe
 *   <li>Calls return within bounded time or raise a {@link RecoverableExecutionException} of kind
 *       {@code TIMEOUT}; the engine additionally enforces its own per-attempt timeout
 *   <li>Missing tooling yields a {@link RoleOutput#degraded degraded} payload, not an exception
 * </ul>
 *
 * @implNote Implementations must be thread-safe; the parallel strategy calls them concurrently.
 * @see io.troupe.core.agent.stub.StubAgentRuntime
 */
@FunctionalInterface
public interface AgentRuntime {

    /**
     * Runs one tier attempt.
     *
     * @param invocation role, tier, provider, config and context of the attempt, not null
     * @return the role output, never null
     * @throws AgentExecutionException for classified failures
     */
    RoleOutput run(AgentInvocation invocation) throws AgentExecutionException;
}
