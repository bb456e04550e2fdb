package io.troupe.core.execution;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.routing.Tier;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final outcome of one agent. Exactly one exists per agent spec after a plan completes, even
 * when the agent was exhausted, failed fatally, or never ran.
 *
 * @param agentId agent id, not null
 * @param role agent role, not null
 * @param status final status, not null
 * @param output last output payload; empty if no attempt produced one
 * @param finalTier tier of the last attempt, or null if never attempted
 * @param errorKind failure classification, or null on success
 * @param message failure detail, or null on success
 * @param attempts every attempt in order, never null
 * @param warnings runtime warnings (degraded output), never null
 */
public record AgentResult(
        String agentId,
        String role,
        AgentStatus status,
        Map<String, Object> output,
        Tier finalTier,
        ErrorKind errorKind,
        String message,
        List<TierAttempt> attempts,
        List<String> warnings) {

    public AgentResult {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(status, "status must not be null");
        output =
                output != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                        : Map.of();
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (status != AgentStatus.SUCCEEDED && errorKind == null) {
            throw new IllegalArgumentException("Unsuccessful result requires an error kind");
        }
    }

    public static AgentResult succeeded(
            AgentSpec spec,
            Map<String, Object> output,
            Tier finalTier,
            List<TierAttempt> attempts,
            List<String> warnings) {
        return new AgentResult(
                spec.getAgentId(),
                spec.getRole(),
                AgentStatus.SUCCEEDED,
                output,
                finalTier,
                null,
                null,
                attempts,
                warnings);
    }

    public static AgentResult failed(
            AgentSpec spec,
            ErrorKind kind,
            String message,
            Map<String, Object> output,
            Tier finalTier,
            List<TierAttempt> attempts,
            List<String> warnings) {
        return new AgentResult(
                spec.getAgentId(),
                spec.getRole(),
                AgentStatus.FAILED,
                output,
                finalTier,
                kind,
                message,
                attempts,
                warnings);
    }

    /** Synthesized result for an agent that was never attempted. */
    public static AgentResult skipped(AgentSpec spec, ErrorKind kind, String message) {
        return new AgentResult(
                spec.getAgentId(),
                spec.getRole(),
                AgentStatus.SKIPPED,
                Map.of(),
                null,
                kind,
                message,
                List.of(),
                List.of());
    }

    public boolean isSuccess() {
        return status == AgentStatus.SUCCEEDED;
    }

    public boolean wasExecuted() {
        return status != AgentStatus.SKIPPED;
    }

    public int attemptCount() {
        return attempts.size();
    }

    public double totalCost() {
        return attempts.stream().mapToDouble(TierAttempt::cost).sum();
    }

    public Duration totalDuration() {
        return attempts.stream().map(TierAttempt::duration).reduce(Duration.ZERO, Duration::plus);
    }

    /** Tiers of every attempt, in order. */
    public List<Tier> tiers() {
        return attempts.stream().map(TierAttempt::tier).toList();
    }
}
