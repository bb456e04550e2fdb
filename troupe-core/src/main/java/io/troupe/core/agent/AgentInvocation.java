package io.troupe.core.agent;

import io.troupe.core.routing.Tier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the agent runtime receives for one tier attempt.
 *
 * @param agentId id of the agent being run, not null
 * @param role role the runtime should perform, not null
 * @param tier tier of this attempt, not null
 * @param provider provider chosen for this attempt, not null
 * @param config agent config built at composition time, never null; values may be null
 * @param tools tool names the agent may use, never null
 * @param context execution context: initial context plus upstream outputs, never null
 */
public record AgentInvocation(
        String agentId,
        String role,
        Tier tier,
        String provider,
        Map<String, Object> config,
        List<String> tools,
        Map<String, Object> context) {

    public AgentInvocation {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        config = copyOf(config);
        tools = tools != null ? List.copyOf(tools) : List.of();
        context = copyOf(context);
    }

    // Template defaults and upstream outputs may carry null values.
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
                : Map.of();
    }
}
