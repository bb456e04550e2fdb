package io.troupe.core.agent;

import io.troupe.core.criteria.SuccessCriteria;
import io.troupe.core.routing.TierStrategy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Concrete agent produced by composition: what to run, how to route it, and what counts as a
 * pass.
 *
 * <p>Created once per execution and immutable afterwards.
 *
 * @implNote Thread-safe. Create instances via {@link #builder()}.
 * @see io.troupe.core.compose.AgentComposer
 */
public final class AgentSpec {

    private final String agentId;
    private final String role;
    private final TierStrategy tierStrategy;
    private final Map<String, Object> config;
    private final List<String> tools;
    private final SuccessCriteria successCriteria;
    private final List<String> dependsOn;

    private AgentSpec(Builder builder) {
        this.role = Objects.requireNonNull(builder.role, "Role required");
        this.agentId =
                builder.agentId != null
                        ? builder.agentId
                        : builder.role + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.tierStrategy = Objects.requireNonNull(builder.tierStrategy, "Tier strategy required");
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.tools = List.copyOf(builder.tools);
        this.successCriteria =
                builder.successCriteria != null ? builder.successCriteria : SuccessCriteria.none();
        this.dependsOn = List.copyOf(builder.dependsOn);
    }

    public String getAgentId() {
        return agentId;
    }

    public String getRole() {
        return role;
    }

    public TierStrategy getTierStrategy() {
        return tierStrategy;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public List<String> getTools() {
        return tools;
    }

    public SuccessCriteria getSuccessCriteria() {
        return successCriteria;
    }

    /** Roles whose output this agent needs before it can run. */
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "AgentSpec{" + agentId + ", role=" + role + ", strategy=" + tierStrategy.id() + "}";
    }

    public static final class Builder {
        private String agentId;
        private String role;
        private TierStrategy tierStrategy = TierStrategy.PROGRESSIVE;
        private Map<String, Object> config = Map.of();
        private List<String> tools = List.of();
        private SuccessCriteria successCriteria;
        private List<String> dependsOn = List.of();

        private Builder() {}

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder tierStrategy(TierStrategy tierStrategy) {
            this.tierStrategy = tierStrategy;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config != null ? config : Map.of();
            return this;
        }

        public Builder tools(List<String> tools) {
            this.tools = tools != null ? tools : List.of();
            return this;
        }

        public Builder successCriteria(SuccessCriteria successCriteria) {
            this.successCriteria = successCriteria;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn != null ? dependsOn : List.of();
            return this;
        }

        public AgentSpec build() {
            return new AgentSpec(this);
        }
    }
}
