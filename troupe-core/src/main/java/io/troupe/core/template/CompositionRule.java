package io.troupe.core.template;

import io.troupe.core.criteria.SuccessCriteria;
import io.troupe.core.routing.TierStrategy;
import java.util.List;
import java.util.Objects;

/**
 * Declarative definition of a potential agent, gated by a condition over user responses.
 *
 * <p>A rule whose condition evaluates false produces no agent. Otherwise the composer turns it
 * into an {@link io.troupe.core.agent.AgentSpec} carrying the rule's role, tier strategy, tools,
 * success criteria and declared dependencies, with a config map built by the rule's {@link
 * ConfigMapping}.
 *
 * @implNote Immutable. Create instances via {@link #builder()}.
 */
public final class CompositionRule {

    private final String role;
    private final String baseTemplate;
    private final String description;
    private final ResponseCondition condition;
    private final ConfigMapping configMapping;
    private final TierStrategy tierStrategy;
    private final List<String> tools;
    private final SuccessCriteria successCriteria;
    private final List<String> dependsOn;

    private CompositionRule(Builder builder) {
        this.role = Objects.requireNonNull(builder.role, "Role required");
        this.baseTemplate = builder.baseTemplate != null ? builder.baseTemplate : builder.role;
        this.description = builder.description != null ? builder.description : "";
        this.condition =
                builder.condition != null ? builder.condition : ResponseCondition.always();
        this.configMapping =
                builder.configMapping != null ? builder.configMapping : ConfigMapping.empty();
        this.tierStrategy = Objects.requireNonNull(builder.tierStrategy, "Tier strategy required");
        this.tools = List.copyOf(builder.tools);
        this.successCriteria =
                builder.successCriteria != null ? builder.successCriteria : SuccessCriteria.none();
        this.dependsOn = List.copyOf(builder.dependsOn);
    }

    public String getRole() {
        return role;
    }

    /** Informational name of the agent template this rule instantiates. */
    public String getBaseTemplate() {
        return baseTemplate;
    }

    public String getDescription() {
        return description;
    }

    public ResponseCondition getCondition() {
        return condition;
    }

    public ConfigMapping getConfigMapping() {
        return configMapping;
    }

    public TierStrategy getTierStrategy() {
        return tierStrategy;
    }

    public List<String> getTools() {
        return tools;
    }

    public SuccessCriteria getSuccessCriteria() {
        return successCriteria;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CompositionRule{role=" + role + ", strategy=" + tierStrategy.id() + "}";
    }

    public static final class Builder {
        private String role;
        private String baseTemplate;
        private String description;
        private ResponseCondition condition;
        private ConfigMapping configMapping;
        private TierStrategy tierStrategy = TierStrategy.PROGRESSIVE;
        private List<String> tools = List.of();
        private SuccessCriteria successCriteria;
        private List<String> dependsOn = List.of();

        private Builder() {}

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder baseTemplate(String baseTemplate) {
            this.baseTemplate = baseTemplate;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder condition(ResponseCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder configMapping(ConfigMapping configMapping) {
            this.configMapping = configMapping;
            return this;
        }

        public Builder tierStrategy(TierStrategy tierStrategy) {
            this.tierStrategy = tierStrategy;
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

        public CompositionRule build() {
            return new CompositionRule(this);
        }
    }
}
