package io.troupe.core.compose;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.form.FormResponse;
import io.troupe.core.role.RoleRegistry;
import io.troupe.core.template.CompositionRule;
import io.troupe.core.template.Template;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Turns a template and a form response into the agents to run.
 *
 * <p>Each rule is evaluated in template order:
 *
 * <ol>
 *   <li>its condition is tested against the response; false skips the rule
 *   <li>its role must be registered in the {@link RoleRegistry}
 *   <li>its config mapping builds the agent config
 *   <li>an {@link AgentSpec} is created with the rule's strategy, tools, criteria and
 *       dependencies
 * </ol>
 *
 * A rule that fails any step is recorded as a {@link SkippedRule}; composition itself never
 * fails. The composer also keeps running totals across calls, see {@link
 * #getCumulativeStats()}.
 *
 * @implNote Thread-safe. Compositions are independent; only the cumulative counters are shared.
 */
public class AgentComposer {

    private static final Logger logger = Logger.getLogger(AgentComposer.class.getName());

    private final RoleRegistry roleRegistry;
    private final AtomicReference<CompositionStats> cumulative =
            new AtomicReference<>(CompositionStats.EMPTY);

    public AgentComposer(RoleRegistry roleRegistry) {
        this.roleRegistry = Objects.requireNonNull(roleRegistry, "roleRegistry must not be null");
    }

    /**
     * Composes the agents for a response.
     *
     * @param template loaded template, not null
     * @param response user answers, not null
     * @return composed specs, stats and skipped rules, never null
     */
    public CompositionResult compose(Template template, FormResponse response) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(response, "response must not be null");

        List<AgentSpec> specs = new ArrayList<>();
        List<SkippedRule> skipped = new ArrayList<>();

        for (CompositionRule rule : template.getRules()) {
            try {
                if (!conditionHolds(rule, response)) {
                    logger.fine("Rule " + rule.getRole() + " skipped: condition not met");
                    skipped.add(new SkippedRule(rule.getRole(), SkippedRule.CONDITION_NOT_MET));
                    continue;
                }
                specs.add(createSpec(rule, response));
            } catch (CompositionException e) {
                logger.warning("Rule " + rule.getRole() + " skipped: " + e.getMessage());
                skipped.add(new SkippedRule(rule.getRole(), e.getMessage()));
            }
        }

        CompositionStats stats =
                new CompositionStats(template.getRules().size(), specs.size(), skipped.size());
        cumulative.accumulateAndGet(stats, CompositionStats::plus);
        logger.info(
                "Composed "
                        + stats.agentsCreated()
                        + " agent(s) from template "
                        + template.getId()
                        + " ("
                        + stats.rulesSkipped()
                        + " rule(s) skipped)");
        return new CompositionResult(specs, stats, skipped);
    }

    private static boolean conditionHolds(CompositionRule rule, FormResponse response)
            throws CompositionException {
        try {
            return rule.getCondition().test(response);
        } catch (RuntimeException e) {
            throw new CompositionException(
                    rule.getRole(), "condition failed: " + e.getMessage(), e);
        }
    }

    private AgentSpec createSpec(CompositionRule rule, FormResponse response)
            throws CompositionException {
        String role = rule.getRole();
        if (!roleRegistry.isRegistered(role)) {
            throw new CompositionException(role, "unknown role '" + role + "'");
        }
        Map<String, Object> config;
        try {
            config = rule.getConfigMapping().apply(response);
        } catch (RuntimeException e) {
            throw new CompositionException(
                    role, "config mapping failed: " + e.getMessage(), e);
        }
        return AgentSpec.builder()
                .agentId("agent-" + UUID.randomUUID().toString().substring(0, 8))
                .role(role)
                .tierStrategy(rule.getTierStrategy())
                .config(config)
                .tools(rule.getTools())
                .successCriteria(rule.getSuccessCriteria())
                .dependsOn(rule.getDependsOn())
                .build();
    }

    /** Totals over every composition since construction or the last {@link #resetStats()}. */
    public CompositionStats getCumulativeStats() {
        return cumulative.get();
    }

    public void resetStats() {
        cumulative.set(CompositionStats.EMPTY);
    }
}
