package io.troupe.core.template;

import io.troupe.core.form.FormSchema;
import io.troupe.core.role.RoleRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Load-time checks that every template must pass before a source hands it out.
 *
 * <p>Checks, all reported together:
 *
 * <ul>
 *   <li>the template has at least one rule and no two rules share a role
 *   <li>every rule role has a registered handler
 *   <li>every key read by a condition or config mapping is declared by the form schema (skipped
 *       for templates without a schema)
 *   <li>every declared dependency names another role of the same template
 * </ul>
 */
public class TemplateValidator {

    private final RoleRegistry roleRegistry;

    public TemplateValidator(RoleRegistry roleRegistry) {
        this.roleRegistry = Objects.requireNonNull(roleRegistry, "roleRegistry must not be null");
    }

    /**
     * Validates a template.
     *
     * @param template template to check, not null
     * @return the same template, for chaining
     * @throws TemplateInvalidException listing every problem found
     */
    public Template validate(Template template) {
        List<String> problems = findProblems(template);
        if (!problems.isEmpty()) {
            throw new TemplateInvalidException(template.getId(), problems);
        }
        return template;
    }

    /**
     * Returns every validation problem without throwing.
     *
     * @param template template to check, not null
     * @return problems, empty when valid
     */
    public List<String> findProblems(Template template) {
        List<String> problems = new ArrayList<>();
        if (template.getRules().isEmpty()) {
            problems.add("template defines no composition rules");
        }

        Set<String> roles = new HashSet<>();
        for (CompositionRule rule : template.getRules()) {
            if (!roles.add(rule.getRole())) {
                problems.add("duplicate role '" + rule.getRole() + "'");
            }
        }

        FormSchema schema = template.getFormSchema();
        for (CompositionRule rule : template.getRules()) {
            String role = rule.getRole();
            if (!roleRegistry.isRegistered(role)) {
                problems.add("rule '" + role + "' uses an unknown role");
            }
            if (!schema.isEmpty()) {
                Set<String> undeclared = new TreeSet<>();
                rule.getCondition().readKeys().stream()
                        .filter(key -> !schema.declares(key))
                        .forEach(undeclared::add);
                rule.getConfigMapping().readKeys().stream()
                        .filter(key -> !schema.declares(key))
                        .forEach(undeclared::add);
                if (!undeclared.isEmpty()) {
                    problems.add("rule '" + role + "' reads undeclared keys " + undeclared);
                }
            }
            for (String dependency : rule.getDependsOn()) {
                if (dependency.equals(role)) {
                    problems.add("rule '" + role + "' depends on itself");
                } else if (!roles.contains(dependency)) {
                    problems.add(
                            "rule '" + role + "' depends on unknown role '" + dependency + "'");
                }
            }
        }
        return problems;
    }
}
