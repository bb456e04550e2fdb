package io.troupe.core.report;

import io.troupe.core.role.CoverageRoleHandler;
import io.troupe.core.role.DocumentationRoleHandler;
import io.troupe.core.role.PerformanceRoleHandler;
import io.troupe.core.role.QualityRoleHandler;
import io.troupe.core.role.SecurityRoleHandler;
import java.util.List;

/** Bundled category sets for health checks and release preparation. */
public final class CategoryDefinitions {

    private CategoryDefinitions() {}

    public static List<CategoryDefinition> healthDefaults() {
        return List.of(
                CategoryDefinition.of(SecurityRoleHandler.ROLE, 0.30),
                CategoryDefinition.of(CoverageRoleHandler.ROLE, 0.25).withPassThreshold(80.0),
                CategoryDefinition.of(QualityRoleHandler.ROLE, 0.20),
                CategoryDefinition.of(PerformanceRoleHandler.ROLE, 0.15),
                CategoryDefinition.of(DocumentationRoleHandler.ROLE, 0.10));
    }

    /**
     * Health categories with release gates: no critical security issues, 80% test coverage and
     * a quality score of 7 are required; 80% documentation coverage only warns.
     */
    public static List<CategoryDefinition> releaseDefaults() {
        return List.of(
                CategoryDefinition.of(SecurityRoleHandler.ROLE, 0.30)
                        .withGate(GateDefinition.critical("critical_issues", "<=", 0)),
                CategoryDefinition.of(CoverageRoleHandler.ROLE, 0.25)
                        .withPassThreshold(80.0)
                        .withGate(GateDefinition.critical("coverage_percent", ">=", 80)),
                CategoryDefinition.of(QualityRoleHandler.ROLE, 0.20)
                        .withGate(GateDefinition.critical("quality_score", ">=", 7)),
                CategoryDefinition.of(PerformanceRoleHandler.ROLE, 0.15),
                CategoryDefinition.of(DocumentationRoleHandler.ROLE, 0.10)
                        .withGate(GateDefinition.advisory("coverage_percent", ">=", 80)));
    }
}
