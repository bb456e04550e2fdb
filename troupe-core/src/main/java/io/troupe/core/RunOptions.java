package io.troupe.core;

import io.troupe.core.execution.ExecutionListener;
import io.troupe.core.execution.StrategyType;
import io.troupe.core.report.CategoryDefinition;
import io.troupe.core.report.CategoryDefinitions;
import io.troupe.core.report.ReportKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run choices: execution strategy, report variant, scored categories, initial context and
 * an optional listener.
 *
 * <p>When no categories are given, health reports use {@link
 * CategoryDefinitions#healthDefaults()} and readiness reports use {@link
 * CategoryDefinitions#releaseDefaults()}.
 *
 * @implNote Immutable. Create instances via {@link #builder()}.
 */
public final class RunOptions {

    private final StrategyType strategy;
    private final ReportKind reportKind;
    private final List<CategoryDefinition> categories;
    private final Map<String, Object> initialContext;
    private final ExecutionListener listener;

    private RunOptions(Builder builder) {
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy required");
        this.reportKind = Objects.requireNonNull(builder.reportKind, "Report kind required");
        if (builder.categories != null) {
            this.categories = List.copyOf(builder.categories);
        } else {
            this.categories =
                    reportKind == ReportKind.READINESS
                            ? CategoryDefinitions.releaseDefaults()
                            : CategoryDefinitions.healthDefaults();
        }
        this.initialContext =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.initialContext));
        this.listener = builder.listener != null ? builder.listener : ExecutionListener.NOOP;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public StrategyType getStrategy() {
        return strategy;
    }

    public ReportKind getReportKind() {
        return reportKind;
    }

    public List<CategoryDefinition> getCategories() {
        return categories;
    }

    public Map<String, Object> getInitialContext() {
        return initialContext;
    }

    public ExecutionListener getListener() {
        return listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private StrategyType strategy = StrategyType.PARALLEL;
        private ReportKind reportKind = ReportKind.HEALTH;
        private List<CategoryDefinition> categories;
        private Map<String, Object> initialContext = Map.of();
        private ExecutionListener listener;

        private Builder() {}

        public Builder strategy(StrategyType strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder reportKind(ReportKind reportKind) {
            this.reportKind = reportKind;
            return this;
        }

        public Builder categories(List<CategoryDefinition> categories) {
            this.categories = categories;
            return this;
        }

        public Builder initialContext(Map<String, Object> initialContext) {
            this.initialContext = initialContext != null ? initialContext : Map.of();
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
