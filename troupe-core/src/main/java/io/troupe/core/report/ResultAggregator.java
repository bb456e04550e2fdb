package io.troupe.core.report;

import io.troupe.core.criteria.Comparator;
import io.troupe.core.execution.AgentResult;
import io.troupe.core.execution.AgentStatus;
import io.troupe.core.result.ErrorKind;
import io.troupe.core.result.Result;
import io.troupe.core.role.AggregationDataException;
import io.troupe.core.role.RoleHandler;
import io.troupe.core.role.RoleRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns settled agent results into a {@link Report}.
 *
 * <p>Per category, the result of the category's role is looked up. A missing, skipped or failed
 * result scores 0 with one issue; otherwise the role's {@link RoleHandler} maps the output to a
 * score, clamped to 0-100. The overall score is the weighted sum with weights renormalized to
 * sum to 1.
 *
 * <p>Readiness reports additionally evaluate one {@link QualityGate} per category against the
 * raw metric, independently of the score. A category without a gate definition is gated,
 * non-critically, on {@code score >= passThreshold}. Gates fail closed when the value cannot be
 * read.
 *
 * <h2>Contracts</h2>
 *
 * <ul>
 *   <li>Never throws for bad agent data: {@link AggregationDataException} becomes a zero score
 *       and an issue
 *   <li>Returns {@code Err(INVALID_CONFIG)} only for unusable category definitions
 *   <li>Category weights of the report always sum to 1
 * </ul>
 *
 * @implNote Stateless and thread-safe.
 */
public class ResultAggregator {

    private static final Logger logger = Logger.getLogger(ResultAggregator.class.getName());

    public static final double DEFAULT_TREND_EPSILON = 1.0;
    public static final double DEFAULT_SMALL_MARGIN = 0.05;
    public static final double DEFAULT_WIDE_MARGIN = 0.15;

    static final String ALL_HEALTHY = "All categories healthy";
    static final String SCORE_METRIC = "score";

    private final RoleRegistry roleRegistry;
    private final Clock clock;
    private final double trendEpsilon;
    private final double smallMargin;
    private final double wideMargin;

    public ResultAggregator(RoleRegistry roleRegistry) {
        this(
                roleRegistry,
                Clock.systemUTC(),
                DEFAULT_TREND_EPSILON,
                DEFAULT_SMALL_MARGIN,
                DEFAULT_WIDE_MARGIN);
    }

    public ResultAggregator(
            RoleRegistry roleRegistry,
            Clock clock,
            double trendEpsilon,
            double smallMargin,
            double wideMargin) {
        this.roleRegistry = Objects.requireNonNull(roleRegistry, "roleRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (trendEpsilon < 0 || smallMargin > wideMargin) {
            throw new IllegalArgumentException(
                    "Invalid thresholds: epsilon=" + trendEpsilon
                            + ", small=" + smallMargin + ", wide=" + wideMargin);
        }
        this.trendEpsilon = trendEpsilon;
        this.smallMargin = smallMargin;
        this.wideMargin = wideMargin;
    }

    /**
     * Aggregates results into a report.
     *
     * @param results settled agent results, not null
     * @param categories scored categories, not null or empty
     * @param previousScore overall score of the previous report, or null for a baseline
     * @param kind report variant, not null
     * @return the report, or {@code INVALID_CONFIG} for unusable categories, never null
     */
    public Result<Report> aggregate(
            List<AgentResult> results,
            List<CategoryDefinition> categories,
            Double previousScore,
            ReportKind kind) {
        Objects.requireNonNull(results, "results must not be null");
        Objects.requireNonNull(kind, "kind must not be null");

        Optional<String> problem = validateCategories(categories);
        if (problem.isPresent()) {
            logger.warning("Cannot aggregate: " + problem.get());
            return Result.err(ErrorKind.INVALID_CONFIG, problem.get());
        }

        Map<String, AgentResult> byRole = new HashMap<>();
        for (AgentResult result : results) {
            byRole.putIfAbsent(result.role(), result);
        }
        double weightSum = categories.stream().mapToDouble(CategoryDefinition::weight).sum();

        List<CategoryScore> scores = new ArrayList<>();
        List<QualityGate> gates = new ArrayList<>();
        for (CategoryDefinition category : categories) {
            AgentResult result = byRole.get(category.role());
            RoleHandler handler = roleRegistry.find(category.role()).orElseThrow();
            scores.add(scoreCategory(category, category.weight() / weightSum, result, handler));
            if (kind == ReportKind.READINESS) {
                gates.add(evaluateGate(category, result, handler));
            }
        }

        double overall = clamp(scores.stream().mapToDouble(CategoryScore::weightedScore).sum());
        Trend trend = Trend.classify(overall, previousScore, trendEpsilon);
        Readiness readiness = kind == ReportKind.READINESS ? readiness(results, gates) : null;

        Report report =
                Report.builder()
                        .kind(kind)
                        .timestamp(clock.instant())
                        .overallScore(overall)
                        .grade(Grade.fromScore(overall))
                        .categories(scores)
                        .issues(scores.stream().flatMap(s -> s.issues().stream()).toList())
                        .recommendations(recommendations(scores))
                        .trend(trend)
                        .previousScore(previousScore)
                        .trendDelta(previousScore != null ? overall - previousScore : null)
                        .gates(gates)
                        .readiness(readiness)
                        .agentsExecuted(
                                (int) results.stream().filter(AgentResult::wasExecuted).count())
                        .agentsSucceeded(
                                (int) results.stream().filter(AgentResult::isSuccess).count())
                        .totalAttempts(results.stream().mapToInt(AgentResult::attemptCount).sum())
                        .totalCost(results.stream().mapToDouble(AgentResult::totalCost).sum())
                        .build();
        logger.info(
                "Aggregated "
                        + kind
                        + " report: "
                        + String.format("%.1f", overall)
                        + " ("
                        + report.getGrade()
                        + ", "
                        + trend
                        + ")");
        return Result.ok(report);
    }

    /**
     * Checks category definitions without aggregating anything.
     *
     * @param categories definitions to check, may be null
     * @return the first problem found, or empty when usable
     */
    public Optional<String> validateCategories(List<CategoryDefinition> categories) {
        if (categories == null || categories.isEmpty()) {
            return Optional.of("no categories defined");
        }
        double sum = 0.0;
        List<String> names = new ArrayList<>();
        for (CategoryDefinition category : categories) {
            if (names.contains(category.name())) {
                return Optional.of("duplicate category '" + category.name() + "'");
            }
            names.add(category.name());
            if (!roleRegistry.isRegistered(category.role())) {
                return Optional.of(
                        "category '" + category.name() + "' uses unknown role '"
                                + category.role() + "'");
            }
            sum += category.weight();
        }
        if (!(sum > 0.0)) {
            return Optional.of("category weights must sum to a positive value");
        }
        return Optional.empty();
    }

    private static CategoryScore scoreCategory(
            CategoryDefinition category, double weight, AgentResult result, RoleHandler handler) {
        String unavailable = unavailableReason(category, result);
        if (unavailable != null) {
            return zero(category, weight, unavailable);
        }
        try {
            double score = clamp(handler.score(result.output()));
            Double raw = rawValue(handler, result.output());
            List<String> issues = new ArrayList<>();
            for (String issue : handler.issues(result.output())) {
                issues.add(category.name() + ": " + issue);
            }
            return new CategoryScore(
                    category.name(),
                    category.role(),
                    raw,
                    weight,
                    score,
                    score >= category.passThreshold(),
                    category.passThreshold(),
                    issues);
        } catch (AggregationDataException e) {
            logger.warning("Category " + category.name() + " scored 0: " + e.getMessage());
            return zero(category, weight, category.name() + ": " + e.getMessage());
        }
    }

    private static Double rawValue(RoleHandler handler, Map<String, Object> output) {
        if (!output.containsKey(handler.primaryMetric())) {
            return null;
        }
        try {
            return handler.metric(output, handler.primaryMetric());
        } catch (AggregationDataException e) {
            logger.fine("No raw value for " + handler.role() + ": " + e.getMessage());
            return null;
        }
    }

    private static CategoryScore zero(CategoryDefinition category, double weight, String issue) {
        return new CategoryScore(
                category.name(),
                category.role(),
                null,
                weight,
                0.0,
                category.passThreshold() <= 0.0,
                category.passThreshold(),
                List.of(issue));
    }

    /** Returns why the category has no usable output, or null when it has one. */
    private static String unavailableReason(CategoryDefinition category, AgentResult result) {
        if (result == null || result.status() == AgentStatus.SKIPPED) {
            return category.name() + ": agent " + category.role() + " not executed";
        }
        if (!result.isSuccess()) {
            return category.name() + ": agent " + category.role() + " failed";
        }
        return null;
    }

    private static QualityGate evaluateGate(
            CategoryDefinition category,
            AgentResult result,
            RoleHandler handler) {
        GateDefinition gate =
                category.gate()
                        .orElseGet(
                                () ->
                                        new GateDefinition(
                                                SCORE_METRIC,
                                                category.passThreshold(),
                                                Comparator.GTE,
                                                false));
        String criterion =
                gate.metric() + " " + gate.comparator().symbol() + " " + gate.threshold();

        Double actual = null;
        String unreadable = unavailableReason(category, result);
        if (unreadable == null) {
            try {
                actual =
                        category.gate().isPresent()
                                ? handler.metric(result.output(), gate.metric())
                                : clamp(handler.score(result.output()));
            } catch (AggregationDataException e) {
                unreadable = e.getMessage();
            }
        }

        if (actual == null) {
            return new QualityGate(
                    category.name(),
                    gate.metric(),
                    null,
                    gate.threshold(),
                    gate.comparator(),
                    false,
                    gate.critical(),
                    -1.0,
                    criterion + " not evaluated (" + unreadable + ")");
        }
        boolean passed = gate.comparator().test(actual, gate.threshold());
        return new QualityGate(
                category.name(),
                gate.metric(),
                actual,
                gate.threshold(),
                gate.comparator(),
                passed,
                gate.critical(),
                margin(gate.comparator(), actual, gate.threshold(), passed),
                String.format("%s: actual %.2f, required %s", gate.metric(), actual, criterion)
                        + (passed ? "" : " (failed)"));
    }

    /**
     * Distance between actual and threshold in the passing direction, relative to the threshold's
     * magnitude (at least 1).
     */
    static double margin(Comparator comparator, double actual, double threshold, boolean passed) {
        double scale = Math.max(Math.abs(threshold), 1.0);
        return switch (comparator) {
            case GT, GTE -> (actual - threshold) / scale;
            case LT, LTE -> passed && threshold == 0.0 ? 1.0 : (threshold - actual) / scale;
            case EQ -> passed ? 1.0 : -1.0;
        };
    }

    private Readiness readiness(List<AgentResult> results, List<QualityGate> gates) {
        List<String> blockers = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (QualityGate gate : gates) {
            if (gate.passed()) {
                continue;
            }
            String line = gate.name() + " gate failed: " + gate.message();
            if (gate.critical()) {
                blockers.add(line);
            } else {
                warnings.add(line);
            }
        }
        boolean anyAgentFailed = false;
        for (AgentResult result : results) {
            if (result.status() == AgentStatus.FAILED) {
                anyAgentFailed = true;
                blockers.add("Agent " + result.role() + " failed: " + result.message());
            } else if (result.status() == AgentStatus.SKIPPED) {
                anyAgentFailed = true;
                blockers.add("Agent " + result.role() + " not executed: " + result.message());
            }
        }

        boolean ready = gates.stream().allMatch(QualityGate::passed);
        double minMargin = gates.stream().mapToDouble(QualityGate::margin).min().orElse(1.0);
        Confidence confidence;
        if (anyAgentFailed || minMargin < smallMargin) {
            confidence = Confidence.LOW;
        } else if (minMargin >= wideMargin) {
            confidence = Confidence.HIGH;
        } else {
            confidence = Confidence.MEDIUM;
        }
        return new Readiness(ready, confidence, blockers, warnings);
    }

    private List<String> recommendations(List<CategoryScore> scores) {
        List<String> recommendations = new ArrayList<>();
        for (CategoryScore score : scores) {
            if (!score.passed()) {
                roleRegistry
                        .find(score.role())
                        .ifPresent(
                                handler ->
                                        recommendations.add(
                                                handler.recommendation(
                                                        score.name(), score.score())));
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add(ALL_HEALTHY);
        }
        return recommendations;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }
}
