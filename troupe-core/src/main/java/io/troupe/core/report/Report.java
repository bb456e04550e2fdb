package io.troupe.core.report;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated outcome of one execution: weighted score, grade, per-category detail, trend and,
 * for readiness reports, the gate verdict.
 *
 * <p>A report exists for every started execution, even when every agent failed; such a report
 * scores 0 with grade F and one issue per category.
 *
 * @implNote Immutable. Create instances via {@link #builder()}; derive a copy with {@link
 *     #toBuilder()}.
 */
public final class Report {

    private final String runId;
    private final String templateId;
    private final ReportKind kind;
    private final Instant timestamp;
    private final double overallScore;
    private final Grade grade;
    private final List<CategoryScore> categories;
    private final List<String> issues;
    private final List<String> recommendations;
    private final Trend trend;
    private final Double previousScore;
    private final Double trendDelta;
    private final List<QualityGate> gates;
    private final Readiness readiness;
    private final int agentsExecuted;
    private final int agentsSucceeded;
    private final int totalAttempts;
    private final double totalCost;

    private Report(Builder builder) {
        this.runId = builder.runId;
        this.templateId = builder.templateId;
        this.kind = Objects.requireNonNull(builder.kind, "Kind required");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "Timestamp required");
        this.overallScore = builder.overallScore;
        this.grade = builder.grade != null ? builder.grade : Grade.fromScore(builder.overallScore);
        this.categories = List.copyOf(builder.categories);
        this.issues = List.copyOf(builder.issues);
        this.recommendations = List.copyOf(builder.recommendations);
        this.trend = builder.trend != null ? builder.trend : Trend.BASELINE;
        this.previousScore = builder.previousScore;
        this.trendDelta = builder.trendDelta;
        this.gates = List.copyOf(builder.gates);
        this.readiness = builder.readiness;
        this.agentsExecuted = builder.agentsExecuted;
        this.agentsSucceeded = builder.agentsSucceeded;
        this.totalAttempts = builder.totalAttempts;
        this.totalCost = builder.totalCost;
    }

    /** Returns the run this report belongs to, or null before it is attached to a run. */
    public String getRunId() {
        return runId;
    }

    public String getTemplateId() {
        return templateId;
    }

    public ReportKind getKind() {
        return kind;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getOverallScore() {
        return overallScore;
    }

    public Grade getGrade() {
        return grade;
    }

    public List<CategoryScore> getCategories() {
        return categories;
    }

    public List<String> getIssues() {
        return issues;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public Trend getTrend() {
        return trend;
    }

    /** Returns the score this report was compared against, or null for a baseline. */
    public Double getPreviousScore() {
        return previousScore;
    }

    public Double getTrendDelta() {
        return trendDelta;
    }

    /** Returns the evaluated gates; empty for health reports. */
    public List<QualityGate> getGates() {
        return gates;
    }

    /** Returns the readiness verdict, or null for health reports. */
    public Readiness getReadiness() {
        return readiness;
    }

    public int getAgentsExecuted() {
        return agentsExecuted;
    }

    public int getAgentsSucceeded() {
        return agentsSucceeded;
    }

    public int getTotalAttempts() {
        return totalAttempts;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .runId(runId)
                .templateId(templateId)
                .kind(kind)
                .timestamp(timestamp)
                .overallScore(overallScore)
                .grade(grade)
                .categories(categories)
                .issues(issues)
                .recommendations(recommendations)
                .trend(trend)
                .previousScore(previousScore)
                .trendDelta(trendDelta)
                .gates(gates)
                .readiness(readiness)
                .agentsExecuted(agentsExecuted)
                .agentsSucceeded(agentsSucceeded)
                .totalAttempts(totalAttempts)
                .totalCost(totalCost);
    }

    @Override
    public String toString() {
        return "Report{"
                + kind
                + ", score="
                + String.format("%.1f", overallScore)
                + ", grade="
                + grade
                + ", trend="
                + trend
                + "}";
    }

    public static final class Builder {
        private String runId;
        private String templateId;
        private ReportKind kind = ReportKind.HEALTH;
        private Instant timestamp;
        private double overallScore;
        private Grade grade;
        private List<CategoryScore> categories = List.of();
        private List<String> issues = List.of();
        private List<String> recommendations = List.of();
        private Trend trend;
        private Double previousScore;
        private Double trendDelta;
        private List<QualityGate> gates = List.of();
        private Readiness readiness;
        private int agentsExecuted;
        private int agentsSucceeded;
        private int totalAttempts;
        private double totalCost;

        private Builder() {}

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder kind(ReportKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder overallScore(double overallScore) {
            this.overallScore = overallScore;
            return this;
        }

        public Builder grade(Grade grade) {
            this.grade = grade;
            return this;
        }

        public Builder categories(List<CategoryScore> categories) {
            this.categories = categories != null ? categories : List.of();
            return this;
        }

        public Builder issues(List<String> issues) {
            this.issues = issues != null ? issues : List.of();
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations != null ? recommendations : List.of();
            return this;
        }

        public Builder trend(Trend trend) {
            this.trend = trend;
            return this;
        }

        public Builder previousScore(Double previousScore) {
            this.previousScore = previousScore;
            return this;
        }

        public Builder trendDelta(Double trendDelta) {
            this.trendDelta = trendDelta;
            return this;
        }

        public Builder gates(List<QualityGate> gates) {
            this.gates = gates != null ? gates : List.of();
            return this;
        }

        public Builder readiness(Readiness readiness) {
            this.readiness = readiness;
            return this;
        }

        public Builder agentsExecuted(int agentsExecuted) {
            this.agentsExecuted = agentsExecuted;
            return this;
        }

        public Builder agentsSucceeded(int agentsSucceeded) {
            this.agentsSucceeded = agentsSucceeded;
            return this;
        }

        public Builder totalAttempts(int totalAttempts) {
            this.totalAttempts = totalAttempts;
            return this;
        }

        public Builder totalCost(double totalCost) {
            this.totalCost = totalCost;
            return this;
        }

        public Report build() {
            return new Report(this);
        }
    }
}
