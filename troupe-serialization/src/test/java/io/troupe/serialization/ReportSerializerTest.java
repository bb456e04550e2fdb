package io.troupe.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.compose.CompositionResult;
import io.troupe.core.compose.CompositionStats;
import io.troupe.core.criteria.Comparator;
import io.troupe.core.execution.AgentResult;
import io.troupe.core.execution.ExecutionOutcome;
import io.troupe.core.execution.PlanStatus;
import io.troupe.core.execution.StrategyType;
import io.troupe.core.execution.TierAttempt;
import io.troupe.core.form.FormResponse;
import io.troupe.core.report.CategoryScore;
import io.troupe.core.report.Confidence;
import io.troupe.core.report.Grade;
import io.troupe.core.report.QualityGate;
import io.troupe.core.report.Readiness;
import io.troupe.core.report.Report;
import io.troupe.core.report.ReportKind;
import io.troupe.core.report.Trend;
import io.troupe.core.routing.Route;
import io.troupe.core.routing.Tier;
import io.troupe.core.run.RunRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Round-trip tests for report JSON and the run record export. */
class ReportSerializerTest {

    private static final Instant TIMESTAMP = Instant.parse("2026-02-10T09:30:00Z");

    @Test
    void roundTrip_readinessReport() {
        Report original = readinessReport();

        Report restored = ReportSerializer.fromJson(ReportSerializer.toJson(original));

        assertThat(restored.getRunId()).isEqualTo("run-42");
        assertThat(restored.getKind()).isEqualTo(ReportKind.READINESS);
        assertThat(restored.getTimestamp()).isEqualTo(TIMESTAMP);
        assertThat(restored.getOverallScore()).isEqualTo(72.5);
        assertThat(restored.getGrade()).isEqualTo(Grade.C);
        assertThat(restored.getTrend()).isEqualTo(Trend.DECLINING);
        assertThat(restored.getPreviousScore()).isEqualTo(80.0);
        assertThat(restored.getTrendDelta()).isEqualTo(-7.5);
        assertThat(restored.getCategories()).isEqualTo(original.getCategories());
        assertThat(restored.getGates()).isEqualTo(original.getGates());
        assertThat(restored.getReadiness()).isEqualTo(original.getReadiness());
        assertThat(restored.getIssues()).containsExactly("coverage: 54.3% below target");
        assertThat(restored.getTotalCost()).isEqualTo(0.06);
    }

    @Test
    void roundTrip_baselineHealthReportKeepsNulls() {
        Report original =
                Report.builder()
                        .kind(ReportKind.HEALTH)
                        .timestamp(TIMESTAMP)
                        .overallScore(91.0)
                        .recommendations(List.of("All categories healthy"))
                        .build();

        Report restored = ReportSerializer.fromJson(ReportSerializer.toJson(original));

        assertThat(restored.getGrade()).isEqualTo(Grade.A);
        assertThat(restored.getTrend()).isEqualTo(Trend.BASELINE);
        assertThat(restored.getPreviousScore()).isNull();
        assertThat(restored.getTrendDelta()).isNull();
        assertThat(restored.getReadiness()).isNull();
        assertThat(restored.getRecommendations()).containsExactly("All categories healthy");
    }

    @Test
    void toJson_writesTimestampAsIsoString() {
        String json = ReportSerializer.toJson(readinessReport());

        assertThat(json).contains("\"2026-02-10T09:30:00Z\"");
    }

    @Test
    void fromJson_rejectsReportWithoutTimestamp() {
        assertThatThrownBy(() -> ReportSerializer.fromJson("{\"kind\": \"HEALTH\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize report");
    }

    @Test
    void toJson_exportsRunRecord() {
        AgentSpec spec = AgentSpec.builder().agentId("agent-1a2b3c4d").role("coverage").build();
        TierAttempt attempt =
                TierAttempt.success(
                        new Route("local", Tier.CAPABLE), TIMESTAMP, Duration.ofMillis(40), 0.05);
        AgentResult result =
                AgentResult.succeeded(
                        spec,
                        Map.of("coverage_percent", 54.3),
                        Tier.CAPABLE,
                        List.of(attempt),
                        List.of());
        RunRecord run =
                new RunRecord(
                        "run-42",
                        "release_prep",
                        FormResponse.of("release_prep", Map.of("has_tests", true)),
                        new CompositionResult(List.of(spec), new CompositionStats(1, 1, 0), null),
                        new ExecutionOutcome(
                                "run-42",
                                StrategyType.PARALLEL,
                                PlanStatus.COMPLETED,
                                List.of(result),
                                1,
                                TIMESTAMP,
                                TIMESTAMP.plusSeconds(2)),
                        readinessReport(),
                        List.of(attempt),
                        List.of(
                                "Agent 'publisher' depends on 'test_runner',"
                                        + " which is not in the plan"));

        String json = ReportSerializer.toJson(run);

        assertThat(json)
                .contains("\"runId\" : \"run-42\"")
                .contains("\"agent-1a2b3c4d\"")
                .contains("\"capable\"")
                .contains("\"coverage_percent\" : 54.3")
                .contains("which is not in the plan");
    }

    // -- Helpers --

    private static Report readinessReport() {
        List<CategoryScore> categories =
                List.of(
                        new CategoryScore(
                                "security", "security", 0.0, 0.5, 100.0, true, 70.0, List.of()),
                        new CategoryScore(
                                "coverage",
                                "coverage",
                                54.3,
                                0.5,
                                54.3,
                                false,
                                80.0,
                                List.of("coverage: 54.3% below target")));
        List<QualityGate> gates =
                List.of(
                        new QualityGate(
                                "security",
                                "critical_issues",
                                0.0,
                                0.0,
                                Comparator.LTE,
                                true,
                                true,
                                1.0,
                                "critical_issues: actual 0.00, required critical_issues <= 0.0"),
                        new QualityGate(
                                "coverage",
                                "coverage_percent",
                                null,
                                80.0,
                                Comparator.GTE,
                                false,
                                true,
                                -1.0,
                                "coverage_percent >= 80.0 not evaluated (agent failed)"));
        return Report.builder()
                .runId("run-42")
                .templateId("release_prep")
                .kind(ReportKind.READINESS)
                .timestamp(TIMESTAMP)
                .overallScore(72.5)
                .categories(categories)
                .issues(List.of("coverage: 54.3% below target"))
                .trend(Trend.DECLINING)
                .previousScore(80.0)
                .trendDelta(-7.5)
                .gates(gates)
                .readiness(
                        new Readiness(
                                false,
                                Confidence.LOW,
                                List.of("coverage gate failed: coverage_percent not evaluated"),
                                List.of()))
                .agentsExecuted(2)
                .agentsSucceeded(1)
                .totalAttempts(3)
                .totalCost(0.06)
                .build();
    }
}
