package io.troupe.core.criteria;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SuccessCriteriaTest {

    @Nested
    class ComparatorTest {

        @Test
        void shouldParseSymbolsAndNames() {
            assertThat(Comparator.parse(">=")).isEqualTo(Comparator.GTE);
            assertThat(Comparator.parse(" < ")).isEqualTo(Comparator.LT);
            assertThat(Comparator.parse("eq")).isEqualTo(Comparator.EQ);
            assertThat(Comparator.parse("LTE")).isEqualTo(Comparator.LTE);
        }

        @Test
        void shouldRejectUnknownComparator() {
            assertThatThrownBy(() -> Comparator.parse("=>"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("=>");
        }

        @Test
        void shouldCompareAtBoundaries() {
            assertThat(Comparator.GTE.test(80.0, 80.0)).isTrue();
            assertThat(Comparator.GT.test(80.0, 80.0)).isFalse();
            assertThat(Comparator.LTE.test(0.0, 0.0)).isTrue();
            assertThat(Comparator.LT.test(0.0, 0.0)).isFalse();
            assertThat(Comparator.EQ.test(7.0, 7.0)).isTrue();
        }
    }

    @Nested
    class EvaluateTest {

        @Test
        void shouldPassWhenNoCriteriaDefined() {
            // When
            CriteriaVerdict verdict = SuccessCriteria.none().evaluate(Map.of());

            // Then
            assertThat(verdict.passed()).isTrue();
            assertThat(verdict.failures()).isEmpty();
        }

        @Test
        void shouldPassWhenEveryCriterionHolds() {
            // Given
            SuccessCriteria criteria =
                    SuccessCriteria.of(
                            Criterion.of("coverage_percent", ">=", 80),
                            Criterion.of("critical_issues", "<=", 0));

            // When
            CriteriaVerdict verdict =
                    criteria.evaluate(Map.of("coverage_percent", 91.5, "critical_issues", 0));

            // Then
            assertThat(verdict.passed()).isTrue();
        }

        @Test
        void shouldReportEachFailedCriterion() {
            // Given
            SuccessCriteria criteria =
                    SuccessCriteria.of(
                            Criterion.of("coverage_percent", ">=", 80),
                            Criterion.of("critical_issues", "<=", 0));

            // When
            CriteriaVerdict verdict =
                    criteria.evaluate(Map.of("coverage_percent", 54.3, "critical_issues", 2));

            // Then
            assertThat(verdict.passed()).isFalse();
            assertThat(verdict.failures()).hasSize(2);
            assertThat(verdict.failures().get(0)).contains("coverage_percent").contains("54.3");
        }

        @Test
        void shouldFailOnMissingOrNonNumericMetric() {
            // Given
            SuccessCriteria criteria =
                    SuccessCriteria.of(
                            Criterion.of("quality_score", ">=", 7),
                            Criterion.of("coverage_percent", ">=", 80));

            // When
            CriteriaVerdict verdict = criteria.evaluate(Map.of("coverage_percent", "high"));

            // Then
            assertThat(verdict.passed()).isFalse();
            assertThat(verdict.failures())
                    .anySatisfy(f -> assertThat(f).contains("missing"))
                    .anySatisfy(f -> assertThat(f).contains("not numeric"));
        }
    }
}
