package io.troupe.core.compose;

import static org.assertj.core.api.Assertions.assertThat;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.criteria.Criterion;
import io.troupe.core.criteria.SuccessCriteria;
import io.troupe.core.form.FormResponse;
import io.troupe.core.role.DefaultRoleRegistry;
import io.troupe.core.routing.TierStrategy;
import io.troupe.core.template.CompositionRule;
import io.troupe.core.template.ConfigMapping;
import io.troupe.core.template.ResponseCondition;
import io.troupe.core.template.Template;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AgentComposerTest {

    private AgentComposer composer;

    @BeforeEach
    void setUp() {
        composer = new AgentComposer(DefaultRoleRegistry.withBuiltins());
    }

    @Nested
    class ComposeTest {

        @Test
        void shouldSkipRuleWhoseConditionDoesNotHold() {
            // Given
            Template template = releaseTemplate();
            FormResponse response = FormResponse.of("release_prep", Map.of("has_tests", false));

            // When
            CompositionResult result = composer.compose(template, response);

            // Then
            assertThat(result.specs()).extracting(AgentSpec::getRole).containsExactly("publisher");
            assertThat(result.stats()).isEqualTo(new CompositionStats(2, 1, 1));
            assertThat(result.skipped())
                    .containsExactly(new SkippedRule("test_runner", SkippedRule.CONDITION_NOT_MET));
        }

        @Test
        void shouldCreateAgentForEveryMatchingRule() {
            // Given
            FormResponse response = FormResponse.of("release_prep", Map.of("has_tests", "Yes"));

            // When
            CompositionResult result = composer.compose(releaseTemplate(), response);

            // Then
            assertThat(result.specs())
                    .extracting(AgentSpec::getRole)
                    .containsExactly("test_runner", "publisher");
            assertThat(result.stats().rulesSkipped()).isZero();
            assertThat(result.specFor("publisher").orElseThrow().getDependsOn())
                    .containsExactly("test_runner");
        }

        @Test
        void shouldCopyRuleSettingsIntoSpec() {
            // Given
            SuccessCriteria criteria =
                    SuccessCriteria.of(Criterion.of("coverage_percent", ">=", 80));
            Template template =
                    template(
                            CompositionRule.builder()
                                    .role("coverage")
                                    .tierStrategy(TierStrategy.CAPABLE_FIRST)
                                    .tools(List.of("pytest-cov"))
                                    .successCriteria(criteria)
                                    .configMapping(
                                            ConfigMapping.builder()
                                                    .field("min_coverage", "threshold")
                                                    .defaultValue("report", "xml")
                                                    .build())
                                    .build());
            FormResponse response = FormResponse.of("t", Map.of("min_coverage", 85));

            // When
            AgentSpec spec = composer.compose(template, response).specs().get(0);

            // Then
            assertThat(spec.getAgentId()).matches("agent-[0-9a-f]{8}");
            assertThat(spec.getTierStrategy()).isEqualTo(TierStrategy.CAPABLE_FIRST);
            assertThat(spec.getTools()).containsExactly("pytest-cov");
            assertThat(spec.getSuccessCriteria()).isEqualTo(criteria);
            assertThat(spec.getConfig())
                    .containsEntry("threshold", 85)
                    .containsEntry("report", "xml");
        }

        @Test
        void shouldSkipUnknownRoleAndKeepComposing() {
            // Given
            Template template = template(rule("astrologer").build(), rule("security").build());

            // When
            CompositionResult result = composer.compose(template, FormResponse.of("t", Map.of()));

            // Then
            assertThat(result.specs()).extracting(AgentSpec::getRole).containsExactly("security");
            assertThat(result.skipped()).hasSize(1);
            assertThat(result.skipped().get(0).role()).isEqualTo("astrologer");
            assertThat(result.skipped().get(0).reason()).contains("unknown role");
        }

        @Test
        void shouldSkipRuleWhoseConditionThrows() {
            // Given
            Template template =
                    template(
                            rule("security")
                                    .condition(
                                            ResponseCondition.custom(
                                                    "explodes",
                                                    Set.of(),
                                                    r -> {
                                                        throw new IllegalStateException("kaboom");
                                                    }))
                                    .build());

            // When
            CompositionResult result = composer.compose(template, FormResponse.of("t", Map.of()));

            // Then
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.skipped().get(0).reason()).contains("kaboom");
            assertThat(result.stats()).isEqualTo(new CompositionStats(1, 0, 1));
        }

        @Test
        void shouldSkipRuleWhoseConfigMappingThrows() {
            // Given
            Template template =
                    template(
                            rule("security")
                                    .configMapping(
                                            ConfigMapping.builder()
                                                    .custom(
                                                            Set.of(),
                                                            r -> {
                                                                throw new IllegalArgumentException(
                                                                        "bad mapping");
                                                            })
                                                    .build())
                                    .build());

            // When
            CompositionResult result = composer.compose(template, FormResponse.of("t", Map.of()));

            // Then
            assertThat(result.specs()).isEmpty();
            assertThat(result.skipped().get(0).reason())
                    .startsWith("config mapping failed")
                    .contains("bad mapping");
        }
    }

    @Nested
    class StatsTest {

        @Test
        void shouldAccumulateAcrossCompositions() {
            // Given
            Template template = releaseTemplate();

            // When
            composer.compose(template, FormResponse.of("t", Map.of("has_tests", true)));
            composer.compose(template, FormResponse.of("t", Map.of("has_tests", false)));

            // Then
            assertThat(composer.getCumulativeStats()).isEqualTo(new CompositionStats(4, 3, 1));
        }

        @Test
        void shouldResetCumulativeStats() {
            // Given
            composer.compose(releaseTemplate(), FormResponse.of("t", Map.of()));

            // When
            composer.resetStats();

            // Then
            assertThat(composer.getCumulativeStats()).isEqualTo(CompositionStats.EMPTY);
        }
    }

    // -- Helpers --

    private static CompositionRule.Builder rule(String role) {
        return CompositionRule.builder().role(role).tierStrategy(TierStrategy.PROGRESSIVE);
    }

    private static Template template(CompositionRule... rules) {
        return Template.builder().id("t").rules(List.of(rules)).build();
    }

    private static Template releaseTemplate() {
        return Template.builder()
                .id("release_prep")
                .rules(
                        List.of(
                                rule("test_runner")
                                        .condition(ResponseCondition.required("has_tests", true))
                                        .build(),
                                rule("publisher").dependsOn(List.of("test_runner")).build()))
                .build();
    }
}
