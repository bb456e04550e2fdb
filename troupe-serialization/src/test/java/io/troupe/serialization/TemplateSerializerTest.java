package io.troupe.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.troupe.core.criteria.Criterion;
import io.troupe.core.criteria.SuccessCriteria;
import io.troupe.core.form.FormQuestion;
import io.troupe.core.form.FormSchema;
import io.troupe.core.form.QuestionType;
import io.troupe.core.routing.TierStrategy;
import io.troupe.core.template.CompositionRule;
import io.troupe.core.template.ConfigMapping;
import io.troupe.core.template.ResponseCondition;
import io.troupe.core.template.Template;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Round-trip tests for template JSON.
 *
 * @see TroupeJacksonModule for the registered serializers and mixins
 */
class TemplateSerializerTest {

    @Nested
    class RoundTrip {

        @Test
        void roundTrip_preservesMetadataAndSchema() {
            Template restored = TemplateSerializer.fromJson(TemplateSerializer.toJson(release()));

            assertThat(restored.getId()).isEqualTo("release_prep");
            assertThat(restored.getName()).isEqualTo("Release preparation");
            assertThat(restored.getVersion()).isEqualTo("1.2.0");
            assertThat(restored.getTags()).containsExactly("release", "ci");
            assertThat(restored.getFormSchema().getQuestions())
                    .extracting(FormQuestion::id, FormQuestion::type)
                    .containsExactly(
                            tuple("has_tests", QuestionType.BOOLEAN),
                            tuple("language", QuestionType.SINGLE_SELECT));
            assertThat(restored.getFormSchema().find("language").orElseThrow().options())
                    .containsExactly("java", "python");
        }

        @Test
        void roundTrip_preservesRules() {
            Template restored = TemplateSerializer.fromJson(TemplateSerializer.toJson(release()));

            assertThat(restored.getRules()).hasSize(2);
            CompositionRule tests = restored.getRules().get(0);
            assertThat(tests.getRole()).isEqualTo("test_runner");
            assertThat(tests.getCondition())
                    .isEqualTo(ResponseCondition.required("has_tests", true));
            assertThat(tests.getTierStrategy()).isEqualTo(TierStrategy.CAPABLE_FIRST);
            assertThat(tests.getTools()).containsExactly("pytest");
            assertThat(tests.getSuccessCriteria())
                    .isEqualTo(SuccessCriteria.of(Criterion.of("coverage_percent", ">=", 80)));
            assertThat(tests.getConfigMapping().getFields()).containsEntry("language", "lang");
            assertThat(tests.getConfigMapping().getDefaults()).containsEntry("timeout", 60);

            CompositionRule publisher = restored.getRules().get(1);
            assertThat(publisher.getCondition()).isEqualTo(ResponseCondition.always());
            assertThat(publisher.getDependsOn()).containsExactly("test_runner");
            assertThat(publisher.getTierStrategy()).isEqualTo(TierStrategy.PROGRESSIVE);
        }

        @Test
        void toJson_writesTierStrategyById() {
            String json = TemplateSerializer.toJson(release());

            assertThat(json).contains("\"capable_first\"").contains("\"required\"");
        }
    }

    @Nested
    class Defaults {

        @Test
        void fromJson_appliesRuleDefaults() {
            String json = "{\"id\": \"minimal\", \"rules\": [{\"role\": \"writer\"}]}";

            Template template = TemplateSerializer.fromJson(json);

            CompositionRule rule = template.getRules().get(0);
            assertThat(rule.getCondition()).isEqualTo(ResponseCondition.always());
            assertThat(rule.getTierStrategy()).isEqualTo(TierStrategy.PROGRESSIVE);
            assertThat(rule.getSuccessCriteria().isEmpty()).isTrue();
            assertThat(rule.getBaseTemplate()).isEqualTo("writer");
        }

        @Test
        void fromJson_ignoresUnknownProperties() {
            String json =
                    "{\"id\": \"t\", \"owner\": \"ops\", \"rules\": [{\"role\": \"writer\"}]}";

            assertThat(TemplateSerializer.fromJson(json).getId()).isEqualTo("t");
        }
    }

    @Nested
    class Rejections {

        @Test
        void toJson_rejectsCustomCondition() {
            Template template =
                    Template.builder()
                            .id("custom")
                            .rules(
                                    List.of(
                                            CompositionRule.builder()
                                                    .role("writer")
                                                    .condition(
                                                            ResponseCondition.custom(
                                                                    "weekday only",
                                                                    Set.of(),
                                                                    r -> true))
                                                    .build()))
                            .build();

            assertThatThrownBy(() -> TemplateSerializer.toJson(template))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("weekday only")
                    .hasMessageContaining("cannot be serialized");
        }

        @Test
        void toJson_rejectsCustomConfigMapping() {
            Template template =
                    Template.builder()
                            .id("custom")
                            .rules(
                                    List.of(
                                            CompositionRule.builder()
                                                    .role("writer")
                                                    .configMapping(
                                                            ConfigMapping.builder()
                                                                    .custom(
                                                                            Set.of("topic"),
                                                                            r -> Map.of())
                                                                    .build())
                                                    .build()))
                            .build();

            assertThatThrownBy(() -> TemplateSerializer.toJson(template))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("custom function");
        }

        @Test
        void fromJson_rejectsUnknownConditionType() {
            String json =
                    "{\"id\": \"t\", \"rules\": [{\"role\": \"writer\","
                            + " \"condition\": {\"type\": \"sometimes\"}}]}";

            assertThatThrownBy(() -> TemplateSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sometimes");
        }

        @Test
        void fromJson_rejectsUnknownComparator() {
            String json =
                    "{\"id\": \"t\", \"rules\": [{\"role\": \"writer\", \"successCriteria\":"
                            + " [{\"metric\": \"score\", \"comparator\": \"~\","
                            + " \"threshold\": 1}]}]}";

            assertThatThrownBy(() -> TemplateSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void fromJson_rejectsMalformedJson() {
            assertThatThrownBy(() -> TemplateSerializer.fromJson("{\"id\": "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize template");
        }
    }

    // -- Helpers --

    private static Template release() {
        return Template.builder()
                .id("release_prep")
                .name("Release preparation")
                .description("Checks a project before tagging a release")
                .version("1.2.0")
                .author("release-team")
                .tags(List.of("release", "ci"))
                .formSchema(
                        FormSchema.of(
                                FormQuestion.bool("has_tests", "Does the project have tests?"),
                                FormQuestion.singleSelect(
                                        "language", "Main language", List.of("java", "python"))))
                .rules(
                        List.of(
                                CompositionRule.builder()
                                        .role("test_runner")
                                        .condition(ResponseCondition.required("has_tests", true))
                                        .configMapping(
                                                ConfigMapping.builder()
                                                        .field("language", "lang")
                                                        .defaultValue("timeout", 60)
                                                        .build())
                                        .tierStrategy(TierStrategy.CAPABLE_FIRST)
                                        .tools(List.of("pytest"))
                                        .successCriteria(
                                                SuccessCriteria.of(
                                                        Criterion.of(
                                                                "coverage_percent", ">=", 80)))
                                        .build(),
                                CompositionRule.builder()
                                        .role("publisher")
                                        .dependsOn(List.of("test_runner"))
                                        .build()))
                .build();
    }
}
