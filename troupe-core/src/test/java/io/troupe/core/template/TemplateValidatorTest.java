package io.troupe.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.troupe.core.form.FormQuestion;
import io.troupe.core.form.FormSchema;
import io.troupe.core.role.DefaultRoleRegistry;
import io.troupe.core.routing.TierStrategy;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TemplateValidatorTest {

    private TemplateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TemplateValidator(DefaultRoleRegistry.withBuiltins());
    }

    @Nested
    class FindProblemsTest {

        @Test
        void shouldAcceptWellFormedTemplate() {
            // Given
            Template template =
                    Template.builder()
                            .id("release_prep")
                            .formSchema(FormSchema.of(FormQuestion.bool("has_tests", "Tests?")))
                            .rules(
                                    List.of(
                                            rule("test_runner")
                                                    .condition(
                                                            ResponseCondition.required(
                                                                    "has_tests", true))
                                                    .build(),
                                            rule("publisher")
                                                    .dependsOn(List.of("test_runner"))
                                                    .build()))
                            .build();

            // Then
            assertThat(validator.findProblems(template)).isEmpty();
            assertThat(validator.validate(template)).isSameAs(template);
        }

        @Test
        void shouldRejectTemplateWithoutRules() {
            Template template = Template.builder().id("empty").build();

            assertThat(validator.findProblems(template))
                    .containsExactly("template defines no composition rules");
        }

        @Test
        void shouldReportDuplicateAndUnknownRoles() {
            // Given
            Template template =
                    Template.builder()
                            .id("broken")
                            .rules(
                                    List.of(
                                            rule("security").build(),
                                            rule("security").build(),
                                            rule("astrologer").build()))
                            .build();

            // When
            List<String> problems = validator.findProblems(template);

            // Then
            assertThat(problems)
                    .contains("duplicate role 'security'")
                    .contains("rule 'astrologer' uses an unknown role");
        }

        @Test
        void shouldReportUndeclaredKeys() {
            // Given
            Template template =
                    Template.builder()
                            .id("keys")
                            .formSchema(FormSchema.of(FormQuestion.bool("has_tests", "Tests?")))
                            .rules(
                                    List.of(
                                            rule("coverage")
                                                    .condition(
                                                            ResponseCondition.required(
                                                                    "has_coverage", true))
                                                    .configMapping(
                                                            ConfigMapping.builder()
                                                                    .field("threshold", "min")
                                                                    .build())
                                                    .build()))
                            .build();

            // Then
            assertThat(validator.findProblems(template))
                    .containsExactly(
                            "rule 'coverage' reads undeclared keys [has_coverage, threshold]");
        }

        @Test
        void shouldReportBadDependencies() {
            // Given
            Template template =
                    Template.builder()
                            .id("deps")
                            .rules(
                                    List.of(
                                            rule("publisher")
                                                    .dependsOn(List.of("publisher", "test_runner"))
                                                    .build()))
                            .build();

            // Then
            assertThat(validator.findProblems(template))
                    .containsExactly(
                            "rule 'publisher' depends on itself",
                            "rule 'publisher' depends on unknown role 'test_runner'");
        }
    }

    @Test
    void shouldThrowWithAllProblemsOnValidate() {
        Template template = Template.builder().id("empty").build();

        assertThatThrownBy(() -> validator.validate(template))
                .isInstanceOf(TemplateInvalidException.class)
                .satisfies(
                        e -> {
                            TemplateInvalidException invalid = (TemplateInvalidException) e;
                            assertThat(invalid.getTemplateId()).isEqualTo("empty");
                            assertThat(invalid.getProblems()).hasSize(1);
                        });
    }

    // -- Helpers --

    private static CompositionRule.Builder rule(String role) {
        return CompositionRule.builder().role(role).tierStrategy(TierStrategy.PROGRESSIVE);
    }
}
