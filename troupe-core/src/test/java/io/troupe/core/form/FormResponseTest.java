package io.troupe.core.form;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FormResponseTest {

    @Test
    void shouldAssignResponseIdAndTimestampWhenAbsent() {
        // When
        FormResponse response = FormResponse.of("release_prep", Map.of("has_tests", true));

        // Then
        assertThat(response.getResponseId()).startsWith("resp-");
        assertThat(response.getTimestamp()).isNotNull();
        assertThat(response.getTemplateId()).isEqualTo("release_prep");
    }

    @Test
    void shouldRequireTemplateId() {
        assertThatThrownBy(() -> FormResponse.builder().answer("a", 1).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Template ID");
    }

    @Test
    void shouldExposeTypedLookups() {
        // Given
        FormResponse response =
                FormResponse.builder()
                        .templateId("health_check")
                        .answer("language", "java")
                        .answer("has_tests", "Yes")
                        .answer("checks", List.of("security", "coverage"))
                        .build();

        // Then
        assertThat(response.getString("language")).contains("java");
        assertThat(response.getBoolean("has_tests")).contains(true);
        assertThat(response.getList("checks")).containsExactly("security", "coverage");
        assertThat(response.getList("language")).containsExactly("java");
        assertThat(response.getList("missing")).isEmpty();
        assertThat(response.get("missing", "fallback")).isEqualTo("fallback");
    }

    @Nested
    class MatchesTest {

        @Test
        void shouldNotMatchAbsentAnswer() {
            FormResponse response = FormResponse.of("t", Map.of());

            assertThat(response.matches("has_tests", true)).isFalse();
        }

        @Test
        void shouldMatchBooleansAgainstYesNoStrings() {
            FormResponse response = FormResponse.of("t", Map.of("has_tests", "Yes", "ci", false));

            assertThat(response.matches("has_tests", true)).isTrue();
            assertThat(response.matches("has_tests", false)).isFalse();
            assertThat(response.matches("ci", "No")).isTrue();
        }

        @Test
        void shouldMatchListAnswerContainingExpectedValue() {
            FormResponse response =
                    FormResponse.of("t", Map.of("checks", List.of("security", "coverage")));

            assertThat(response.matches("checks", "coverage")).isTrue();
            assertThat(response.matches("checks", "docs")).isFalse();
            assertThat(response.matches("checks", List.of("security", "coverage"))).isTrue();
        }

        @Test
        void shouldMatchNumbersByValue() {
            FormResponse response = FormResponse.of("t", Map.of("depth", 3));

            assertThat(response.matches("depth", 3.0)).isTrue();
            assertThat(response.matches("depth", 4)).isFalse();
        }

        @Test
        void shouldMatchScalarsByStringEquality() {
            FormResponse response = FormResponse.of("t", Map.of("registry", "pypi"));

            assertThat(response.matches("registry", "pypi")).isTrue();
            assertThat(response.matches("registry", "npm")).isFalse();
        }
    }
}
