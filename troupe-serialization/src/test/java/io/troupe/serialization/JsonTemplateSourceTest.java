package io.troupe.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.troupe.core.role.DefaultRoleRegistry;
import io.troupe.core.template.Template;
import io.troupe.core.template.TemplateInvalidException;
import io.troupe.core.template.TemplateNotFoundException;
import io.troupe.core.template.TemplateSummary;
import io.troupe.core.template.TemplateValidator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonTemplateSourceTest {

    private static final String HEALTH_JSON =
            """
            {
              "id": "health_check",
              "name": "Project health check",
              "version": "1.0.0",
              "tags": ["health"],
              "formSchema": {
                "questions": [
                  {"id": "has_tests", "text": "Does the project have tests?", "type": "BOOLEAN"}
                ]
              },
              "rules": [
                {"role": "security", "tierStrategy": "cheap_only"},
                {
                  "role": "coverage",
                  "condition": {"type": "required", "responses": {"has_tests": true}},
                  "successCriteria": [
                    {"metric": "coverage_percent", "comparator": ">=", "threshold": 60}
                  ]
                }
              ]
            }
            """;

    @TempDir Path directory;

    private JsonTemplateSource source;

    @BeforeEach
    void setUp() {
        source =
                new JsonTemplateSource(
                        directory, new TemplateValidator(DefaultRoleRegistry.withBuiltins()));
    }

    @Nested
    class Load {

        @Test
        void shouldLoadAndCacheValidTemplate() throws IOException {
            // Given
            write("health_check.json", HEALTH_JSON);

            // When
            Template template = source.load("health_check");

            // Then
            assertThat(template.getName()).isEqualTo("Project health check");
            assertThat(template.getRules()).hasSize(2);
            assertThat(template.getFormSchema().declares("has_tests")).isTrue();
            assertThat(source.load("health_check")).isSameAs(template);
        }

        @Test
        void shouldThrowNotFoundForMissingFile() {
            assertThatThrownBy(() -> source.load("missing"))
                    .isInstanceOf(TemplateNotFoundException.class);
        }

        @Test
        void shouldNotResolveOutsideDirectory() {
            assertThatThrownBy(() -> source.load("../escape"))
                    .isInstanceOf(TemplateNotFoundException.class);
        }

        @Test
        void shouldRejectMalformedJson() throws IOException {
            // Given
            write("broken.json", "{\"id\": \"broken\", \"rules\": [");

            // When / Then
            assertThatThrownBy(() -> source.load("broken"))
                    .isInstanceOf(TemplateInvalidException.class)
                    .satisfies(
                            e ->
                                    assertThat(((TemplateInvalidException) e).getProblems())
                                            .containsExactly("malformed JSON"));
        }

        @Test
        void shouldRejectIdThatDiffersFromFileName() throws IOException {
            // Given
            write("renamed.json", HEALTH_JSON);

            // When / Then
            assertThatThrownBy(() -> source.load("renamed"))
                    .isInstanceOf(TemplateInvalidException.class)
                    .hasMessageContaining("file declares id 'health_check'");
        }

        @Test
        void shouldValidateLoadedTemplate() throws IOException {
            // Given
            write(
                    "astrology.json",
                    "{\"id\": \"astrology\", \"rules\": [{\"role\": \"astrologer\"}]}");

            // When / Then
            assertThatThrownBy(() -> source.load("astrology"))
                    .isInstanceOf(TemplateInvalidException.class)
                    .hasMessageContaining("unknown role");
        }
    }

    @Nested
    class ListTemplates {

        @Test
        void shouldListValidTemplatesAndSkipInvalidOnes() throws IOException {
            // Given
            write("health_check.json", HEALTH_JSON);
            write("broken.json", "not json at all");
            write("notes.txt", "ignored");

            // When / Then
            assertThat(source.list())
                    .singleElement()
                    .satisfies(
                            summary -> {
                                assertThat(summary.id()).isEqualTo("health_check");
                                assertThat(summary.ruleCount()).isEqualTo(2);
                                assertThat(summary.tags()).containsExactly("health");
                            });
        }

        @Test
        void shouldReturnEmptyListForEmptyDirectory() {
            assertThat(source.list()).extracting(TemplateSummary::id).isEmpty();
        }
    }

    @Test
    void shouldRejectMissingDirectory() {
        Path missing = directory.resolve("absent");

        assertThatThrownBy(
                        () ->
                                new JsonTemplateSource(
                                        missing,
                                        new TemplateValidator(
                                                DefaultRoleRegistry.withBuiltins())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a directory");
    }

    // -- Helpers --

    private void write(String fileName, String content) throws IOException {
        Files.writeString(directory.resolve(fileName), content, StandardCharsets.UTF_8);
    }
}
