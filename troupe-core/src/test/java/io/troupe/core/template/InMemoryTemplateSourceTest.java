package io.troupe.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.troupe.core.role.DefaultRoleRegistry;
import io.troupe.core.routing.TierStrategy;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryTemplateSourceTest {

    private InMemoryTemplateSource source;

    @BeforeEach
    void setUp() {
        source =
                new InMemoryTemplateSource(
                        new TemplateValidator(DefaultRoleRegistry.withBuiltins()));
    }

    @Test
    void shouldLoadRegisteredTemplate() {
        // Given
        Template template = template("health_check");
        source.register(template);

        // When
        Template loaded = source.load("health_check");

        // Then
        assertThat(loaded).isSameAs(template);
    }

    @Test
    void shouldThrowNotFoundForUnknownId() {
        assertThatThrownBy(() -> source.load("nope"))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void shouldRefuseInvalidTemplate() {
        Template invalid = Template.builder().id("invalid").build();

        assertThatThrownBy(() -> source.register(invalid))
                .isInstanceOf(TemplateInvalidException.class);
        assertThat(source.list()).isEmpty();
    }

    @Test
    void shouldListSummariesSortedById() {
        // Given
        source.register(template("release_prep"));
        source.register(template("health_check"));

        // When
        List<TemplateSummary> summaries = source.list();

        // Then
        assertThat(summaries)
                .extracting(TemplateSummary::id)
                .containsExactly("health_check", "release_prep");
        assertThat(summaries.get(0).ruleCount()).isEqualTo(1);
    }

    // -- Helpers --

    private static Template template(String id) {
        return Template.builder()
                .id(id)
                .rules(
                        List.of(
                                CompositionRule.builder()
                                        .role("security")
                                        .tierStrategy(TierStrategy.CHEAP_ONLY)
                                        .build()))
                .build();
    }
}
