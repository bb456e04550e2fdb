package io.troupe.core.template;

import java.util.List;

/**
 * Listing entry for a template, as returned by {@link TemplateSource#list()}.
 *
 * @param id template id
 * @param name display name
 * @param description short description, possibly empty
 * @param version template version
 * @param ruleCount number of composition rules
 * @param tags free-form tags
 */
public record TemplateSummary(
        String id,
        String name,
        String description,
        String version,
        int ruleCount,
        List<String> tags) {

    public TemplateSummary {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
