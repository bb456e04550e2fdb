package io.troupe.core.template;

import java.util.List;

/**
 * Boundary for loading templates.
 *
 * <p>Implementations must only return fully validated templates. Loading problems are reported
 * with unchecked exceptions because they are configuration errors that abort a run before it
 * starts.
 *
 * @see InMemoryTemplateSource
 */
public interface TemplateSource {

    /**
     * Loads a template by id.
     *
     * @param templateId template id, not null
     * @return the validated template, never null
     * @throws TemplateNotFoundException if no template has this id
     * @throws TemplateInvalidException if the stored definition is invalid
     */
    Template load(String templateId);

    /**
     * Lists every available template.
     *
     * @return summaries in a stable order, never null
     */
    List<TemplateSummary> list();
}
