package io.troupe.core.template;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * In-memory template source (default implementation).
 *
 * <p>Templates are validated when registered, so {@link #load(String)} only ever returns valid
 * templates. Registering a template with an existing id replaces the previous definition.
 *
 * @implNote Thread-safe. Uses {@link ConcurrentHashMap} for storage.
 */
public final class InMemoryTemplateSource implements TemplateSource {

    private static final Logger logger = Logger.getLogger(InMemoryTemplateSource.class.getName());

    private final Map<String, Template> templates = new ConcurrentHashMap<>();
    private final TemplateValidator validator;

    public InMemoryTemplateSource(TemplateValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Validates and stores a template.
     *
     * @param template template to register, not null
     * @throws TemplateInvalidException if validation fails
     */
    public void register(Template template) {
        Objects.requireNonNull(template, "template must not be null");
        validator.validate(template);
        if (templates.put(template.getId(), template) != null) {
            logger.warning("Replaced template: " + template.getId());
        } else {
            logger.info("Registered template: " + template.getId());
        }
    }

    @Override
    public Template load(String templateId) {
        Objects.requireNonNull(templateId, "templateId must not be null");
        Template template = templates.get(templateId);
        if (template == null) {
            throw new TemplateNotFoundException(templateId);
        }
        return template;
    }

    @Override
    public List<TemplateSummary> list() {
        return templates.values().stream()
                .map(Template::toSummary)
                .sorted(Comparator.comparing(TemplateSummary::id))
                .toList();
    }
}
