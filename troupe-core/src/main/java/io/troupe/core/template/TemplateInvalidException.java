package io.troupe.core.template;

import java.io.Serial;
import java.util.List;

/** Raised when a template definition fails validation or cannot be parsed. */
public class TemplateInvalidException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2283311547791660921L;

    private final String templateId;
    private final List<String> problems;

    public TemplateInvalidException(String templateId, List<String> problems) {
        super("Template '" + templateId + "' is invalid: " + String.join("; ", problems));
        this.templateId = templateId;
        this.problems = List.copyOf(problems);
    }

    public TemplateInvalidException(String templateId, String problem, Throwable cause) {
        super("Template '" + templateId + "' is invalid: " + problem, cause);
        this.templateId = templateId;
        this.problems = List.of(problem);
    }

    public String getTemplateId() {
        return templateId;
    }

    public List<String> getProblems() {
        return problems;
    }
}
