package io.troupe.core.template;

import java.io.Serial;

public class TemplateNotFoundException extends RuntimeException {
    @Serial private static final long serialVersionUID = 3172840951183470525L;

    public TemplateNotFoundException(String templateId) {
        super("Template not found: " + templateId);
    }
}
