package io.troupe.core.template;

import io.troupe.core.form.FormSchema;
import java.util.List;
import java.util.Objects;

/**
 * A loaded agent-team template: form schema plus ordered composition rules.
 *
 * <p>Templates are loaded once per process by a {@link TemplateSource} and reused across runs.
 * Rule order is significant: it is the order in which agents are composed and, for the
 * sequential and refinement strategies, executed.
 *
 * @implNote Immutable and thread-safe.
 * @see TemplateValidator
 */
public final class Template {

    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final String author;
    private final List<String> tags;
    private final FormSchema formSchema;
    private final List<CompositionRule> rules;

    private Template(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Template ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description != null ? builder.description : "";
        this.version = builder.version != null ? builder.version : "1.0.0";
        this.author = builder.author;
        this.tags = List.copyOf(builder.tags);
        this.formSchema = builder.formSchema != null ? builder.formSchema : FormSchema.empty();
        this.rules = List.copyOf(builder.rules);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    /** Returns the template author, or null when unattributed. */
    public String getAuthor() {
        return author;
    }

    public List<String> getTags() {
        return tags;
    }

    public FormSchema getFormSchema() {
        return formSchema;
    }

    public List<CompositionRule> getRules() {
        return rules;
    }

    public TemplateSummary toSummary() {
        return new TemplateSummary(id, name, description, version, rules.size(), tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String version;
        private String author;
        private List<String> tags = List.of();
        private FormSchema formSchema;
        private List<CompositionRule> rules = List.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags != null ? tags : List.of();
            return this;
        }

        public Builder formSchema(FormSchema formSchema) {
            this.formSchema = formSchema;
            return this;
        }

        public Builder rules(List<CompositionRule> rules) {
            this.rules = rules != null ? rules : List.of();
            return this;
        }

        public Template build() {
            return new Template(this);
        }
    }
}
