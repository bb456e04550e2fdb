package io.troupe.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.troupe.core.template.Template;

/**
 * Binds {@code Template} deserialization to its builder.
 *
 * @see TemplateBuilderMixin
 */
@JsonDeserialize(builder = Template.Builder.class)
public abstract class TemplateMixin {}
