package io.troupe.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/** Maps JSON field names directly to {@code Template.Builder} methods. */
@JsonPOJOBuilder(withPrefix = "")
public abstract class TemplateBuilderMixin {}
