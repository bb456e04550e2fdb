package io.troupe.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

@JsonPOJOBuilder(withPrefix = "")
public abstract class CompositionRuleBuilderMixin {}
