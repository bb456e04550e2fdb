package io.troupe.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.troupe.core.template.CompositionRule;

@JsonDeserialize(builder = CompositionRule.Builder.class)
public abstract class CompositionRuleMixin {}
