package io.troupe.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/** Writes and reads {@code TierStrategy} constants by id ({@code "capable_first"}). */
public abstract class TierStrategyMixin {

    @JsonValue
    public abstract String id();
}
