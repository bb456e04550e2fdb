package io.troupe.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/** Writes and reads {@code Tier} constants by their lowercase id ({@code "cheap"}). */
public abstract class TierMixin {

    @JsonValue
    public abstract String id();
}
