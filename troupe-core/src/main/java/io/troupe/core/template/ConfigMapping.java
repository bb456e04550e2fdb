package io.troupe.core.template;

import io.troupe.core.form.FormResponse;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns a form response into the config map handed to an agent.
 *
 * <p>Application order:
 *
 * <ol>
 *   <li>static {@code defaults} are copied
 *   <li>each {@code question id -> config key} field is copied when the answer is present;
 *       absent answers leave the default in place
 *   <li>the optional custom function's output is merged last
 * </ol>
 *
 * <p>The mapping declares every response key it reads ({@link #readKeys()}), which lets
 * template validation reject mappings that reference questions the schema does not define.
 *
 * @implNote Immutable. The custom function must be side-effect free; any exception it throws is
 *     reported by the composer as a skipped rule.
 */
public final class ConfigMapping {

    private static final ConfigMapping EMPTY = builder().build();

    private final Map<String, String> fields;
    private final Map<String, Object> defaults;
    private final Function<FormResponse, Map<String, Object>> custom;
    private final Set<String> customReads;

    private ConfigMapping(Builder builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
        this.custom = builder.custom;
        this.customReads = Set.copyOf(builder.customReads);
    }

    public static ConfigMapping empty() {
        return EMPTY;
    }

    public static ConfigMapping of(Map<String, String> fields) {
        return builder().fields(fields).build();
    }

    /**
     * Builds the agent config for a response.
     *
     * @param response user answers, not null
     * @return new mutable-safe config map, never null
     * @throws RuntimeException whatever the custom function throws
     */
    public Map<String, Object> apply(FormResponse response) {
        Map<String, Object> config = new LinkedHashMap<>(defaults);
        for (Map.Entry<String, String> field : fields.entrySet()) {
            response.get(field.getKey()).ifPresent(value -> config.put(field.getValue(), value));
        }
        if (custom != null) {
            Map<String, Object> extra = custom.apply(response);
            if (extra != null) {
                config.putAll(extra);
            }
        }
        return config;
    }

    /**
     * Returns every response key this mapping may read.
     *
     * @return declared keys, never null
     */
    public Set<String> readKeys() {
        Set<String> keys = new HashSet<>(fields.keySet());
        keys.addAll(customReads);
        return Collections.unmodifiableSet(keys);
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public Map<String, Object> getDefaults() {
        return defaults;
    }

    public boolean hasCustomFunction() {
        return custom != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, String> fields = new LinkedHashMap<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private Function<FormResponse, Map<String, Object>> custom;
        private final Set<String> customReads = new HashSet<>();

        private Builder() {}

        public Builder field(String questionId, String configKey) {
            fields.put(
                    Objects.requireNonNull(questionId, "questionId must not be null"),
                    Objects.requireNonNull(configKey, "configKey must not be null"));
            return this;
        }

        public Builder fields(Map<String, String> mapping) {
            if (mapping != null) {
                mapping.forEach(this::field);
            }
            return this;
        }

        public Builder defaultValue(String configKey, Object value) {
            defaults.put(Objects.requireNonNull(configKey, "configKey must not be null"), value);
            return this;
        }

        public Builder defaults(Map<String, Object> values) {
            if (values != null) {
                values.forEach(this::defaultValue);
            }
            return this;
        }

        /**
         * Adds a custom mapping function.
         *
         * @param readKeys response keys the function reads, not null
         * @param function mapping function, not null
         * @return this builder for chaining, never null
         */
        public Builder custom(
                Set<String> readKeys, Function<FormResponse, Map<String, Object>> function) {
            this.custom = Objects.requireNonNull(function, "function must not be null");
            this.customReads.addAll(Objects.requireNonNull(readKeys, "readKeys must not be null"));
            return this;
        }

        public ConfigMapping build() {
            return new ConfigMapping(this);
        }
    }
}
