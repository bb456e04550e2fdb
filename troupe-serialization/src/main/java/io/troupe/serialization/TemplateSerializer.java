package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.troupe.core.template.Template;

/**
 * JSON conversion of {@link Template} definitions.
 *
 * <p>Templates whose conditions or config mappings carry Java functions cannot be written;
 * {@link #toJson} rejects them with an explanation.
 */
public final class TemplateSerializer {

    private TemplateSerializer() {}

    /**
     * Serializes a template.
     *
     * @param template template to write, not null
     * @return indented JSON, never null
     * @throws IllegalArgumentException if the template contains non-serializable parts
     */
    public static String toJson(Template template) {
        try {
            return createMapper().writeValueAsString(template);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize template: " + e.getMessage(), e);
        }
    }

    /**
     * Deserializes a template. The result is not validated.
     *
     * @param json template JSON, not null
     * @return the template, never null
     * @throws IllegalArgumentException if the JSON is malformed or incomplete
     */
    public static Template fromJson(String json) {
        try {
            return createMapper().readValue(json, Template.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize template: " + e.getMessage(), e);
        }
    }

    /**
     * Creates a mapper with the Troupe module and ISO-8601 dates; unknown properties are
     * ignored.
     *
     * @return new mapper, never null
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new TroupeJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
