package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.troupe.core.template.ConfigMapping;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/**
 * Writes a {@link ConfigMapping} as {@code {"fields": {...}, "defaults": {...}}}. Mappings with
 * a custom function cannot be written.
 */
class ConfigMappingSerializer extends StdSerializer<ConfigMapping> {

    @Serial private static final long serialVersionUID = -6992254104511806734L;

    ConfigMappingSerializer() {
        super(ConfigMapping.class);
    }

    @Override
    public void serialize(ConfigMapping mapping, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (mapping.hasCustomFunction()) {
            throw JsonMappingException.from(
                    gen, "ConfigMapping with a custom function cannot be serialized");
        }
        gen.writeStartObject();
        gen.writeObjectFieldStart("fields");
        for (Map.Entry<String, String> field : mapping.getFields().entrySet()) {
            gen.writeStringField(field.getKey(), field.getValue());
        }
        gen.writeEndObject();
        gen.writeObjectFieldStart("defaults");
        for (Map.Entry<String, Object> entry : mapping.getDefaults().entrySet()) {
            gen.writeFieldName(entry.getKey());
            provider.defaultSerializeValue(entry.getValue(), gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
