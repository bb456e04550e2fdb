package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.troupe.core.template.ResponseCondition;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/**
 * Writes a {@link ResponseCondition} with a {@code type} discriminator.
 *
 * <pre>
 * {"type": "always"}
 * {"type": "required", "responses": {"has_tests": true}}
 * </pre>
 *
 * Custom conditions hold a Java predicate and cannot be written.
 */
class ResponseConditionSerializer extends StdSerializer<ResponseCondition> {

    @Serial private static final long serialVersionUID = 3605871946279930248L;

    ResponseConditionSerializer() {
        super(ResponseCondition.class);
    }

    @Override
    public void serialize(
            ResponseCondition condition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (condition instanceof ResponseCondition.Custom custom) {
            throw JsonMappingException.from(
                    gen,
                    "Custom condition '"
                            + custom.description()
                            + "' wraps a Java predicate and cannot be serialized;"
                            + " express it as a 'required' condition instead");
        }
        gen.writeStartObject();
        if (condition instanceof ResponseCondition.RequiredResponses required) {
            gen.writeStringField("type", "required");
            gen.writeObjectFieldStart("responses");
            for (Map.Entry<String, Object> entry : required.expected().entrySet()) {
                gen.writeFieldName(entry.getKey());
                provider.defaultSerializeValue(entry.getValue(), gen);
            }
            gen.writeEndObject();
        } else {
            gen.writeStringField("type", "always");
        }
        gen.writeEndObject();
    }
}
