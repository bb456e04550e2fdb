package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.troupe.core.template.ResponseCondition;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/** Reads the {@code type}-discriminated form written by {@link ResponseConditionSerializer}. */
class ResponseConditionDeserializer extends StdDeserializer<ResponseCondition> {

    @Serial private static final long serialVersionUID = -4418050378924370561L;

    private static final TypeReference<Map<String, Object>> RESPONSES = new TypeReference<>() {};

    ResponseConditionDeserializer() {
        super(ResponseCondition.class);
    }

    @Override
    public ResponseCondition deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null) {
            throw new IOException("ResponseCondition requires a 'type' field");
        }
        String type = typeNode.asText();
        return switch (type) {
            case "always" -> ResponseCondition.always();
            case "required" -> {
                JsonNode responses = root.get("responses");
                if (responses == null || !responses.isObject() || responses.isEmpty()) {
                    throw new IOException("'required' condition needs a 'responses' object");
                }
                yield ResponseCondition.required(mapper.convertValue(responses, RESPONSES));
            }
            default -> throw new IOException("Unknown ResponseCondition type: " + type);
        };
    }
}
