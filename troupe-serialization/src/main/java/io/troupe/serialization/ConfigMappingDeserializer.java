package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.troupe.core.template.ConfigMapping;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

class ConfigMappingDeserializer extends StdDeserializer<ConfigMapping> {

    @Serial private static final long serialVersionUID = 7717280993407136217L;

    private static final TypeReference<Map<String, String>> FIELDS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> DEFAULTS = new TypeReference<>() {};

    ConfigMappingDeserializer() {
        super(ConfigMapping.class);
    }

    @Override
    public ConfigMapping deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        ConfigMapping.Builder builder = ConfigMapping.builder();
        if (root.hasNonNull("fields")) {
            builder.fields(mapper.convertValue(root.get("fields"), FIELDS));
        }
        if (root.hasNonNull("defaults")) {
            builder.defaults(mapper.convertValue(root.get("defaults"), DEFAULTS));
        }
        return builder.build();
    }
}
