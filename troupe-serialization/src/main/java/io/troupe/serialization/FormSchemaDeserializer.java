package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.troupe.core.form.FormQuestion;
import io.troupe.core.form.FormSchema;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

class FormSchemaDeserializer extends StdDeserializer<FormSchema> {

    @Serial private static final long serialVersionUID = -1609542420447329013L;

    FormSchemaDeserializer() {
        super(FormSchema.class);
    }

    @Override
    public FormSchema deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        List<FormQuestion> questions = new ArrayList<>();
        JsonNode nodes = root.get("questions");
        if (nodes != null && nodes.isArray()) {
            for (JsonNode node : nodes) {
                questions.add(mapper.treeToValue(node, FormQuestion.class));
            }
        }
        try {
            return FormSchema.of(questions);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
