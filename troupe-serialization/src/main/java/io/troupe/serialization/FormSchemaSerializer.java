package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.troupe.core.form.FormQuestion;
import io.troupe.core.form.FormSchema;
import java.io.IOException;
import java.io.Serial;

/** Writes a {@link FormSchema} as {@code {"questions": [...]}}. */
class FormSchemaSerializer extends StdSerializer<FormSchema> {

    @Serial private static final long serialVersionUID = 5300795337961585873L;

    FormSchemaSerializer() {
        super(FormSchema.class);
    }

    @Override
    public void serialize(FormSchema schema, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeArrayFieldStart("questions");
        for (FormQuestion question : schema.getQuestions()) {
            provider.defaultSerializeValue(question, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
