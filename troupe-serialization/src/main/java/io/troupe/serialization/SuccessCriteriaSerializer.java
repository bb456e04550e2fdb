package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.troupe.core.criteria.Criterion;
import io.troupe.core.criteria.SuccessCriteria;
import java.io.IOException;
import java.io.Serial;

/**
 * Writes {@link SuccessCriteria} as an array of criteria with symbolic comparators.
 *
 * <pre>
 * [{"metric": "coverage_percent", "comparator": "&gt;=", "threshold": 80.0}]
 * </pre>
 */
class SuccessCriteriaSerializer extends StdSerializer<SuccessCriteria> {

    @Serial private static final long serialVersionUID = 1862405591385306142L;

    SuccessCriteriaSerializer() {
        super(SuccessCriteria.class);
    }

    @Override
    public void serialize(SuccessCriteria criteria, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (Criterion criterion : criteria.criteria()) {
            gen.writeStartObject();
            gen.writeStringField("metric", criterion.metric());
            gen.writeStringField("comparator", criterion.comparator().symbol());
            gen.writeNumberField("threshold", criterion.threshold());
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
