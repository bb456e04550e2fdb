package io.troupe.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.troupe.core.criteria.Comparator;
import io.troupe.core.criteria.Criterion;
import io.troupe.core.criteria.SuccessCriteria;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

class SuccessCriteriaDeserializer extends StdDeserializer<SuccessCriteria> {

    @Serial private static final long serialVersionUID = -2371165427403617953L;

    SuccessCriteriaDeserializer() {
        super(SuccessCriteria.class);
    }

    @Override
    public SuccessCriteria deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isArray()) {
            throw new IOException("successCriteria must be an array");
        }

        List<Criterion> criteria = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.hasNonNull("metric")
                    || !node.hasNonNull("comparator")
                    || !node.hasNonNull("threshold")) {
                throw new IOException("criterion needs 'metric', 'comparator' and 'threshold'");
            }
            Comparator comparator;
            try {
                comparator = Comparator.parse(node.get("comparator").asText());
            } catch (IllegalArgumentException e) {
                throw new IOException(e.getMessage(), e);
            }
            criteria.add(
                    new Criterion(
                            node.get("metric").asText(),
                            comparator,
                            node.get("threshold").doubleValue()));
        }
        return new SuccessCriteria(criteria);
    }
}
