package io.isoflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.isoflow.core.model.StepTarget;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Reads `"next"`, `"end"` or a positive step number into a {@link StepTarget}.
///
/// @implNote Package-private. Registered by {@link IsoflowJacksonModule}.
class StepTargetDeserializer extends StdDeserializer<StepTarget> {

    @Serial private static final long serialVersionUID = -2650793392127106215L;

    StepTargetDeserializer() {
        super(StepTarget.class);
    }

    @Override
    public StepTarget deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            int index = p.getIntValue();
            if (index < 1) {
                throw JsonMappingException.from(p, "Step target must be positive: " + index);
            }
            return StepTarget.step(index);
        }

        String value = p.getValueAsString();
        if (value == null) {
            throw JsonMappingException.from(p, "Step target must be a string or a number");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "next" -> StepTarget.next();
            case "end" -> StepTarget.end();
            default -> throw JsonMappingException.from(p, "Unknown step target: " + value);
        };
    }
}
