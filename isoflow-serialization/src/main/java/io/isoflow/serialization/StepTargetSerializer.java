package io.isoflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.isoflow.core.model.StepTarget;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link StepTarget} as `"next"`, `"end"` or the bare step number.
///
/// @implNote Package-private. Registered by {@link IsoflowJacksonModule}.
class StepTargetSerializer extends StdSerializer<StepTarget> {

    @Serial private static final long serialVersionUID = 1784417364013377350L;

    StepTargetSerializer() {
        super(StepTarget.class);
    }

    @Override
    public void serialize(StepTarget target, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (target instanceof StepTarget.Step step) {
            gen.writeNumber(step.index());
        } else if (target instanceof StepTarget.End) {
            gen.writeString("end");
        } else {
            gen.writeString("next");
        }
    }
}
