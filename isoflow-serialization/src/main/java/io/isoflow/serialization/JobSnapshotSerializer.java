package io.isoflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.isoflow.core.job.JobSnapshot;
import io.isoflow.core.render.AttemptFailure;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.RenderResult;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link JobSnapshot} as a status payload for polling clients.
///
/// The artifact itself is left out; only its metadata is written. Timestamps go through
/// the mapper's `java.time` support.
///
/// ```
/// Field        Present when
/// ———————————————+——————————————————————————————
/// id, status,  │ always
/// progress,    │
/// createdAt,   │
/// updatedAt    │
/// render       │ status is COMPLETED
/// error        │ status is FAILED
/// ```
///
/// @implNote Package-private. Registered by {@link IsoflowJacksonModule}.
class JobSnapshotSerializer extends StdSerializer<JobSnapshot> {

    @Serial private static final long serialVersionUID = -7395512863604207019L;

    JobSnapshotSerializer() {
        super(JobSnapshot.class);
    }

    @Override
    public void serialize(JobSnapshot job, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", job.id());
        gen.writeStringField("status", job.status().name());
        gen.writeStringField("progress", job.progress());
        provider.defaultSerializeField("createdAt", job.createdAt(), gen);
        provider.defaultSerializeField("updatedAt", job.updatedAt(), gen);

        if (job.result() != null) {
            writeRender(job.result(), gen);
        }
        if (job.error() != null) {
            gen.writeStringField("error", job.error());
        }
        gen.writeEndObject();
    }

    private static void writeRender(RenderResult render, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("render");
        gen.writeStringField("backend", render.resolvedBackend().getName());
        gen.writeStringField("format", render.format().name());
        gen.writeStringField("mediaType", render.format().getMediaType());
        gen.writeNumberField("size", render.artifactBytes().length);
        gen.writeBooleanField("integrityChecked", render.integrityChecked());

        gen.writeArrayFieldStart("fallbackChainTried");
        for (BackendId backend : render.fallbackChainTried()) {
            gen.writeString(backend.getName());
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("warnings");
        for (String warning : render.warnings()) {
            gen.writeString(warning);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("failures");
        for (AttemptFailure failure : render.failures()) {
            gen.writeStartObject();
            gen.writeStringField("backend", failure.backend().getName());
            gen.writeStringField("errorType", failure.errorType());
            gen.writeStringField("message", failure.message());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
