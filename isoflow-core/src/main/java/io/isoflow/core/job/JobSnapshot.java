package io.isoflow.core.job;

import io.isoflow.core.render.RenderResult;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// Point-in-time view of a render job.
///
/// @param id opaque job id, not null
/// @param status current status, not null
/// @param progress human-readable progress message, not null
/// @param result render result, present only when COMPLETED
/// @param error failure message, present only when FAILED
/// @param createdAt submission time, not null
/// @param updatedAt time of the last status change, not null
public record JobSnapshot(
        String id,
        JobStatus status,
        String progress,
        RenderResult result,
        String error,
        Instant createdAt,
        Instant updatedAt) {

    public JobSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(progress, "progress must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    public Optional<RenderResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
}
