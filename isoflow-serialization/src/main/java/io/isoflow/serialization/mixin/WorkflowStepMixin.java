package io.isoflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.isoflow.core.model.WorkflowStep;

/// Binds `WorkflowStep` deserialization to its builder.
///
/// Applied to `WorkflowStep.class` via `IsoflowJacksonModule.setupModule()`.
/// `isDecision()` is derived from the category and is not written.
///
/// @see WorkflowStepBuilderMixin
@JsonDeserialize(builder = WorkflowStep.Builder.class)
public abstract class WorkflowStepMixin {

    @JsonIgnore
    public abstract boolean isDecision();
}
