package io.isoflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.isoflow.core.model.Branch;

/// Lets Jackson call `WorkflowStep.Builder` methods, which carry no `with` prefix.
///
/// `branch(Branch)` is hidden so that only the list-valued `branches` property binds.
///
/// @see WorkflowStepMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowStepBuilderMixin {

    @JsonIgnore
    public abstract Object branch(Branch branch);
}
