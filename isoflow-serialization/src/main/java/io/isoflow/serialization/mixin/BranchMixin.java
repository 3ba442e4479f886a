package io.isoflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Hides the derived `implicit` flag of `Branch`.
public abstract class BranchMixin {

    @JsonIgnore
    public abstract boolean isImplicit();
}
