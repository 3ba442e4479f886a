package io.isoflow.core.render;

import java.util.Set;

/// Reports which rendering backends are usable right now.
///
/// Used only to resolve automatic backend selection and to check a requested backend
/// before it is attempted.
///
/// @see SystemCapabilityDetector for the probing implementation
public interface CapabilityDetector {

    /// Returns the currently available backends.
    ///
    /// @return available backends, never null; always contains {@link BackendId#HTML}
    Set<BackendId> listAvailable();

    default boolean isAvailable(BackendId backend) {
        return listAvailable().contains(backend);
    }
}
