package io.isoflow.core.model;

import java.util.Objects;

/// A directed flowchart edge.
///
/// @param fromId source node id, not null
/// @param toId target node id, not null
/// @param label branch text, empty for plain sequential flow; never null
/// @param kind edge role, not null
public record Connection(String fromId, String toId, String label, ConnectionKind kind) {

    public Connection {
        Objects.requireNonNull(fromId, "fromId must not be null");
        Objects.requireNonNull(toId, "toId must not be null");
        label = label != null ? label : "";
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static Connection sequential(String fromId, String toId) {
        return new Connection(fromId, toId, "", ConnectionKind.SEQUENTIAL);
    }

    public static Connection branch(String fromId, String toId, String label) {
        return new Connection(fromId, toId, label, ConnectionKind.BRANCH);
    }

    public static Connection loopback(String fromId, String toId, String label) {
        return new Connection(fromId, toId, label, ConnectionKind.LOOPBACK);
    }

    public boolean isLoopback() {
        return kind == ConnectionKind.LOOPBACK;
    }

    public boolean hasLabel() {
        return !label.isBlank();
    }
}
