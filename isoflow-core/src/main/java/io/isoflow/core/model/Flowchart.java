package io.isoflow.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Directed graph intermediate representation of one workflow.
///
/// Nodes are kept in insertion order so that every renderer emits them in the same
/// sequence for the same input. Connections are kept in insertion order as well.
///
/// ### Invariant
/// Every connection references existing node ids. {@link #addConnection(Connection)}
/// rejects an edge with an unknown endpoint, and {@link #removeNode(String)} drops the
/// node's edges along with it.
///
/// @implNote **Not thread-safe**. A flowchart is mutated by the
/// {@link io.isoflow.core.build.GraphBuilder} and by explicit caller edits, then read
/// concurrently by validators and renderers without further mutation.
public final class Flowchart {

    private final String title;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();

    public Flowchart(String title) {
        this.title = Objects.requireNonNull(title, "title must not be null");
    }

    public String getTitle() {
        return title;
    }

    /// Adds a node.
    ///
    /// @param node the node to add, not null
    /// @return this flowchart for chaining, never null
    /// @throws IllegalArgumentException if a node with the same id already exists
    public Flowchart addNode(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        if (nodes.putIfAbsent(node.getId(), node) != null) {
            throw new IllegalArgumentException("Duplicate node id: " + node.getId());
        }
        return this;
    }

    /// Adds a connection between two existing nodes.
    ///
    /// @param connection the edge to add, not null
    /// @return this flowchart for chaining, never null
    /// @throws IllegalArgumentException if either endpoint is not a node of this flowchart
    public Flowchart addConnection(Connection connection) {
        Objects.requireNonNull(connection, "connection must not be null");
        if (!nodes.containsKey(connection.fromId())) {
            throw new IllegalArgumentException(
                    "Connection source not found: " + connection.fromId());
        }
        if (!nodes.containsKey(connection.toId())) {
            throw new IllegalArgumentException(
                    "Connection target not found: " + connection.toId());
        }
        connections.add(connection);
        return this;
    }

    /// Removes a node and every connection touching it.
    ///
    /// @param id node id, not null
    /// @return `true` if the node existed
    public boolean removeNode(String id) {
        Node removed = nodes.remove(id);
        if (removed == null) {
            return false;
        }
        connections.removeIf(c -> c.fromId().equals(id) || c.toId().equals(id));
        return true;
    }

    /// Removes one connection.
    ///
    /// @param connection the edge to remove, not null
    /// @return `true` if the edge existed
    public boolean removeConnection(Connection connection) {
        return connections.remove(connection);
    }

    public Optional<Node> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    /// Returns the nodes in insertion order.
    ///
    /// @return unmodifiable view, never null
    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /// Returns the node ids in insertion order.
    public List<String> getNodeIds() {
        return List.copyOf(nodes.keySet());
    }

    /// Returns the connections in insertion order.
    ///
    /// @return unmodifiable view, never null
    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public List<Connection> outgoing(String id) {
        return connections.stream().filter(c -> c.fromId().equals(id)).toList();
    }

    public List<Connection> incoming(String id) {
        return connections.stream().filter(c -> c.toId().equals(id)).toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return "Flowchart{'"
                + title
                + "', nodes="
                + nodes.size()
                + ", connections="
                + connections.size()
                + '}';
    }
}
