package com.lapair.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A vertex of the IR graph.
 *
 * Identifiers are opaque labels and are not required to be unique. Two node
 * instances with the same id are still distinct: equality is reference identity.
 * Adjacency lists are only changed through {@link #addIncomingEdge(Edge)} and
 * {@link #addOutgoingEdge(Edge)}; creating an {@link Edge} does not touch them.
 */
public class Node {

    private final String id;
    private final List<Edge> incomingEdges = new ArrayList<>();
    private final List<Edge> outgoingEdges = new ArrayList<>();
    private final PropertyBag properties = new PropertyBag();

    public Node(String id) {
        this.id = id;
    }

    public String getId() { return id; }

    public void addIncomingEdge(Edge edge) {
        incomingEdges.add(edge);
    }

    public void addOutgoingEdge(Edge edge) {
        outgoingEdges.add(edge);
    }

    /** Incoming edges in registration order. */
    public List<Edge> getIncomingEdges() {
        return Collections.unmodifiableList(incomingEdges);
    }

    /** Outgoing edges in registration order. */
    public List<Edge> getOutgoingEdges() {
        return Collections.unmodifiableList(outgoingEdges);
    }

    public void setProperty(String key, String value) {
        properties.set(key, value);
    }

    /** Returns the property value, or {@code ""} when unset. */
    public String getProperty(String key) {
        return properties.get(key);
    }

    public Optional<String> findProperty(String key) {
        return properties.find(key);
    }

    public boolean hasProperty(String key) {
        return properties.contains(key);
    }

    public PropertyBag getProperties() { return properties; }

    @Override
    public String toString() {
        return "Node(" + id + ")";
    }
}
