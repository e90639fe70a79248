package com.lapair.ir;

import java.util.Optional;

/**
 * A directed edge of the IR graph. Either endpoint may be null.
 *
 * The edge holds plain references to its endpoints and is not registered on
 * their adjacency lists by the constructor; see {@link IrGraphBuilder#connect}.
 */
public class Edge {

    private final String id;
    private final Node source;
    private final Node target;
    private final PropertyBag properties = new PropertyBag();

    public Edge(String id, Node source, Node target) {
        this.id = id;
        this.source = source;
        this.target = target;
    }

    public String getId() { return id; }

    /** May be null. */
    public Node getSource() { return source; }

    /** May be null. */
    public Node getTarget() { return target; }

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
        return "Edge(" + id + ": "
                + (source != null ? source.getId() : "null") + " -> "
                + (target != null ? target.getId() : "null") + ")";
    }
}
