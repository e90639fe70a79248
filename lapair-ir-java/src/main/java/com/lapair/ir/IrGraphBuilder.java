package com.lapair.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Convenience for front ends and tests: creates nodes and edges and keeps every
 * edge symmetrically registered on both of its endpoints.
 */
public class IrGraphBuilder {

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    public Node node(String id) {
        Node node = new Node(id);
        nodes.add(node);
        return node;
    }

    /**
     * Creates an edge and registers it on {@code source}'s outgoing list and
     * {@code target}'s incoming list. Null endpoints are skipped.
     */
    public Edge connect(String id, Node source, Node target) {
        Edge edge = new Edge(id, source, target);
        register(edge);
        edges.add(edge);
        return edge;
    }

    /** Edge id defaults to {@code "<source>-><target>"}. */
    public Edge connect(Node source, Node target) {
        String id = (source != null ? source.getId() : "null") + "->"
                + (target != null ? target.getId() : "null");
        return connect(id, source, target);
    }

    public IrGraph build() {
        return new IrGraph(nodes, edges);
    }

    /** Registers an existing edge on both endpoints. */
    public static void register(Edge edge) {
        if (edge.getSource() != null) edge.getSource().addOutgoingEdge(edge);
        if (edge.getTarget() != null) edge.getTarget().addIncomingEdge(edge);
    }
}
