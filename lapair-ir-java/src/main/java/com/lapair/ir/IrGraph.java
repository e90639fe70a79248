package com.lapair.ir;

import java.util.List;

/**
 * Nodes and edges produced by one front-end run or one builder.
 * Not a registry: analyses only follow edges, this record just keeps the handles.
 */
public record IrGraph(
    List<Node> nodes,
    List<Edge> edges
) {
    public IrGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /** First node created, or null for an empty graph. */
    public Node entry() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }
}
