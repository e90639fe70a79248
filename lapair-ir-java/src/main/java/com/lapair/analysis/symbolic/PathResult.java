package com.lapair.analysis.symbolic;

import com.lapair.ir.Node;

import java.util.List;

/**
 * One row of the path table.
 *
 * @param index    position in the table
 * @param trail    nodes executed along the path, entry first; empty in merge mode
 * @param terminal node where the path stopped
 * @param state    state after the last executed node
 * @param status   why the path stopped
 */
public record PathResult(
    int index,
    List<Node> trail,
    Node terminal,
    SymbolicState state,
    PathStatus status
) {
    public PathResult {
        trail = List.copyOf(trail);
    }

    public boolean isCompleted() {
        return status == PathStatus.COMPLETED;
    }
}
