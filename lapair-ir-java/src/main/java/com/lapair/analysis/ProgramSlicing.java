package com.lapair.analysis;

import com.lapair.ir.Edge;
import com.lapair.ir.Node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Backward and forward slicing over the IR graph.
 *
 * Both directions are a depth-first transitive closure. Membership is tested
 * before a neighbour is pushed, so every reachable node is visited once even on
 * cyclic graphs. Sets are identity-based: two node instances sharing an id are
 * two slice members.
 */
public class ProgramSlicing {

    /**
     * Backward slice: every node that reaches {@code criterion} through incoming
     * edges, the criterion included. Returns an empty set for a null criterion.
     */
    public Set<Node> computeSlice(Node criterion) {
        Set<Node> slice = newNodeSet();
        traverse(criterion, slice, Node::getIncomingEdges, Edge::getSource);
        return slice;
    }

    /**
     * Forward slice from {@code node}, added into {@code slice}. Nodes already in
     * the accumulator are not expanded again, which lets callers union several
     * slices into one set.
     */
    public void computeForwardSlice(Node node, Set<Node> slice) {
        traverse(node, slice, Node::getOutgoingEdges, Edge::getTarget);
    }

    public Set<Node> computeForwardSlice(Node node) {
        Set<Node> slice = newNodeSet();
        computeForwardSlice(node, slice);
        return slice;
    }

    /** Identity-keyed set suitable as a slice accumulator. */
    public static Set<Node> newNodeSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static void traverse(Node start, Set<Node> slice,
                                 Function<Node, List<Edge>> edges,
                                 Function<Edge, Node> next) {
        if (start == null || !slice.add(start)) return;

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            for (Edge edge : edges.apply(current)) {
                if (edge == null) continue;
                Node neighbour = next.apply(edge);
                if (neighbour != null && slice.add(neighbour)) {
                    stack.push(neighbour);
                }
            }
        }
    }
}
