package com.lapair.analysis.dataflow;

import com.lapair.ir.Edge;
import com.lapair.ir.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Control flow view of the IR nodes reachable from an entry node.
 *
 * Each IR node is one CFG node; outgoing edges with a non-null target are the
 * control flow successors. Parallel edges collapse into one successor.
 * Predecessors only include reachable nodes, so edges from outside the region
 * are ignored. The view is a snapshot: edges added afterwards are not seen.
 */
public final class ControlFlowGraph {

    private final Node entry;
    private final List<Node> preOrder;
    private final List<Node> postOrder;
    private final Map<Node, List<Node>> successors;
    private final Map<Node, List<Node>> predecessors;

    private ControlFlowGraph(Node entry, List<Node> preOrder, List<Node> postOrder,
                             Map<Node, List<Node>> successors, Map<Node, List<Node>> predecessors) {
        this.entry = entry;
        this.preOrder = Collections.unmodifiableList(preOrder);
        this.postOrder = Collections.unmodifiableList(postOrder);
        this.successors = successors;
        this.predecessors = predecessors;
    }

    /** Builds the CFG of everything reachable from {@code entry}; a null entry gives an empty graph. */
    public static ControlFlowGraph build(Node entry) {
        List<Node> preOrder = new ArrayList<>();
        List<Node> postOrder = new ArrayList<>();
        Map<Node, List<Node>> successors = new IdentityHashMap<>();
        Map<Node, List<Node>> predecessors = new IdentityHashMap<>();
        if (entry == null) {
            return new ControlFlowGraph(null, preOrder, postOrder, successors, predecessors);
        }

        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> path = new ArrayDeque<>();
        Deque<Iterator<Node>> pending = new ArrayDeque<>();

        seen.add(entry);
        preOrder.add(entry);
        successors.put(entry, targetsOf(entry));
        path.push(entry);
        pending.push(successors.get(entry).iterator());

        while (!pending.isEmpty()) {
            Iterator<Node> it = pending.peek();
            if (it.hasNext()) {
                Node next = it.next();
                if (seen.add(next)) {
                    preOrder.add(next);
                    successors.put(next, targetsOf(next));
                    path.push(next);
                    pending.push(successors.get(next).iterator());
                }
            } else {
                pending.pop();
                postOrder.add(path.pop());
            }
        }

        for (Node node : preOrder) {
            predecessors.putIfAbsent(node, new ArrayList<>());
            for (Node succ : successors.get(node)) {
                predecessors.computeIfAbsent(succ, n -> new ArrayList<>()).add(node);
            }
        }
        predecessors.replaceAll((n, preds) -> Collections.unmodifiableList(preds));
        return new ControlFlowGraph(entry, preOrder, postOrder, successors, predecessors);
    }

    private static List<Node> targetsOf(Node node) {
        Set<Node> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Node> ordered = new ArrayList<>();
        for (Edge edge : node.getOutgoingEdges()) {
            if (edge == null || edge.getTarget() == null) continue;
            if (targets.add(edge.getTarget())) ordered.add(edge.getTarget());
        }
        return Collections.unmodifiableList(ordered);
    }

    /** The entry node, or null for an empty graph. */
    public Node entry() { return entry; }

    /** All reachable nodes in depth-first discovery order, entry first. */
    public List<Node> getNodes() { return preOrder; }

    /** Same as {@link #getNodes()}: depth-first preorder from the entry. */
    public List<Node> traverse() { return preOrder; }

    /** Nodes in depth-first postorder: every node after the successors it discovered. */
    public List<Node> postOrder() { return postOrder; }

    public List<Node> reversePostOrder() {
        List<Node> order = new ArrayList<>(postOrder);
        Collections.reverse(order);
        return order;
    }

    public boolean contains(Node node) {
        return successors.containsKey(node);
    }

    public int size() { return preOrder.size(); }

    /** Successors of {@code node}; empty for nodes outside the graph. */
    public List<Node> successors(Node node) {
        return successors.getOrDefault(node, List.of());
    }

    /** Reachable predecessors of {@code node}; empty for nodes outside the graph. */
    public List<Node> predecessors(Node node) {
        return predecessors.getOrDefault(node, List.of());
    }

    /** Nodes with no successors. */
    public List<Node> exits() {
        List<Node> exits = new ArrayList<>();
        for (Node node : preOrder) {
            if (successors.get(node).isEmpty()) exits.add(node);
        }
        return exits;
    }
}
