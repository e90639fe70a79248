package com.lapair.analysis;

import com.lapair.ir.Edge;
import com.lapair.ir.IrProperties;
import com.lapair.ir.Node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Forward propagation of the boolean {@code tainted} fact.
 *
 * A node is a source when its {@code tainted} property reads {@code "true"}.
 * Every outgoing target of a tainted node is marked tainted. There is no
 * sanitisation: once set, the property is never cleared.
 *
 * Not thread-safe; the analysis writes node properties and must not run
 * concurrently with another mutating pass over the same graph.
 */
public class TaintAnalysis {

    private final Set<String> taintedIds = new LinkedHashSet<>();
    private final Set<Node> taintedNodes = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Clears the results of any previous run, then propagates taint from
     * {@code entryNode}. A null entry leaves the recorded sets empty.
     */
    public void analyze(Node entryNode) {
        taintedIds.clear();
        taintedNodes.clear();
        propagateTaint(entryNode);
    }

    private void propagateTaint(Node entryNode) {
        if (entryNode == null) return;

        Deque<Node> worklist = new ArrayDeque<>();
        // node -> taint fact seen when it was last processed
        IdentityHashMap<Node, Boolean> visited = new IdentityHashMap<>();
        worklist.add(entryNode);

        while (!worklist.isEmpty()) {
            Node current = worklist.poll();
            boolean tainted = isTainted(current);

            Boolean seen = visited.get(current);
            // Re-process only when the node turned tainted after its first visit.
            if (seen != null && (seen || !tainted)) continue;
            visited.put(current, tainted);

            if (tainted) {
                taintedIds.add(current.getId());
                taintedNodes.add(current);
            }

            for (Edge edge : current.getOutgoingEdges()) {
                Node target = edge != null ? edge.getTarget() : null;
                if (target == null) continue;
                if (tainted) {
                    target.setProperty(IrProperties.TAINTED, IrProperties.TRUE);
                }
                worklist.add(target);
            }
        }
    }

    public static boolean isTainted(Node node) {
        return node != null && IrProperties.TRUE.equals(node.getProperty(IrProperties.TAINTED));
    }

    /** Identifiers of the tainted nodes reached by the last run, in discovery order. */
    public Set<String> getTaintedIds() {
        return Collections.unmodifiableSet(taintedIds);
    }

    /** Tainted node instances reached by the last run. */
    public Set<Node> getTaintedNodes() {
        return Collections.unmodifiableSet(taintedNodes);
    }
}
