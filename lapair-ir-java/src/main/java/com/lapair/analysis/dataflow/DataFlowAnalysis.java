package com.lapair.analysis.dataflow;

import com.lapair.analysis.symbolic.Instruction;
import com.lapair.ir.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Iterative worklist solver over a {@link ControlFlowGraph}.
 *
 * Subclasses supply the direction, the boundary fact, the meet and the transfer
 * function. Facts must be immutable values with a meaningful {@code equals}.
 *
 * The meet only combines neighbours that have been computed at least once.
 * A node whose neighbours are all still uncomputed (the entry of a forward
 * analysis, an exit of a backward one, or a node reached only over back edges)
 * starts from {@link #boundary()}. Nodes are seeded in reverse postorder for
 * forward analyses and in postorder for backward ones, so on reducible graphs
 * every loop body sees its entry fact before its back edge.
 *
 * Transfer functions must be monotone over a finite lattice for the solver to
 * terminate. Not thread-safe; {@link #analyze()} may be called again to
 * recompute after the graph's properties change.
 *
 * @param <T> the data flow fact
 */
public abstract class DataFlowAnalysis<T> {

    public enum Direction { FORWARD, BACKWARD }

    protected final ControlFlowGraph cfg;

    private final Map<Node, T> inFacts = new IdentityHashMap<>();
    private final Map<Node, T> outFacts = new IdentityHashMap<>();
    private final Map<Node, Instruction> instructions = new IdentityHashMap<>();
    private int evaluations;

    protected DataFlowAnalysis(ControlFlowGraph cfg) {
        if (cfg == null) throw new IllegalArgumentException("cfg is required");
        this.cfg = cfg;
    }

    protected abstract Direction direction();

    /** Fact entering the entry (forward) or leaving an exit (backward). */
    protected abstract T boundary();

    /** Combines the facts of two or more computed neighbours. */
    protected abstract T meet(List<T> facts);

    /** Fact after {@code node} (forward) or before it (backward), given the fact on the other side. */
    protected abstract T transfer(Node node, T fact);

    public final DataFlowAnalysis<T> analyze() {
        inFacts.clear();
        outFacts.clear();
        instructions.clear();
        evaluations = 0;

        boolean forward = direction() == Direction.FORWARD;
        // "before" is the side facts flow in from: in-facts going forward, out-facts going backward.
        Map<Node, T> before = forward ? inFacts : outFacts;
        Map<Node, T> after = forward ? outFacts : inFacts;

        List<Node> order = forward ? cfg.reversePostOrder() : cfg.postOrder();
        Deque<Node> worklist = new ArrayDeque<>(order);
        Set<Node> queued = Collections.newSetFromMap(new IdentityHashMap<>());
        queued.addAll(order);

        while (!worklist.isEmpty()) {
            Node node = worklist.poll();
            queued.remove(node);
            evaluations++;

            List<T> incoming = new ArrayList<>();
            for (Node neighbour : forward ? cfg.predecessors(node) : cfg.successors(node)) {
                T fact = after.get(neighbour);
                if (fact != null) incoming.add(fact);
            }
            T joined;
            if (incoming.isEmpty()) {
                joined = boundary();
            } else if (incoming.size() == 1) {
                joined = incoming.get(0);
            } else {
                joined = meet(incoming);
            }
            before.put(node, joined);

            T result = transfer(node, joined);
            T previous = after.put(node, result);
            if (previous == null || !previous.equals(result)) {
                for (Node next : forward ? cfg.successors(node) : cfg.predecessors(node)) {
                    if (queued.add(next)) worklist.add(next);
                }
            }
        }
        return this;
    }

    /** Decoded instruction of {@code node}, decoded once per run. */
    protected Instruction instruction(Node node) {
        return instructions.computeIfAbsent(node, Instruction::decode);
    }

    /** Fact at the start of {@code node}, or null if the node is not in the graph or not analyzed yet. */
    public T getIn(Node node) { return inFacts.get(node); }

    /** Fact at the end of {@code node}, or null if the node is not in the graph or not analyzed yet. */
    public T getOut(Node node) { return outFacts.get(node); }

    public ControlFlowGraph getCfg() { return cfg; }

    /** Number of transfer function evaluations in the last run. */
    public int getEvaluations() { return evaluations; }
}
