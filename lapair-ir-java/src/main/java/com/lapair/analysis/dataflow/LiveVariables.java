package com.lapair.analysis.dataflow;

import com.lapair.analysis.symbolic.Instruction;
import com.lapair.ir.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Backward may-analysis: variables whose current value may still be read on
 * some path. A node's live-in is its uses plus live-out minus its definition.
 */
public class LiveVariables extends DataFlowAnalysis<Set<String>> {

    public LiveVariables(ControlFlowGraph cfg) {
        super(cfg);
    }

    @Override
    protected Direction direction() { return Direction.BACKWARD; }

    @Override
    protected Set<String> boundary() { return Set.of(); }

    @Override
    protected Set<String> meet(List<Set<String>> facts) {
        Set<String> union = new LinkedHashSet<>();
        facts.forEach(union::addAll);
        return Collections.unmodifiableSet(union);
    }

    @Override
    protected Set<String> transfer(Node node, Set<String> out) {
        Instruction ins = instruction(node);
        Set<String> in = new LinkedHashSet<>(out);
        ins.definedVariable().ifPresent(in::remove);
        in.addAll(ins.usedVariables());
        return Collections.unmodifiableSet(in);
    }

    public Set<String> liveIn(Node node) {
        Set<String> in = getIn(node);
        return in != null ? in : Set.of();
    }

    public Set<String> liveOut(Node node) {
        Set<String> out = getOut(node);
        return out != null ? out : Set.of();
    }

    /**
     * Nodes whose defined variable is not live afterwards, so the write is never
     * read. Nodes with other effects are not special-cased: every opcode that
     * defines a variable is side-effect free.
     */
    public List<Node> deadDefinitions() {
        List<Node> dead = new ArrayList<>();
        for (Node node : cfg.getNodes()) {
            instruction(node).definedVariable()
                    .filter(v -> !liveOut(node).contains(v))
                    .ifPresent(v -> dead.add(node));
        }
        return dead;
    }
}
