package com.lapair.analysis.dataflow;

import com.lapair.ir.Node;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Forward may-analysis: which definitions can reach each node without being
 * overwritten on the way. Meet is union.
 */
public class ReachingDefinitions extends DataFlowAnalysis<Set<Definition>> {

    public ReachingDefinitions(ControlFlowGraph cfg) {
        super(cfg);
    }

    @Override
    protected Direction direction() { return Direction.FORWARD; }

    @Override
    protected Set<Definition> boundary() { return Set.of(); }

    @Override
    protected Set<Definition> meet(List<Set<Definition>> facts) {
        Set<Definition> union = new LinkedHashSet<>();
        facts.forEach(union::addAll);
        return Collections.unmodifiableSet(union);
    }

    @Override
    protected Set<Definition> transfer(Node node, Set<Definition> in) {
        Optional<String> defined = instruction(node).definedVariable();
        if (defined.isEmpty()) return in;
        String variable = defined.get();
        Set<Definition> out = new LinkedHashSet<>();
        for (Definition d : in) {
            if (!d.variable().equals(variable)) out.add(d);
        }
        out.add(new Definition(variable, node));
        return Collections.unmodifiableSet(out);
    }

    /** Definitions of {@code variable} that reach the start of {@code node}. */
    public Set<Definition> reaching(Node node, String variable) {
        Set<Definition> in = getIn(node);
        if (in == null) return Set.of();
        return in.stream()
                .filter(d -> d.variable().equals(variable))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Every definition in the graph, in discovery order. */
    public Set<Definition> allDefinitions() {
        Set<Definition> all = new LinkedHashSet<>();
        for (Node node : cfg.getNodes()) {
            instruction(node).definedVariable().ifPresent(v -> all.add(new Definition(v, node)));
        }
        return all;
    }
}
