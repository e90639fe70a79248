package com.lapair.analysis.dataflow;

import com.lapair.analysis.symbolic.Instruction;
import com.lapair.ir.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Forward must-analysis: expressions computed on every path to a node with none
 * of their operands reassigned since. Meet is intersection.
 */
public class AvailableExpressions extends DataFlowAnalysis<Set<Expression>> {

    public AvailableExpressions(ControlFlowGraph cfg) {
        super(cfg);
    }

    @Override
    protected Direction direction() { return Direction.FORWARD; }

    @Override
    protected Set<Expression> boundary() { return Set.of(); }

    @Override
    protected Set<Expression> meet(List<Set<Expression>> facts) {
        Set<Expression> common = new LinkedHashSet<>(facts.get(0));
        for (Set<Expression> fact : facts.subList(1, facts.size())) {
            common.retainAll(fact);
        }
        return Collections.unmodifiableSet(common);
    }

    @Override
    protected Set<Expression> transfer(Node node, Set<Expression> in) {
        Instruction ins = instruction(node);
        Optional<String> defined = ins.definedVariable();
        Optional<Expression> computed = Expression.of(ins);
        if (defined.isEmpty() && computed.isEmpty()) return in;

        Set<Expression> out = new LinkedHashSet<>();
        for (Expression e : in) {
            if (defined.isEmpty() || !e.uses(defined.get())) out.add(e);
        }
        // x = x + 1 computes the expression but immediately invalidates it
        computed.filter(e -> defined.isEmpty() || !e.uses(defined.get())).ifPresent(out::add);
        return Collections.unmodifiableSet(out);
    }

    public Set<Expression> availableAt(Node node) {
        Set<Expression> in = getIn(node);
        return in != null ? in : Set.of();
    }

    /** Nodes recomputing an expression that is already available when they run. */
    public List<Node> redundantComputations() {
        List<Node> redundant = new ArrayList<>();
        for (Node node : cfg.getNodes()) {
            Expression.of(instruction(node))
                    .filter(availableAt(node)::contains)
                    .ifPresent(e -> redundant.add(node));
        }
        return redundant;
    }
}
