package com.lapair.analysis.dataflow;

import com.lapair.analysis.symbolic.Instruction;
import com.lapair.analysis.symbolic.SymbolicState;
import com.lapair.analysis.symbolic.SymbolicValue;
import com.lapair.ir.Node;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Forward analysis mapping each assigned variable to a constant, or to
 * {@link SymbolicValue#unknown()} when it is not a constant on every path.
 *
 * Instructions are evaluated with the symbolic interpreter over a state that
 * holds only the known constants, so folding follows the same rules as
 * symbolic execution. Variables never assigned are absent and read as inputs.
 * Path constraints are ignored.
 */
public class ConstantPropagation extends DataFlowAnalysis<Map<String, SymbolicValue>> {

    public ConstantPropagation(ControlFlowGraph cfg) {
        super(cfg);
    }

    @Override
    protected Direction direction() { return Direction.FORWARD; }

    @Override
    protected Map<String, SymbolicValue> boundary() { return Map.of(); }

    @Override
    protected Map<String, SymbolicValue> meet(List<Map<String, SymbolicValue>> facts) {
        TreeSet<String> names = new TreeSet<>();
        facts.forEach(f -> names.addAll(f.keySet()));
        Map<String, SymbolicValue> met = new TreeMap<>();
        for (String name : names) {
            SymbolicValue first = facts.get(0).get(name);
            boolean agree = first != null;
            for (Map<String, SymbolicValue> fact : facts) {
                if (!agree) break;
                agree = first.equals(fact.get(name));
            }
            met.put(name, agree ? first : SymbolicValue.unknown());
        }
        return Collections.unmodifiableMap(met);
    }

    @Override
    protected Map<String, SymbolicValue> transfer(Node node, Map<String, SymbolicValue> in) {
        Instruction ins = instruction(node);
        Optional<String> defined = ins.definedVariable();
        if (defined.isEmpty()) return in;

        SymbolicState state = SymbolicState.empty();
        for (Map.Entry<String, SymbolicValue> e : in.entrySet()) {
            state = state.assign(e.getKey(), e.getValue());
        }
        SymbolicValue value = ins.apply(state).read(defined.get());

        Map<String, SymbolicValue> out = new TreeMap<>(in);
        out.put(defined.get(), value.concreteValue().isPresent() ? value : SymbolicValue.unknown());
        return Collections.unmodifiableMap(out);
    }

    /** Constant value of {@code variable} when {@code node} starts, if it is one. */
    public OptionalLong constantBefore(Node node, String variable) {
        return constantIn(getIn(node), variable);
    }

    /** Constant value of {@code variable} after {@code node} ran, if it is one. */
    public OptionalLong constantAfter(Node node, String variable) {
        return constantIn(getOut(node), variable);
    }

    private static OptionalLong constantIn(Map<String, SymbolicValue> fact, String variable) {
        if (fact == null) return OptionalLong.empty();
        SymbolicValue value = fact.get(variable);
        return value == null ? OptionalLong.empty() : value.concreteValue();
    }
}
