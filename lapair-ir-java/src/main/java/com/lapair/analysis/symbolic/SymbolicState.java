package com.lapair.analysis.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable interpreter state: variable bindings, the path condition and the
 * values recorded by {@code output} instructions.
 *
 * Every update returns a new instance, so states handed to sibling paths can
 * never observe each other's changes. An unbound variable reads as the symbol
 * with the variable's name.
 */
public final class SymbolicState {

    private static final SymbolicState EMPTY =
            new SymbolicState(new TreeMap<>(), List.of(), new LinkedHashMap<>(), false);

    private final Map<String, SymbolicValue> variables;
    private final List<SymbolicValue> pathCondition;
    private final Map<String, SymbolicValue> outputs;
    private final boolean infeasible;

    private SymbolicState(Map<String, SymbolicValue> variables,
                          List<SymbolicValue> pathCondition,
                          Map<String, SymbolicValue> outputs,
                          boolean infeasible) {
        this.variables = variables;
        this.pathCondition = pathCondition;
        this.outputs = outputs;
        this.infeasible = infeasible;
    }

    public static SymbolicState empty() {
        return EMPTY;
    }

    public SymbolicValue read(String variable) {
        SymbolicValue value = variables.get(variable);
        return value != null ? value : SymbolicValue.symbol(variable);
    }

    public boolean isBound(String variable) {
        return variables.containsKey(variable);
    }

    public SymbolicState assign(String variable, SymbolicValue value) {
        Map<String, SymbolicValue> next = new TreeMap<>(variables);
        next.put(variable, value);
        return new SymbolicState(next, pathCondition, outputs, infeasible);
    }

    /**
     * Adds {@code constraint} to the path condition. A constraint that folded to a
     * non-zero constant is dropped; one that folded to zero marks the state
     * infeasible.
     */
    public SymbolicState constrain(SymbolicValue constraint) {
        OptionalLong folded = constraint.concreteValue();
        if (folded.isPresent()) {
            return folded.getAsLong() != 0 ? this
                    : new SymbolicState(variables, pathCondition, outputs, true);
        }
        if (pathCondition.contains(constraint)) return this;
        List<SymbolicValue> next = new ArrayList<>(pathCondition);
        next.add(constraint);
        return new SymbolicState(variables, Collections.unmodifiableList(next), outputs, infeasible);
    }

    public SymbolicState output(String key, SymbolicValue value) {
        Map<String, SymbolicValue> next = new LinkedHashMap<>(outputs);
        next.put(key, value);
        return new SymbolicState(variables, pathCondition, next, infeasible);
    }

    /**
     * Merge with a state arriving over another path: per-variable join and the
     * constraints both path conditions share.
     */
    public SymbolicState join(SymbolicState other) {
        if (this.equals(other)) return this;
        if (this.infeasible) return other;
        if (other.infeasible) return this;

        Map<String, SymbolicValue> vars = new TreeMap<>();
        for (String name : union(variables, other.variables)) {
            vars.put(name, SymbolicValue.join(read(name), other.read(name)));
        }

        List<SymbolicValue> common = new ArrayList<>(pathCondition);
        common.retainAll(other.pathCondition);

        Map<String, SymbolicValue> outs = new LinkedHashMap<>(outputs);
        for (Map.Entry<String, SymbolicValue> e : other.outputs.entrySet()) {
            outs.merge(e.getKey(), e.getValue(), SymbolicValue::join);
        }
        return new SymbolicState(vars, Collections.unmodifiableList(common), outs, false);
    }

    /**
     * Widening against the previous state at the same program point: every
     * variable or output whose value changed becomes unknown.
     */
    public SymbolicState widen(SymbolicState next) {
        Map<String, SymbolicValue> vars = new TreeMap<>();
        for (String name : union(variables, next.variables)) {
            SymbolicValue before = read(name);
            SymbolicValue after = next.read(name);
            vars.put(name, before.equals(after) ? after : SymbolicValue.unknown());
        }
        Map<String, SymbolicValue> outs = new LinkedHashMap<>(next.outputs);
        for (Map.Entry<String, SymbolicValue> e : outs.entrySet()) {
            if (!Objects.equals(outputs.get(e.getKey()), e.getValue())) {
                e.setValue(SymbolicValue.unknown());
            }
        }
        return new SymbolicState(vars, next.pathCondition, outs, next.infeasible);
    }

    private static TreeSet<String> union(Map<String, ?> a, Map<String, ?> b) {
        TreeSet<String> names = new TreeSet<>(a.keySet());
        names.addAll(b.keySet());
        return names;
    }

    public Map<String, SymbolicValue> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public List<SymbolicValue> getPathCondition() {
        return pathCondition;
    }

    public Map<String, SymbolicValue> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public boolean isInfeasible() {
        return infeasible;
    }

    /** e.g. {@code acc=(A + B); pc=[(A != 0)]; out={C=(A + B)}} */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(variables.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().render())
                .collect(Collectors.joining(", ", "{", "}")));
        if (!pathCondition.isEmpty()) {
            sb.append("; pc=").append(pathCondition.stream()
                    .map(SymbolicValue::render)
                    .collect(Collectors.joining(" && ", "[", "]")));
        }
        if (!outputs.isEmpty()) {
            sb.append("; out=").append(outputs.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue().render())
                    .collect(Collectors.joining(", ", "{", "}")));
        }
        if (infeasible) sb.append("; infeasible");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolicState)) return false;
        SymbolicState that = (SymbolicState) o;
        return infeasible == that.infeasible
                && variables.equals(that.variables)
                && pathCondition.equals(that.pathCondition)
                && outputs.equals(that.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, pathCondition, outputs, infeasible);
    }

    @Override
    public String toString() {
        return render();
    }
}
