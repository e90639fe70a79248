package com.lapair.analysis.symbolic;

import java.util.LinkedHashSet;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A value held by a variable during symbolic execution. Implementations are
 * immutable records with structural equality.
 */
public interface SymbolicValue {

    /** Most choice members kept by a merge before it gives up and returns {@link Unknown}. */
    int MAX_CHOICES = 8;

    String render();

    default OptionalLong concreteValue() {
        return OptionalLong.empty();
    }

    static SymbolicValue of(long value) {
        return new Concrete(value);
    }

    static SymbolicValue symbol(String name) {
        return new Symbol(name);
    }

    static SymbolicValue unknown() {
        return Unknown.INSTANCE;
    }

    /**
     * Least upper bound used at merge points: equal values stay as they are,
     * {@link Unknown} absorbs everything, anything else becomes a {@link Choice}.
     */
    static SymbolicValue join(SymbolicValue a, SymbolicValue b) {
        if (a.equals(b)) return a;
        if (a instanceof Unknown || b instanceof Unknown) return unknown();
        Set<SymbolicValue> members = new LinkedHashSet<>();
        addMembers(members, a);
        addMembers(members, b);
        if (members.size() > MAX_CHOICES) return unknown();
        return new Choice(members);
    }

    private static void addMembers(Set<SymbolicValue> members, SymbolicValue value) {
        if (value instanceof Choice) {
            members.addAll(((Choice) value).options());
        } else {
            members.add(value);
        }
    }

    record Concrete(long value) implements SymbolicValue {
        @Override public String render() { return Long.toString(value); }
        @Override public OptionalLong concreteValue() { return OptionalLong.of(value); }
    }

    record Symbol(String name) implements SymbolicValue {
        @Override public String render() { return name; }
    }

    record Unary(Opcode op, SymbolicValue operand) implements SymbolicValue {
        @Override public String render() { return op.symbol() + operand.render(); }
    }

    record Binary(Opcode op, SymbolicValue left, SymbolicValue right) implements SymbolicValue {
        @Override public String render() {
            return "(" + left.render() + " " + op.symbol() + " " + right.render() + ")";
        }
    }

    /** One of several values, produced when states from different paths are merged. */
    record Choice(Set<SymbolicValue> options) implements SymbolicValue {
        public Choice {
            options = Set.copyOf(options);
        }

        @Override public String render() {
            return options.stream()
                    .map(SymbolicValue::render)
                    .sorted()
                    .collect(Collectors.joining(", ", "phi(", ")"));
        }
    }

    /** Top of the value lattice: nothing is known. */
    final class Unknown implements SymbolicValue {
        static final Unknown INSTANCE = new Unknown();

        private Unknown() {}

        @Override public String render() { return "?"; }
        @Override public String toString() { return "Unknown"; }
    }
}
