package com.lapair.analysis.symbolic;

import java.util.OptionalLong;

/**
 * Builds expressions, folding them whenever the operands are concrete.
 * Comparisons evaluate to 1 or 0.
 */
final class Evaluator {

    private Evaluator() {}

    static SymbolicValue binary(Opcode op, SymbolicValue left, SymbolicValue right) {
        if (!op.isBinary()) {
            throw new IllegalArgumentException("Not a binary operator: " + op);
        }
        if (left instanceof SymbolicValue.Unknown || right instanceof SymbolicValue.Unknown) {
            return SymbolicValue.unknown();
        }

        OptionalLong l = left.concreteValue();
        OptionalLong r = right.concreteValue();
        if (l.isPresent() && r.isPresent()) {
            return fold(op, l.getAsLong(), r.getAsLong());
        }

        // Identities that do not need both sides
        if (r.isPresent()) {
            long rv = r.getAsLong();
            if (rv == 0 && (op == Opcode.DIVIDE || op == Opcode.REMAINDER)) return SymbolicValue.unknown();
            if (rv == 0 && (op == Opcode.ADD || op == Opcode.SUBTRACT)) return left;
            if (rv == 1 && (op == Opcode.MULTIPLY || op == Opcode.DIVIDE)) return left;
        }
        if (l.isPresent()) {
            long lv = l.getAsLong();
            if (lv == 0 && op == Opcode.ADD) return right;
            if (lv == 1 && op == Opcode.MULTIPLY) return right;
        }
        return new SymbolicValue.Binary(op, left, right);
    }

    static SymbolicValue negate(SymbolicValue operand) {
        if (operand instanceof SymbolicValue.Unknown) return operand;
        OptionalLong v = operand.concreteValue();
        if (v.isPresent()) return SymbolicValue.of(-v.getAsLong());
        if (operand instanceof SymbolicValue.Unary
                && ((SymbolicValue.Unary) operand).op() == Opcode.NEGATE) {
            return ((SymbolicValue.Unary) operand).operand();
        }
        return new SymbolicValue.Unary(Opcode.NEGATE, operand);
    }

    /** Constraint that {@code condition} holds, i.e. {@code condition != 0}. */
    static SymbolicValue holds(SymbolicValue condition) {
        return binary(Opcode.NE, condition, SymbolicValue.of(0));
    }

    /** Constraint that {@code condition} does not hold, i.e. {@code condition == 0}. */
    static SymbolicValue fails(SymbolicValue condition) {
        return binary(Opcode.EQ, condition, SymbolicValue.of(0));
    }

    private static SymbolicValue fold(Opcode op, long l, long r) {
        switch (op) {
            case ADD:       return SymbolicValue.of(l + r);
            case SUBTRACT:  return SymbolicValue.of(l - r);
            case MULTIPLY:  return SymbolicValue.of(l * r);
            case DIVIDE:    return r == 0 ? SymbolicValue.unknown() : SymbolicValue.of(l / r);
            case REMAINDER: return r == 0 ? SymbolicValue.unknown() : SymbolicValue.of(l % r);
            case EQ:        return bool(l == r);
            case NE:        return bool(l != r);
            case LT:        return bool(l < r);
            case LE:        return bool(l <= r);
            case GT:        return bool(l > r);
            case GE:        return bool(l >= r);
            default:
                throw new IllegalArgumentException("Not a binary operator: " + op);
        }
    }

    private static SymbolicValue bool(boolean b) {
        return SymbolicValue.of(b ? 1 : 0);
    }
}
