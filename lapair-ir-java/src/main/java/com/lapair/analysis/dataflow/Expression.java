package com.lapair.analysis.dataflow;

import com.lapair.analysis.symbolic.Instruction;
import com.lapair.analysis.symbolic.Opcode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A binary expression as computed by an instruction, e.g. {@code (a + b)}.
 * Operands of commutative operators are stored sorted, so {@code a + b} and
 * {@code b + a} are the same expression.
 */
public record Expression(Opcode opcode, List<String> operands) {

    public Expression {
        if (!opcode.isBinary()) throw new IllegalArgumentException("Not a binary opcode: " + opcode);
        operands = List.copyOf(operands);
    }

    /** The expression computed by {@code instruction}, if it computes a binary one. */
    public static Optional<Expression> of(Instruction instruction) {
        Opcode op = instruction.opcode();
        if (!op.isBinary()) return Optional.empty();
        List<String> operands = new ArrayList<>(instruction.operands());
        if (isCommutative(op)) Collections.sort(operands);
        return Optional.of(new Expression(op, operands));
    }

    static boolean isCommutative(Opcode op) {
        return op == Opcode.ADD || op == Opcode.MULTIPLY || op == Opcode.EQ || op == Opcode.NE;
    }

    public boolean uses(String variable) {
        return operands.contains(variable);
    }

    public String render() {
        return "(" + operands.get(0) + " " + opcode.symbol() + " " + operands.get(1) + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
