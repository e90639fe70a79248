package com.lapair.analysis.symbolic;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed instruction set understood by the interpreter, decoded from a node's
 * {@code instruction} property.
 */
public enum Opcode {
    INPUT("input", null),
    CONST("const", null),
    ASSIGN("assign", null),
    ADD("add", "+"),
    SUBTRACT("subtract", "-"),
    MULTIPLY("multiply", "*"),
    DIVIDE("divide", "/"),
    REMAINDER("remainder", "%"),
    NEGATE("negate", "-"),
    EQ("eq", "=="),
    NE("ne", "!="),
    LT("lt", "<"),
    LE("le", "<="),
    GT("gt", ">"),
    GE("ge", ">="),
    BRANCH("branch", null),
    ASSUME("assume", null),
    OUTPUT("output", null),
    NOP("nop", null);

    private final String mnemonic;
    private final String symbol;

    Opcode(String mnemonic, String symbol) {
        this.mnemonic = mnemonic;
        this.symbol = symbol;
    }

    public String mnemonic() { return mnemonic; }

    /** Infix/prefix operator used when rendering expressions; null for non-operators. */
    public String symbol() { return symbol; }

    public boolean isArithmetic() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE || this == REMAINDER;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
    }

    public boolean isBinary() {
        return isArithmetic() || isComparison();
    }

    /** Case-insensitive lookup by mnemonic; empty for an unknown name. */
    public static Optional<Opcode> parse(String mnemonic) {
        if (mnemonic == null) return Optional.empty();
        String key = mnemonic.trim().toLowerCase(Locale.ROOT);
        for (Opcode op : values()) {
            if (op.mnemonic.equals(key)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
