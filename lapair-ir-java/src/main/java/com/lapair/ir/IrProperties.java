package com.lapair.ir;

/**
 * Property keys and values shared between the front end and the analyses.
 */
public final class IrProperties {

    private IrProperties() {}

    public static final String TRUE = "true";

    // Taint analysis
    public static final String TAINTED = "tainted";

    // Symbolic execution
    public static final String INSTRUCTION = "instruction";
    public static final String SYMBOLIC_STATE = "symbolic_state";
    public static final String SYMBOLIC_STATE_PROCESSED = "processed";
    public static final String SYMBOLIC_PATHS = "symbolic_paths";
    public static final String SYMBOLIC_RESULT = "symbolic_result";
    public static final String DEST = "dest";
    public static final String LHS = "lhs";
    public static final String RHS = "rhs";
    public static final String SRC = "src";
    public static final String COND = "cond";
    public static final String VALUE = "value";
    public static final String SYMBOL = "symbol";

    /** Edge property on the successors of a {@code branch} node: "true" or "false". */
    public static final String BRANCH = "branch";

    // Front end
    public static final String KIND = "kind";
    public static final String PATH = "path";
    public static final String LANGUAGE = "language";
    public static final String COMPILER_ARGS = "compiler_args";
}
