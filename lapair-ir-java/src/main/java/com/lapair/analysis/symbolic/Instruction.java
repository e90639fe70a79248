package com.lapair.analysis.symbolic;

import com.lapair.ir.IrProperties;
import com.lapair.ir.Node;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A node's operation, decoded from its property bag.
 *
 * Operands are variable names or integer literals. An operand that is not set
 * reads the variable named after the node, so an instruction with no operands
 * still produces a well-formed (symbolic) result.
 */
public final class Instruction {

    static final String DEFAULT_DEST = "acc";

    private final Node node;
    private final Opcode opcode;

    private Instruction(Node node, Opcode opcode) {
        this.node = node;
        this.opcode = opcode;
    }

    /** Absent instruction decodes to NOP; an unknown mnemonic is reported and also runs as NOP. */
    public static Instruction decode(Node node) {
        Optional<String> mnemonic = node.findProperty(IrProperties.INSTRUCTION)
                .filter(s -> !s.isBlank());
        if (mnemonic.isEmpty()) {
            return new Instruction(node, Opcode.NOP);
        }
        Optional<Opcode> op = Opcode.parse(mnemonic.get());
        if (op.isEmpty()) {
            System.err.println("[lapair] WARNING: unknown instruction '" + mnemonic.get()
                    + "' on node " + node.getId() + ", treated as nop");
            return new Instruction(node, Opcode.NOP);
        }
        return new Instruction(node, op.get());
    }

    public Opcode opcode() { return opcode; }

    public Node node() { return node; }

    /** Applies this instruction to {@code in}, returning the successor state. */
    public SymbolicState apply(SymbolicState in) {
        String dest = dest();
        switch (opcode) {
            case INPUT: {
                String name = node.findProperty(IrProperties.SYMBOL)
                        .filter(s -> !s.isBlank())
                        .orElse(node.getId());
                return in.assign(dest, SymbolicValue.symbol(name));
            }
            case CONST:
                return in.assign(dest, literal());
            case ASSIGN:
                return in.assign(dest, operand(in, IrProperties.SRC, null));
            case NEGATE:
                return in.assign(dest, Evaluator.negate(operand(in, IrProperties.SRC, dest)));
            case ADD: case SUBTRACT: case MULTIPLY: case DIVIDE: case REMAINDER:
            case EQ: case NE: case LT: case LE: case GT: case GE:
                return in.assign(dest, Evaluator.binary(opcode,
                        operand(in, IrProperties.LHS, dest),
                        operand(in, IrProperties.RHS, null)));
            case ASSUME:
                return in.constrain(Evaluator.holds(condition(in)));
            case OUTPUT:
                return in.output(node.getId(), operand(in, IrProperties.SRC, dest));
            case BRANCH:
            case NOP:
                return in;
            default:
                throw new IllegalStateException("Unhandled opcode " + opcode);
        }
    }

    /**
     * State for the successor reached over an edge labelled {@code branch=true|false}.
     * Unlabelled edges, and edges of nodes that are not branches, add no constraint.
     */
    public SymbolicState refine(SymbolicState out, String branchLabel) {
        if (opcode != Opcode.BRANCH || branchLabel == null || branchLabel.isBlank()) {
            return out;
        }
        String label = branchLabel.trim().toLowerCase(Locale.ROOT);
        switch (label) {
            case "true":
                return out.constrain(Evaluator.holds(condition(out)));
            case "false":
                return out.constrain(Evaluator.fails(condition(out)));
            default:
                System.err.println("[lapair] WARNING: branch label '" + branchLabel.trim()
                        + "' on an edge of node " + node.getId() + " is not true/false, treated as unlabelled");
                return out;
        }
    }

    /** Variable written by this instruction, if any. */
    public Optional<String> definedVariable() {
        switch (opcode) {
            case INPUT: case CONST: case ASSIGN: case NEGATE:
            case ADD: case SUBTRACT: case MULTIPLY: case DIVIDE: case REMAINDER:
            case EQ: case NE: case LT: case LE: case GT: case GE:
                return Optional.of(dest());
            default:
                return Optional.empty();
        }
    }

    /**
     * Operands read by this instruction after defaults are applied, in evaluation
     * order. Each entry is a variable name or an integer literal.
     */
    public List<String> operands() {
        return operandRefs().stream().map(OperandRef::text).collect(Collectors.toList());
    }

    /** Variables read by this instruction, literals excluded. */
    public List<String> usedVariables() {
        return operandRefs().stream()
                .filter(o -> !o.literal())
                .map(OperandRef::text)
                .distinct()
                .collect(Collectors.toList());
    }

    private List<OperandRef> operandRefs() {
        String dest = dest();
        switch (opcode) {
            case ASSIGN:
                return List.of(operandRef(IrProperties.SRC, null));
            case NEGATE:
            case OUTPUT:
                return List.of(operandRef(IrProperties.SRC, dest));
            case ADD: case SUBTRACT: case MULTIPLY: case DIVIDE: case REMAINDER:
            case EQ: case NE: case LT: case LE: case GT: case GE:
                return List.of(operandRef(IrProperties.LHS, dest), operandRef(IrProperties.RHS, null));
            case ASSUME:
            case BRANCH:
                return List.of(operandRef(IrProperties.COND, null));
            default:
                return List.of();
        }
    }

    private SymbolicValue condition(SymbolicState state) {
        return operand(state, IrProperties.COND, null);
    }

    private String dest() {
        return node.findProperty(IrProperties.DEST)
                .filter(s -> !s.isBlank())
                .orElse(DEFAULT_DEST);
    }

    private SymbolicValue literal() {
        String raw = node.getProperty(IrProperties.VALUE).trim();
        try {
            return SymbolicValue.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            System.err.println("[lapair] WARNING: const on node " + node.getId()
                    + " has non-integer value '" + raw + "', treated as unknown");
            return SymbolicValue.unknown();
        }
    }

    /** Operand text, and whether it is an integer literal rather than a variable name. */
    private record OperandRef(String text, boolean literal) {}

    /**
     * Resolves the operand stored under {@code key}. When it is not set, falls
     * back to the variable {@code fallbackVariable}, or to the variable named
     * after the node if that is null too.
     */
    private OperandRef operandRef(String key, String fallbackVariable) {
        String raw = node.findProperty(key).map(String::trim).orElse("");
        if (raw.isEmpty()) {
            return new OperandRef(fallbackVariable != null ? fallbackVariable : node.getId(), false);
        }
        return new OperandRef(raw, isLiteral(raw));
    }

    private SymbolicValue operand(SymbolicState state, String key, String fallbackVariable) {
        OperandRef ref = operandRef(key, fallbackVariable);
        return ref.literal() ? SymbolicValue.of(Long.parseLong(ref.text())) : state.read(ref.text());
    }

    private static boolean isLiteral(String operand) {
        try {
            Long.parseLong(operand);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return node.getId() + ": " + opcode.mnemonic();
    }
}
