package com.lapair.analysis.symbolic;

import com.lapair.ir.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstructionTest {

    private static Node node(String id, String... props) {
        Node n = new Node(id);
        for (int i = 0; i + 1 < props.length; i += 2) {
            n.setProperty(props[i], props[i + 1]);
        }
        return n;
    }

    @Test
    void decodeIsCaseInsensitive() {
        assertEquals(Opcode.MULTIPLY, Instruction.decode(node("n", "instruction", " Multiply ")).opcode());
    }

    @Test
    void missingOrUnknownInstructionIsNop() {
        assertEquals(Opcode.NOP, Instruction.decode(node("n")).opcode());
        assertEquals(Opcode.NOP, Instruction.decode(node("n", "instruction", "")).opcode());
        assertEquals(Opcode.NOP, Instruction.decode(node("n", "instruction", "frobnicate")).opcode());
    }

    @Test
    void inputBindsFreshSymbolToAccumulatorByDefault() {
        SymbolicState s = Instruction.decode(node("A", "instruction", "input")).apply(SymbolicState.empty());
        assertEquals(SymbolicValue.symbol("A"), s.read("acc"));
    }

    @Test
    void inputHonoursDestAndSymbol() {
        SymbolicState s = Instruction.decode(node("A", "instruction", "input", "dest", "x", "symbol", "argv"))
                .apply(SymbolicState.empty());
        assertEquals(SymbolicValue.symbol("argv"), s.read("x"));
    }

    @Test
    void binaryOperandsMayBeLiteralsOrVariables() {
        SymbolicState in = SymbolicState.empty().assign("a", SymbolicValue.of(6));
        SymbolicState s = Instruction.decode(node("n", "instruction", "subtract", "dest", "r", "lhs", "a", "rhs", "2"))
                .apply(in);
        assertEquals(SymbolicValue.of(4), s.read("r"));
    }

    @Test
    void missingRhsReadsVariableNamedAfterNode() {
        SymbolicState in = SymbolicState.empty().assign("acc", SymbolicValue.of(1));
        SymbolicState s = Instruction.decode(node("B", "instruction", "add")).apply(in);
        assertEquals("(1 + B)", s.read("acc").render());
    }

    @Test
    void constWithBadLiteralIsUnknown() {
        SymbolicState s = Instruction.decode(node("k", "instruction", "const", "value", "abc"))
                .apply(SymbolicState.empty());
        assertEquals(SymbolicValue.unknown(), s.read("acc"));
    }

    @Test
    void assignCopiesSource() {
        SymbolicState in = SymbolicState.empty().assign("x", SymbolicValue.symbol("X"));
        SymbolicState s = Instruction.decode(node("n", "instruction", "assign", "dest", "y", "src", "x")).apply(in);
        assertEquals(SymbolicValue.symbol("X"), s.read("y"));
    }

    @Test
    void outputRecordsUnderNodeId() {
        SymbolicState in = SymbolicState.empty().assign("acc", SymbolicValue.of(3));
        SymbolicState s = Instruction.decode(node("sink", "instruction", "output")).apply(in);
        assertEquals(SymbolicValue.of(3), s.getOutputs().get("sink"));
    }

    @Test
    void refineOnlyAppliesToLabelledBranchEdges() {
        Instruction branch = Instruction.decode(node("br", "instruction", "branch", "cond", "c"));
        Instruction plain = Instruction.decode(node("p", "instruction", "nop", "cond", "c"));
        SymbolicState s = SymbolicState.empty();

        assertEquals(1, branch.refine(s, "true").getPathCondition().size());
        assertSame(s, branch.refine(s, ""));
        assertSame(s, plain.refine(s, "true"));
    }

    @Test
    void branchLabelsAreCaseInsensitive() {
        Instruction branch = Instruction.decode(node("br", "instruction", "branch", "cond", "c"));
        SymbolicState s = SymbolicState.empty();

        assertEquals("(c != 0)", branch.refine(s, " TRUE ").getPathCondition().get(0).render());
        assertEquals("(c == 0)", branch.refine(s, "False").getPathCondition().get(0).render());
    }

    @Test
    void otherBranchLabelsAddNoConstraint() {
        Instruction branch = Instruction.decode(node("br", "instruction", "branch", "cond", "c"));
        SymbolicState s = SymbolicState.empty();

        assertSame(s, branch.refine(s, "1"));
        assertSame(s, branch.refine(s, "yes"));
        assertSame(s, branch.refine(s, "then"));
    }

    @Test
    void definedVariableFollowsDest() {
        assertEquals("x", Instruction.decode(node("n", "instruction", "add", "dest", "x"))
                .definedVariable().orElseThrow());
        assertEquals("acc", Instruction.decode(node("n", "instruction", "input"))
                .definedVariable().orElseThrow());
        assertTrue(Instruction.decode(node("n", "instruction", "output")).definedVariable().isEmpty());
        assertTrue(Instruction.decode(node("n", "instruction", "branch")).definedVariable().isEmpty());
        assertTrue(Instruction.decode(node("n")).definedVariable().isEmpty());
    }

    @Test
    void operandsApplyDefaultsAndSkipLiteralsInUses() {
        Instruction add = Instruction.decode(node("n", "instruction", "add", "dest", "x", "rhs", "5"));
        assertEquals(List.of("x", "5"), add.operands());
        assertEquals(List.of("x"), add.usedVariables());

        Instruction assign = Instruction.decode(node("7", "instruction", "assign", "dest", "y"));
        assertEquals(List.of("7"), assign.usedVariables(), "Node-id fallback is a variable even when numeric");

        Instruction square = Instruction.decode(node("sq", "instruction", "multiply", "lhs", "a", "rhs", "a"));
        assertEquals(List.of("a"), square.usedVariables());

        assertEquals(List.of("flag"),
                Instruction.decode(node("br", "instruction", "branch", "cond", "flag")).usedVariables());
        assertTrue(Instruction.decode(node("k", "instruction", "const", "value", "3")).operands().isEmpty());
    }
}
