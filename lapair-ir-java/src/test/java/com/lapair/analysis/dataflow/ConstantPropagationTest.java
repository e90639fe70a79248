package com.lapair.analysis.dataflow;

import com.lapair.ir.IrGraphBuilder;
import com.lapair.ir.Node;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class ConstantPropagationTest {

    private static Node op(IrGraphBuilder b, String id, String instruction, String... props) {
        Node node = b.node(id);
        node.setProperty("instruction", instruction);
        for (int i = 0; i + 1 < props.length; i += 2) {
            node.setProperty(props[i], props[i + 1]);
        }
        return node;
    }

    private static ConstantPropagation analyze(Node entry) {
        ConstantPropagation cp = new ConstantPropagation(ControlFlowGraph.build(entry));
        cp.analyze();
        return cp;
    }

    @Test
    void foldsThroughAChain() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node k1 = op(b, "k1", "const", "dest", "x", "value", "2");
        Node k2 = op(b, "k2", "const", "dest", "y", "value", "3");
        Node m = op(b, "m", "multiply", "dest", "z", "lhs", "x", "rhs", "y");
        b.connect(k1, k2);
        b.connect(k2, m);

        ConstantPropagation cp = analyze(k1);

        assertEquals(OptionalLong.of(6), cp.constantAfter(m, "z"));
        assertEquals(OptionalLong.of(2), cp.constantBefore(m, "x"));
        assertEquals(OptionalLong.empty(), cp.constantBefore(k1, "x"));
    }

    @Test
    void inputsAreNotConstant() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node in = op(b, "in", "input", "dest", "c");
        Node add = op(b, "add", "add", "dest", "d", "lhs", "c", "rhs", "1");
        b.connect(in, add);

        ConstantPropagation cp = analyze(in);

        assertTrue(cp.constantAfter(in, "c").isEmpty());
        assertTrue(cp.constantAfter(add, "d").isEmpty());
    }

    @Test
    void joinKeepsOnlyAgreeingConstants() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node s = op(b, "s", "input", "dest", "c");
        Node br = op(b, "br", "branch", "cond", "c");
        Node left = op(b, "left", "const", "dest", "x", "value", "1");
        Node right = op(b, "right", "const", "dest", "x", "value", "2");
        Node leftN = op(b, "leftN", "const", "dest", "n", "value", "5");
        Node rightN = op(b, "rightN", "const", "dest", "n", "value", "5");
        Node join = op(b, "join", "add", "dest", "y", "lhs", "x", "rhs", "n");
        b.connect(s, br);
        b.connect(br, left);
        b.connect(br, right);
        b.connect(left, leftN);
        b.connect(right, rightN);
        b.connect(leftN, join);
        b.connect(rightN, join);

        ConstantPropagation cp = analyze(s);

        assertTrue(cp.constantBefore(join, "x").isEmpty());
        assertEquals(OptionalLong.of(5), cp.constantBefore(join, "n"));
        assertTrue(cp.constantAfter(join, "y").isEmpty());
    }

    @Test
    void definitionOnOnlyOnePathIsNotConstant() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node br = op(b, "br", "branch", "cond", "c");
        Node left = op(b, "left", "const", "dest", "x", "value", "1");
        Node right = op(b, "right", "nop");
        Node join = op(b, "join", "nop");
        b.connect(br, left);
        b.connect(br, right);
        b.connect(left, join);
        b.connect(right, join);

        assertTrue(analyze(br).constantBefore(join, "x").isEmpty());
    }

    @Test
    void loopCounterIsNotConstantButInvariantIs() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node init = op(b, "init", "const", "dest", "i", "value", "0");
        Node n = op(b, "n", "const", "dest", "n", "value", "4");
        Node head = op(b, "head", "nop");
        Node body = op(b, "body", "add", "dest", "i", "lhs", "i", "rhs", "1");
        Node exit = op(b, "exit", "add", "dest", "r", "lhs", "n", "rhs", "1");
        b.connect(init, n);
        b.connect(n, head);
        b.connect(head, body);
        b.connect(body, head);
        b.connect(head, exit);

        ConstantPropagation cp = analyze(init);

        assertEquals(OptionalLong.of(0), cp.constantAfter(init, "i"));
        assertTrue(cp.constantBefore(exit, "i").isEmpty());
        assertEquals(OptionalLong.of(5), cp.constantAfter(exit, "r"));
    }

    @Test
    void reanalyzeSeesPropertyChanges() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node k = op(b, "k", "const", "dest", "x", "value", "1");
        ConstantPropagation cp = analyze(k);
        assertEquals(OptionalLong.of(1), cp.constantAfter(k, "x"));

        k.setProperty("value", "9");
        cp.analyze();

        assertEquals(OptionalLong.of(9), cp.constantAfter(k, "x"));
        assertEquals(1, cp.getEvaluations());
    }

    @Test
    void emptyGraphAnalyzesNothing() {
        ConstantPropagation cp = analyze(null);

        assertEquals(0, cp.getEvaluations());
        assertNull(cp.getOut(new Node("x")));
    }
}
