package com.lapair.analysis.dataflow;

import com.lapair.ir.IrGraphBuilder;
import com.lapair.ir.Node;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LiveVariablesTest {

    private static Node op(IrGraphBuilder b, String id, String instruction, String... props) {
        Node node = b.node(id);
        node.setProperty("instruction", instruction);
        for (int i = 0; i + 1 < props.length; i += 2) {
            node.setProperty(props[i], props[i + 1]);
        }
        return node;
    }

    private static LiveVariables analyze(Node entry) {
        LiveVariables lv = new LiveVariables(ControlFlowGraph.build(entry));
        lv.analyze();
        return lv;
    }

    @Test
    void straightLineLiveness() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node a = op(b, "a", "input", "dest", "a");
        Node bb = op(b, "b", "input", "dest", "b");
        Node z = op(b, "z", "const", "dest", "z", "value", "5");
        Node s = op(b, "s", "add", "dest", "s", "lhs", "a", "rhs", "b");
        Node o = op(b, "o", "output", "src", "s");
        b.connect(a, bb);
        b.connect(bb, z);
        b.connect(z, s);
        b.connect(s, o);

        LiveVariables lv = analyze(a);

        assertEquals(Set.of("s"), lv.liveIn(o));
        assertEquals(Set.of("a", "b"), lv.liveIn(s));
        assertEquals(Set.of("a", "b"), lv.liveOut(bb));
        assertEquals(Set.of("a"), lv.liveIn(bb));
        assertTrue(lv.liveIn(a).isEmpty());
        assertEquals(List.of(z), lv.deadDefinitions());
    }

    @Test
    void readModifyWriteKeepsVariableLive() {
        Node inc = new Node("inc");
        inc.setProperty("instruction", "add");
        inc.setProperty("rhs", "x");

        LiveVariables lv = analyze(inc);

        assertEquals(Set.of("acc", "x"), lv.liveIn(inc));
    }

    @Test
    void loopVariableIsLiveAroundTheBackEdge() {
        IrGraphBuilder b = new IrGraphBuilder();
        Node init = op(b, "init", "const", "dest", "i", "value", "0");
        Node head = op(b, "head", "lt", "dest", "c", "lhs", "i", "rhs", "10");
        Node body = op(b, "body", "add", "dest", "i", "lhs", "i", "rhs", "1");
        Node exit = op(b, "exit", "output", "src", "i");
        b.connect(init, head);
        b.connect(head, body);
        b.connect(body, head);
        b.connect(head, exit);

        LiveVariables lv = analyze(init);

        assertEquals(Set.of("i"), lv.liveOut(body));
        assertEquals(Set.of("i"), lv.liveIn(head));
        assertEquals(Set.of("i"), lv.liveOut(init));
        assertTrue(lv.liveIn(init).isEmpty());
        assertEquals(List.of(head), lv.deadDefinitions(), "c is computed but never read");
    }
}
