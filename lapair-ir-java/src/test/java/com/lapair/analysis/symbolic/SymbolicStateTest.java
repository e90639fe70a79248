package com.lapair.analysis.symbolic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolicStateTest {

    @Test
    void unboundVariableReadsAsItsOwnSymbol() {
        SymbolicState s = SymbolicState.empty();
        assertEquals(SymbolicValue.symbol("x"), s.read("x"));
        assertFalse(s.isBound("x"));
    }

    @Test
    void assignReturnsNewStateAndLeavesOriginalAlone() {
        SymbolicState before = SymbolicState.empty();
        SymbolicState after = before.assign("x", SymbolicValue.of(3));

        assertNotSame(before, after);
        assertTrue(after.isBound("x"));
        assertFalse(before.isBound("x"));
        assertEquals(SymbolicValue.of(3), after.read("x"));
    }

    @Test
    void trivialConstraintsAreDroppedAndFalseOnesMarkInfeasible() {
        SymbolicState s = SymbolicState.empty();
        assertSame(s, s.constrain(SymbolicValue.of(1)));
        assertTrue(s.constrain(SymbolicValue.of(0)).isInfeasible());
        assertFalse(s.isInfeasible());
    }

    @Test
    void duplicateConstraintIsKeptOnce() {
        SymbolicValue c = Evaluator.holds(SymbolicValue.symbol("c"));
        SymbolicState s = SymbolicState.empty().constrain(c).constrain(c);
        assertEquals(List.of(c), s.getPathCondition());
    }

    @Test
    void joinUnionsDifferingValues() {
        SymbolicState left = SymbolicState.empty().assign("x", SymbolicValue.of(1)).assign("y", SymbolicValue.of(5));
        SymbolicState right = SymbolicState.empty().assign("x", SymbolicValue.of(2)).assign("y", SymbolicValue.of(5));

        SymbolicState joined = left.join(right);

        assertEquals("phi(1, 2)", joined.read("x").render());
        assertEquals(SymbolicValue.of(5), joined.read("y"));
    }

    @Test
    void joinWithVariableBoundOnOneSideUsesItsSymbol() {
        SymbolicState left = SymbolicState.empty().assign("x", SymbolicValue.of(1));
        SymbolicState joined = left.join(SymbolicState.empty());
        assertEquals("phi(1, x)", joined.read("x").render());
    }

    @Test
    void joinIgnoresInfeasibleSide() {
        SymbolicState feasible = SymbolicState.empty().assign("x", SymbolicValue.of(1));
        SymbolicState dead = SymbolicState.empty().constrain(SymbolicValue.of(0));
        assertEquals(feasible, feasible.join(dead));
        assertEquals(feasible, dead.join(feasible));
    }

    @Test
    void joinOfEqualStatesIsIdentity() {
        SymbolicState s = SymbolicState.empty().assign("x", SymbolicValue.of(1));
        SymbolicState t = SymbolicState.empty().assign("x", SymbolicValue.of(1));
        assertSame(s, s.join(t));
    }

    @Test
    void widenTurnsChangedValuesUnknown() {
        SymbolicState old = SymbolicState.empty().assign("i", SymbolicValue.of(0)).assign("k", SymbolicValue.of(9));
        SymbolicState next = SymbolicState.empty().assign("i", SymbolicValue.of(1)).assign("k", SymbolicValue.of(9));

        SymbolicState widened = old.widen(next);

        assertEquals(SymbolicValue.unknown(), widened.read("i"));
        assertEquals(SymbolicValue.of(9), widened.read("k"));
        assertEquals(widened, widened.widen(widened.join(next)), "Widened state is stable");
    }

    @Test
    void outputsAreRecordedPerKey() {
        SymbolicState s = SymbolicState.empty()
                .output("out", SymbolicValue.of(1))
                .output("out", SymbolicValue.of(2));
        assertEquals(1, s.getOutputs().size());
        assertEquals(SymbolicValue.of(2), s.getOutputs().get("out"));
    }

    @Test
    void renderListsVariablesInNameOrder() {
        SymbolicState s = SymbolicState.empty()
                .assign("b", SymbolicValue.of(2))
                .assign("a", SymbolicValue.symbol("A"))
                .constrain(Evaluator.holds(SymbolicValue.symbol("a")));
        assertEquals("{a=A, b=2}; pc=[(a != 0)]", s.render());
    }
}
