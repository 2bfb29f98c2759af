package com.lrp.statemachine.ast;

import com.lrp.protocol.error.MalformedTreeException;
import com.lrp.protocol.error.RecursionLimitException;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.SequentialIdGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateStructureTest {

    private final IdGenerator ids = new SequentialIdGenerator();

    @Test
    void getNestedInitialState_simpleStateIsItsOwn() {
        SimpleState s = new SimpleState("S", false, null, ids);

        assertSame(s, s.getNestedInitialState());
        assertSame(s, new InitialState(s).getNestedInitialState());
    }

    @Test
    void getNestedInitialState_followsChainThroughComposites() {
        CompositeState s1 = new CompositeState("S1", null, ids);
        CompositeState s2 = new CompositeState("S2", null, ids);
        SimpleState s3 = new SimpleState("S3", false, null, ids);
        SimpleState other = new SimpleState("Other", false, null, ids);
        s2.addState(other);
        s2.addState(s3);
        s2.setInitialState(s3);
        s1.addState(s2);
        s1.setInitialState(s2);

        assertSame(s3, s1.getNestedInitialState());
        assertSame(s3, s1.getInitialState().getNestedInitialState());
        assertSame(s1, s1.getInitialState().getParentState());
    }

    @Test
    void getNestedInitialState_deepNestingResolves() {
        SimpleState leaf = new SimpleState("Leaf", false, null, ids);
        State current = leaf;
        for (int i = 0; i < 50; i++) {
            CompositeState wrapper = new CompositeState("W" + i, null, ids);
            wrapper.addState(current);
            wrapper.setInitialState(current);
            current = wrapper;
        }

        State outermost = current;

        assertSame(leaf, outermost.getNestedInitialState());
        assertEquals(50, leaf.getDepth());
        assertEquals(0, outermost.getDepth());
        assertThrows(RecursionLimitException.class, () -> outermost.getNestedInitialState(10));
    }

    @Test
    void getNestedInitialState_compositeWithoutInitialThrows() {
        CompositeState outer = new CompositeState("Outer", null, ids);
        CompositeState inner = new CompositeState("Inner", null, ids);
        inner.addState(new SimpleState("X", false, null, ids));
        outer.addState(inner);
        outer.setInitialState(inner);

        MalformedTreeException e = assertThrows(MalformedTreeException.class, outer::getNestedInitialState);
        assertEquals(inner.getId(), e.getElementId());
    }

    @Test
    void getDepth_countsEnclosingComposites() {
        StateMachine machine = new StateMachine("M", null, ids);
        CompositeState c = new CompositeState("C", null, ids);
        CompositeState d = new CompositeState("D", null, ids);
        SimpleState leaf = new SimpleState("Leaf", false, null, ids);
        d.addState(leaf);
        c.addState(d);
        machine.addState(c);

        assertEquals(0, c.getDepth());
        assertNull(c.getParentState());
        assertEquals(1, d.getDepth());
        assertEquals(2, leaf.getDepth());
        assertSame(d, leaf.getParentState());
    }

    @Test
    void createTransition_registersInBothAdjacencyLists() {
        SimpleState a = new SimpleState("A", false, null, ids);
        SimpleState b = new SimpleState("B", false, null, ids);

        Transition t = a.createTransition(b, "in", "out");

        assertEquals(List.of(t), a.getOutgoingTransitions());
        assertTrue(a.getIncomingTransitions().isEmpty());
        assertEquals(List.of(t), b.getIncomingTransitions());
        assertSame(a, t.getSource());
        assertSame(b, t.getTarget());
        assertEquals("in", t.getInput());
        assertEquals("out", t.getOutput());
        assertThrows(UnsupportedOperationException.class, () -> a.getOutgoingTransitions().clear());
    }

    @Test
    void addState_stateHasExactlyOneOwner() {
        StateMachine machine = new StateMachine("M", null, ids);
        CompositeState c = new CompositeState("C", null, ids);
        SimpleState s = new SimpleState("S", false, null, ids);
        c.addState(s);

        assertThrows(IllegalStateException.class, () -> machine.addState(s));
        assertThrows(IllegalStateException.class, () -> new CompositeState("D", null, ids).addState(s));
        assertEquals(List.of(s), c.getStates());
        assertTrue(s.getStates().isEmpty());
    }

    @Test
    void addState_rejectsContainmentCycles() {
        CompositeState outer = new CompositeState("Outer", null, ids);
        CompositeState inner = new CompositeState("Inner", null, ids);
        outer.addState(inner);

        assertThrows(IllegalArgumentException.class, () -> inner.addState(outer));
        assertThrows(IllegalArgumentException.class, () -> outer.addState(outer));
    }

    @Test
    void setInitialState_targetMustBeDirectChildAndSetOnce() {
        StateMachine machine = new StateMachine("M", null, ids);
        CompositeState c = new CompositeState("C", null, ids);
        SimpleState nested = new SimpleState("N", false, null, ids);
        SimpleState top = new SimpleState("T", false, null, ids);
        c.addState(nested);
        machine.addState(c);
        machine.addState(top);

        assertThrows(IllegalArgumentException.class, () -> machine.setInitialState(nested));
        assertThrows(IllegalArgumentException.class, () -> c.setInitialState(top));
        c.setInitialState(nested);
        assertThrows(IllegalStateException.class, () -> c.setInitialState(nested));
        machine.setInitialState(top);
        assertSame(top, machine.getNestedInitialState(10));
    }

    @Test
    void findElementById_findsStatesTransitionsAndMachine() {
        StateMachine machine = new StateMachine("M", null, ids);
        CompositeState c = new CompositeState("C", null, ids);
        SimpleState n = new SimpleState("N", false, null, ids);
        c.addState(n);
        machine.addState(c);
        Transition t = n.createTransition(n, "loop", null);

        assertSame(machine, machine.findElementById(machine.getId()));
        assertSame(n, machine.findElementById(n.getId()));
        assertSame(t, machine.findElementById(t.getId()));
        assertNull(machine.findElementById("nope"));
        assertEquals(List.of(c, n), machine.getAllStates());
        assertEquals(List.of(t), machine.getAllTransitions());
        assertEquals(StateKind.COMPOSITE, c.getKind());
        assertEquals(StateKind.SIMPLE, n.getKind());
    }
}
