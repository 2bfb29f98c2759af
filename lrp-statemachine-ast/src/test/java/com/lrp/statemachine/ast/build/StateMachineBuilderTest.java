package com.lrp.statemachine.ast.build;

import com.lrp.protocol.error.MalformedTreeException;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.SequentialIdGenerator;
import com.lrp.protocol.model.WireRecord;
import com.lrp.protocol.validate.WireReferenceValidator;
import com.lrp.statemachine.ast.CompositeState;
import com.lrp.statemachine.ast.State;
import com.lrp.statemachine.ast.StateMachine;
import com.lrp.statemachine.ast.Transition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateMachineBuilderTest {

    /** Door controller: Closed/Opened inside composite Operating, with a final Broken state. */
    private static StateMachineBuilder door() {
        return new StateMachineBuilder("Door", new SequentialIdGenerator())
                .simpleState("Closed", "Operating", new Location(3, 5, 3, 11))
                .simpleState("Opened", "Operating", null)
                .compositeState("Operating")
                .finalState("Broken")
                .transition("Closed", "Opened", "open", "creak")
                .transition("Opened", "Closed", "close", null)
                .transition("Operating", "Broken", "kick", "crash")
                .initialState("Operating", "Closed")
                .initialState("Operating");
    }

    @Test
    void build_createsWellFormedTree() {
        StateMachine machine = door().build();

        assertEquals("Door", machine.getName());
        assertEquals(List.of("Operating", "Broken"), machine.getStates().stream().map(State::getName).toList());
        CompositeState operating = assertInstanceOf(CompositeState.class, machine.getStates().get(0));
        assertEquals(List.of("Closed", "Opened"), operating.getStates().stream().map(State::getName).toList());
        assertSame(operating, machine.getInitialState().getTarget());
        assertEquals("Closed", machine.getNestedInitialState(10).getName());
        assertEquals(1, operating.getStates().get(0).getDepth());
        assertEquals(new Location(3, 5, 3, 11), operating.getStates().get(0).getLocation());
        assertTrue(machine.getStates().get(1).isFinal());
        assertFalse(operating.isFinal());
    }

    @Test
    void build_wiresTransitionsInDeclarationOrder() {
        StateMachine machine = door().build();

        List<Transition> transitions = machine.getAllTransitions();
        assertEquals(3, transitions.size());
        Transition kick = transitions.get(0);
        assertEquals("Operating", kick.getSource().getName());
        assertEquals("kick", kick.getInput());
        assertEquals("crash", kick.getOutput());
        Transition open = transitions.get(1);
        assertEquals("Closed", open.getSource().getName());
        assertEquals(List.of(open), open.getTarget().getIncomingTransitions());
    }

    @Test
    void build_serializesWithUniqueIdsAndResolvedRefs() {
        WireRecord root = door().build().toWireRecord();

        assertEquals(WireReferenceValidator.countRecords(root), WireReferenceValidator.collectIds(root).size());
        WireReferenceValidator.validate(root);
    }

    @Test
    void build_rejectsCompositeWithoutInitialState() {
        StateMachineBuilder builder = new StateMachineBuilder("M")
                .compositeState("C")
                .simpleState("C1", "C", null)
                .initialState("C");

        assertThrows(MalformedTreeException.class, builder::build);
    }

    @Test
    void build_allowsMachineWithoutInitialState() {
        StateMachine machine = new StateMachineBuilder("M").simpleState("A").build();

        assertNull(machine.getInitialState());
        assertEquals("", machine.toWireRecord().getRefs().get("initialState"));
    }

    @Test
    void build_rejectsUnknownNames() {
        assertThrows(MalformedTreeException.class,
                () -> new StateMachineBuilder("M").simpleState("A").transition("A", "Z").build());
        assertThrows(MalformedTreeException.class,
                () -> new StateMachineBuilder("M").simpleState("A", "Nowhere", null).build());
        assertThrows(MalformedTreeException.class,
                () -> new StateMachineBuilder("M").simpleState("A").initialState("Z").build());
    }

    @Test
    void build_rejectsSimpleParentAndCyclicContainment() {
        assertThrows(MalformedTreeException.class,
                () -> new StateMachineBuilder("M").simpleState("P").simpleState("A", "P", null).build());

        StateMachineBuilder cyclic = new StateMachineBuilder("M")
                .compositeState("X", "Y", null)
                .compositeState("Y", "X", null);
        assertThrows(MalformedTreeException.class, cyclic::build);
    }

    @Test
    void build_rejectsInitialTargetOutsideOwner() {
        StateMachineBuilder nestedAsMachineInitial = new StateMachineBuilder("M")
                .compositeState("C")
                .simpleState("C1", "C", null)
                .initialState("C", "C1")
                .initialState("C1");
        assertThrows(MalformedTreeException.class, nestedAsMachineInitial::build);

        StateMachineBuilder foreignTarget = new StateMachineBuilder("M")
                .compositeState("C")
                .simpleState("C1", "C", null)
                .simpleState("Top")
                .initialState("C", "Top");
        assertThrows(MalformedTreeException.class, foreignTarget::build);

        StateMachineBuilder onSimple = new StateMachineBuilder("M")
                .simpleState("A")
                .simpleState("B")
                .initialState("A", "B");
        assertThrows(MalformedTreeException.class, onSimple::build);
    }

    @Test
    void declare_rejectsDuplicateNames() {
        StateMachineBuilder builder = new StateMachineBuilder("M").simpleState("A");

        assertThrows(IllegalArgumentException.class, () -> builder.finalState("A"));
    }

    @Test
    void build_createsAnonymousStatesReferencedByKey() {
        StateMachine machine = new StateMachineBuilder("M", new SequentialIdGenerator())
                .compositeState("Outer")
                .anonymousState("_1", "Outer", null)
                .anonymousState("_2", "Outer", null)
                .transition("_1", "_2", "next", null)
                .initialState("Outer", "_1")
                .initialState("Outer")
                .build();

        CompositeState outer = (CompositeState) machine.getStates().get(0);
        State first = outer.getStates().get(0);
        assertNull(first.getName());
        assertSame(first, outer.getInitialState().getTarget());
        assertSame(outer.getStates().get(1), first.getOutgoingTransitions().get(0).getTarget());

        WireRecord firstRecord = machine.toWireRecord().childList("states").get(0).childList("states").get(0);
        assertTrue(firstRecord.getAttributes().containsKey("name"));
        assertNull(firstRecord.getAttributes().get("name"));
        assertThrows(IllegalArgumentException.class,
                () -> new StateMachineBuilder("M").simpleState("A").anonymousState("A", null, null));
    }
}
