package com.lrp.statemachine.runtime;

import com.lrp.protocol.message.BreakpointParameter;
import com.lrp.protocol.message.BreakpointType;
import com.lrp.statemachine.ast.State;
import com.lrp.statemachine.ast.Transition;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Breakpoint types the state machine backend offers to the front-end. */
public final class StateMachineBreakpointTypes {

    public static final String STATE_REACHED = "stateMachine.stateReached";
    public static final String STATE_EXITED = "stateMachine.stateExited";
    public static final String TRANSITION_FIRED = "stateMachine.transitionFired";

    public static final BreakpointType STATE_REACHED_TYPE = new BreakpointType(
            STATE_REACHED, "State reached",
            List.of(BreakpointParameter.object("state", State.TYPE)),
            "Breaks when a specific state is reached.");

    public static final BreakpointType STATE_EXITED_TYPE = new BreakpointType(
            STATE_EXITED, "State exited",
            List.of(BreakpointParameter.object("state", State.TYPE)),
            "Breaks when a specific state is about to be exited.");

    public static final BreakpointType TRANSITION_FIRED_TYPE = new BreakpointType(
            TRANSITION_FIRED, "Transition fired",
            List.of(BreakpointParameter.object("transition", Transition.TYPE)),
            "Breaks when a specific transition is about to be fired.");

    private static final List<BreakpointType> ALL = List.of(STATE_REACHED_TYPE, STATE_EXITED_TYPE, TRANSITION_FIRED_TYPE);

    private StateMachineBreakpointTypes() {
    }

    public static List<BreakpointType> all() {
        return ALL;
    }

    public static Optional<BreakpointType> findById(String typeId) {
        if (typeId == null) return Optional.empty();
        return ALL.stream().filter(t -> t.getId().equals(typeId)).findFirst();
    }

    /** AST node type the breakpoint is set on: the object type of its first object parameter. */
    public static Optional<String> targetElementType(BreakpointType type) {
        return type.getParameters().stream()
                .map(BreakpointParameter::getObjectType)
                .filter(Objects::nonNull)
                .findFirst();
    }
}
