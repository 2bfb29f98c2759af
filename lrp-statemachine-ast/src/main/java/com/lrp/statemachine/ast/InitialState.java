package com.lrp.statemachine.ast;

import java.util.Objects;

/**
 * Initial pseudostate: records which state execution enters first in its owner (a
 * {@link StateMachine} or a {@link CompositeState}). It is not a node of its own on the wire;
 * the owner's record carries {@code refs.initialState} with the target id instead.
 */
public final class InitialState {

    private final State target;

    public InitialState(State target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    public State getTarget() {
        return target;
    }

    /** Same as the target's parent: the composite state containing the pseudostate, or null at top level. */
    public CompositeState getParentState() {
        return target.getParentState();
    }

    /** @see State#getNestedInitialState(int) */
    public State getNestedInitialState(int maxDepth) {
        return target.getNestedInitialState(maxDepth);
    }

    public State getNestedInitialState() {
        return target.getNestedInitialState();
    }
}
