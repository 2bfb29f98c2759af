package com.lrp.statemachine.ast;

import com.lrp.protocol.error.MalformedTreeException;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.UuidIdGenerator;
import com.lrp.protocol.model.WireRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State that contains other states. A composite state is never final and, once fully built,
 * has exactly one initial state targeting one of its direct children.
 */
public final class CompositeState extends State {

    static final String CHILD_STATES = "states";
    static final String REF_INITIAL_STATE = "initialState";

    private final List<State> states = new ArrayList<>();
    private InitialState initialState;

    public CompositeState(String name, Location location, IdGenerator ids) {
        super(name, false, location, ids);
    }

    public CompositeState(String name) {
        this(name, null, UuidIdGenerator.INSTANCE);
    }

    @Override
    public StateKind getKind() {
        return StateKind.COMPOSITE;
    }

    @Override
    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    /**
     * Attaches {@code child} as the next direct child and makes this state its parent.
     *
     * @throws IllegalStateException    when the child already has an owner
     * @throws IllegalArgumentException when attaching would make this state contain itself
     */
    public void addState(State child) {
        Objects.requireNonNull(child, "child");
        if (isSelfOrAncestor(child)) {
            throw new IllegalArgumentException("State cannot contain itself: " + child.describe());
        }
        child.attachTo(this);
        states.add(child);
    }

    /** Initial pseudostate, or null while the state is still being built. */
    public InitialState getInitialState() {
        return initialState;
    }

    /**
     * Sets the initial pseudostate. Its target must be a direct child of this state; the initial
     * state is set once, after the children are attached.
     */
    public void setInitialState(InitialState initialState) {
        Objects.requireNonNull(initialState, "initialState");
        if (this.initialState != null) {
            throw new IllegalStateException("Initial state already set on " + describe());
        }
        if (!states.contains(initialState.getTarget())) {
            throw new IllegalArgumentException("Initial target " + initialState.getTarget().describe()
                    + " is not a direct child of " + describe());
        }
        this.initialState = initialState;
    }

    public InitialState setInitialState(State target) {
        InitialState initial = new InitialState(target);
        setInitialState(initial);
        return initial;
    }

    @Override
    protected WireRecord toWireRecord(SerializationContext context) {
        if (initialState == null) {
            throw new MalformedTreeException(getId(), "Composite state has no initial state");
        }
        return super.toWireRecord(context);
    }

    @Override
    protected void contribute(WireRecord.Builder record, SerializationContext context) {
        record.children(CHILD_STATES, context.serializeAll(states))
                .ref(REF_INITIAL_STATE, initialState.getTarget().getId());
    }
}
