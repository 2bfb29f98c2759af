package com.lrp.statemachine.ast;

import com.lrp.protocol.error.MalformedTreeException;
import com.lrp.protocol.model.ASTElement;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.UuidIdGenerator;
import com.lrp.protocol.model.WireRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Root of a state machine AST: a name, the top-level states it owns and its initial state.
 * <p>
 * Unlike a composite state, a machine without initial state still serializes, with an empty
 * {@code refs.initialState}.
 */
public final class StateMachine extends ASTElement {

    public static final String TYPE = "stateMachine.stateMachine";

    private final String name;
    private final List<State> states = new ArrayList<>();
    private InitialState initialState;

    public StateMachine(String name, Location location, IdGenerator ids) {
        super(TYPE, location, ids);
        this.name = name;
    }

    public StateMachine(String name) {
        this(name, null, UuidIdGenerator.INSTANCE);
    }

    public String getName() {
        return name;
    }

    /** Top-level states in declaration order. */
    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    /**
     * Attaches a top-level state.
     *
     * @throws IllegalStateException when the state already has an owner
     */
    public void addState(State state) {
        Objects.requireNonNull(state, "state");
        state.attachTo(null);
        states.add(state);
    }

    /** Initial pseudostate, or null if none was declared. */
    public InitialState getInitialState() {
        return initialState;
    }

    /** Sets the initial pseudostate; its target must be a top-level state of this machine. */
    public void setInitialState(InitialState initialState) {
        Objects.requireNonNull(initialState, "initialState");
        if (this.initialState != null) {
            throw new IllegalStateException("Initial state already set on state machine " + name);
        }
        if (!states.contains(initialState.getTarget())) {
            throw new IllegalArgumentException("Initial target " + initialState.getTarget().describe()
                    + " is not a top-level state of state machine " + name);
        }
        this.initialState = initialState;
    }

    public InitialState setInitialState(State target) {
        InitialState initial = new InitialState(target);
        setInitialState(initial);
        return initial;
    }

    /**
     * Simple state execution starts in.
     *
     * @throws MalformedTreeException when the machine or a composite on the way has no initial state
     */
    public State getNestedInitialState(int maxDepth) {
        if (initialState == null) {
            throw new MalformedTreeException(getId(), "State machine has no initial state");
        }
        return initialState.getNestedInitialState(maxDepth);
    }

    /** Every state of the machine, pre-order (a composite before its children). */
    public List<State> getAllStates() {
        List<State> all = new ArrayList<>();
        Deque<State> pending = new ArrayDeque<>();
        for (int i = states.size() - 1; i >= 0; i--) {
            pending.push(states.get(i));
        }
        while (!pending.isEmpty()) {
            State state = pending.pop();
            all.add(state);
            List<State> nested = state.getStates();
            for (int i = nested.size() - 1; i >= 0; i--) {
                pending.push(nested.get(i));
            }
        }
        return all;
    }

    /** Every transition of the machine, grouped by source state in {@link #getAllStates()} order. */
    public List<Transition> getAllTransitions() {
        List<Transition> all = new ArrayList<>();
        for (State state : getAllStates()) {
            all.addAll(state.getOutgoingTransitions());
        }
        return all;
    }

    /**
     * Finds the machine, a state or a transition by id. Returns null if not found.
     */
    public ASTElement findElementById(String elementId) {
        if (elementId == null || elementId.isBlank()) return null;
        if (elementId.equals(getId())) return this;
        for (State state : getAllStates()) {
            if (elementId.equals(state.getId())) return state;
            for (Transition transition : state.getOutgoingTransitions()) {
                if (elementId.equals(transition.getId())) return transition;
            }
        }
        return null;
    }

    @Override
    protected WireRecord toWireRecord(SerializationContext context) {
        return recordBuilder()
                .attribute(State.ATTR_NAME, name)
                .children(CompositeState.CHILD_STATES, context.serializeAll(states))
                .ref(CompositeState.REF_INITIAL_STATE, initialState == null ? "" : initialState.getTarget().getId())
                .build();
    }
}
