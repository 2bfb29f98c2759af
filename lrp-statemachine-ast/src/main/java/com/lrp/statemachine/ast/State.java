package com.lrp.statemachine.ast;

import com.lrp.config.LrpConfig;
import com.lrp.protocol.error.MalformedTreeException;
import com.lrp.protocol.error.RecursionLimitException;
import com.lrp.protocol.model.ASTElement;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.WireRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of a state machine, either {@link SimpleState} or {@link CompositeState}.
 * <p>
 * Transitions are referenced from both endpoints: a transition sits in exactly one source's
 * outgoing list and one target's incoming list, and {@link #createTransition} is the only place
 * those lists change. The parent state is a non-owning back-reference set when the state is
 * attached to a {@link CompositeState}; top-level states have none.
 */
public abstract class State extends ASTElement {

    public static final String TYPE = "stateMachine.state";

    static final String ATTR_NAME = "name";
    static final String CHILD_TRANSITIONS = "transitions";
    static final String CHILD_FINAL_TRANSITIONS = "final transitions";

    private final String name;
    private final boolean isFinal;
    private final IdGenerator ids;
    private final List<Transition> outgoingTransitions = new ArrayList<>();
    private final List<Transition> incomingTransitions = new ArrayList<>();
    private CompositeState parentState;
    private boolean attached;

    protected State(String name, boolean isFinal, Location location, IdGenerator ids) {
        super(TYPE, location, ids);
        this.name = name;
        this.isFinal = isFinal;
        this.ids = ids;
    }

    public abstract StateKind getKind();

    /** Name of the state; null for anonymous states. */
    public String getName() {
        return name;
    }

    public boolean isFinal() {
        return isFinal;
    }

    /** Enclosing composite state, or null for top-level states. */
    public CompositeState getParentState() {
        return parentState;
    }

    public List<Transition> getOutgoingTransitions() {
        return Collections.unmodifiableList(outgoingTransitions);
    }

    public List<Transition> getIncomingTransitions() {
        return Collections.unmodifiableList(incomingTransitions);
    }

    /** Directly contained states; always empty for simple states. */
    public List<State> getStates() {
        return List.of();
    }

    /**
     * Creates a transition from this state to {@code target} and registers it in this state's
     * outgoing list and the target's incoming list. The transition id comes from this state's
     * id generator.
     *
     * @param input    input required to fire the transition (may be null)
     * @param output   output produced when the transition fires (may be null)
     * @param location source span (may be null)
     */
    public Transition createTransition(State target, String input, String output, Location location) {
        Transition transition = new Transition(this, target, input, output, location, ids);
        outgoingTransitions.add(transition);
        target.incomingTransitions.add(transition);
        return transition;
    }

    public Transition createTransition(State target, String input, String output) {
        return createTransition(target, input, output, null);
    }

    public Transition createTransition(State target) {
        return createTransition(target, null, null, null);
    }

    /**
     * State execution actually enters when entering this state: the state itself for a simple
     * state, otherwise the nested initial state of the composite's initial target.
     *
     * @throws MalformedTreeException  when a composite state on the way has no initial state
     * @throws RecursionLimitException when the chain is longer than {@code maxDepth}
     */
    public State getNestedInitialState(int maxDepth) {
        State current = this;
        int hops = 0;
        while (current instanceof CompositeState composite) {
            if (hops++ >= maxDepth) {
                throw new RecursionLimitException(TYPE, composite.getId(), maxDepth);
            }
            InitialState initial = composite.getInitialState();
            if (initial == null) {
                throw new MalformedTreeException(composite.getId(), "Composite state has no initial state");
            }
            current = initial.getTarget();
        }
        return current;
    }

    public State getNestedInitialState() {
        return getNestedInitialState(LrpConfig.DEFAULT_MAX_TREE_DEPTH);
    }

    /** Nesting depth: 0 for top-level states, parent depth + 1 otherwise. */
    public int getDepth() {
        int depth = 0;
        for (CompositeState p = parentState; p != null; p = p.getParentState()) {
            depth++;
        }
        return depth;
    }

    /** Whether {@code candidate} is this state or one of its enclosing states. */
    public boolean isSelfOrAncestor(State candidate) {
        for (State s = this; s != null; s = s.getParentState()) {
            if (s == candidate) return true;
        }
        return false;
    }

    /** Marks this state as owned; a state has exactly one owner. */
    void attachTo(CompositeState parent) {
        if (attached) {
            throw new IllegalStateException("State already attached to an owner: " + describe());
        }
        this.parentState = parent;
        this.attached = true;
    }

    String describe() {
        return name != null ? name + " (" + getId() + ")" : getId();
    }

    @Override
    protected WireRecord toWireRecord(SerializationContext context) {
        List<Transition> transitions = new ArrayList<>();
        List<Transition> finalTransitions = new ArrayList<>();
        for (Transition transition : outgoingTransitions) {
            (transition.getTarget().isFinal() ? finalTransitions : transitions).add(transition);
        }
        WireRecord.Builder record = recordBuilder()
                .attribute(ATTR_NAME, name)
                .children(CHILD_TRANSITIONS, context.serializeAll(transitions))
                .children(CHILD_FINAL_TRANSITIONS, context.serializeAll(finalTransitions));
        contribute(record, context);
        return record.build();
    }

    /** Adds the kind-specific children and refs to this state's record. */
    protected abstract void contribute(WireRecord.Builder record, SerializationContext context);
}
