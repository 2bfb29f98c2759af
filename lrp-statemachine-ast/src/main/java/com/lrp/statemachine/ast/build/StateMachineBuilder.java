package com.lrp.statemachine.ast.build;

import com.lrp.protocol.error.MalformedTreeException;
import com.lrp.protocol.model.IdGenerator;
import com.lrp.protocol.model.Location;
import com.lrp.protocol.model.UuidIdGenerator;
import com.lrp.statemachine.ast.CompositeState;
import com.lrp.statemachine.ast.SimpleState;
import com.lrp.statemachine.ast.State;
import com.lrp.statemachine.ast.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tree-building pass for parser front-ends: collects state, transition and initial-state
 * declarations by state name, then {@link #build()} creates the AST in construction order
 * (states attached to their owners, then transitions, then initial states last) and checks it.
 * <p>
 * State names are unique within one builder. A declaration may name a parent composite that is
 * declared later; only {@link #build()} resolves names. Anonymous states are declared under a
 * key that other declarations use to refer to them; the key is not part of the AST.
 */
public final class StateMachineBuilder {

    private static final Logger log = LoggerFactory.getLogger(StateMachineBuilder.class);

    private final String name;
    private final Location location;
    private final IdGenerator ids;
    private final Map<String, StateDecl> states = new LinkedHashMap<>();
    private final List<TransitionDecl> transitions = new ArrayList<>();
    private final Map<String, String> compositeInitials = new LinkedHashMap<>();
    private String machineInitial;

    public StateMachineBuilder(String name, Location location, IdGenerator ids) {
        this.name = name;
        this.location = location;
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public StateMachineBuilder(String name, IdGenerator ids) {
        this(name, null, ids);
    }

    public StateMachineBuilder(String name) {
        this(name, null, UuidIdGenerator.INSTANCE);
    }

    public StateMachineBuilder simpleState(String stateName) {
        return simpleState(stateName, null, null);
    }

    /** @param parent name of the enclosing composite state, or null for a top-level state */
    public StateMachineBuilder simpleState(String stateName, String parent, Location location) {
        return declare(new StateDecl(stateName, stateName, parent, false, false, location));
    }

    /**
     * Declares a simple state without a name. {@code key} identifies it in later declarations of
     * this builder; the built state has a null name.
     */
    public StateMachineBuilder anonymousState(String key, String parent, Location location) {
        return declare(new StateDecl(key, null, parent, false, false, location));
    }

    public StateMachineBuilder finalState(String stateName) {
        return finalState(stateName, null, null);
    }

    public StateMachineBuilder finalState(String stateName, String parent, Location location) {
        return declare(new StateDecl(stateName, stateName, parent, false, true, location));
    }

    public StateMachineBuilder compositeState(String stateName) {
        return compositeState(stateName, null, null);
    }

    public StateMachineBuilder compositeState(String stateName, String parent, Location location) {
        return declare(new StateDecl(stateName, stateName, parent, true, false, location));
    }

    public StateMachineBuilder transition(String source, String target) {
        return transition(source, target, null, null, null);
    }

    public StateMachineBuilder transition(String source, String target, String input, String output) {
        return transition(source, target, input, output, null);
    }

    public StateMachineBuilder transition(String source, String target, String input, String output, Location location) {
        transitions.add(new TransitionDecl(
                Objects.requireNonNull(source, "source"),
                Objects.requireNonNull(target, "target"),
                input, output, location));
        return this;
    }

    /** Declares the initial state of the machine (a top-level state). */
    public StateMachineBuilder initialState(String target) {
        this.machineInitial = Objects.requireNonNull(target, "target");
        return this;
    }

    /** Declares the initial state of a composite state (one of its direct children). */
    public StateMachineBuilder initialState(String composite, String target) {
        compositeInitials.put(Objects.requireNonNull(composite, "composite"), Objects.requireNonNull(target, "target"));
        return this;
    }

    /**
     * Builds the AST.
     *
     * @throws MalformedTreeException when a name is unknown, a parent is not composite, containment
     *                                is cyclic, an initial target is not a direct child of its owner, or a composite
     *                                state has no initial state
     */
    public StateMachine build() {
        checkContainment();
        StateMachine machine = new StateMachine(name, location, ids);

        Map<String, State> created = new LinkedHashMap<>();
        for (StateDecl decl : states.values()) {
            created.put(decl.key(), decl.composite()
                    ? new CompositeState(decl.name(), decl.location(), ids)
                    : new SimpleState(decl.name(), decl.isFinal(), decl.location(), ids));
        }
        for (StateDecl decl : states.values()) {
            State state = created.get(decl.key());
            if (decl.parent() == null) {
                machine.addState(state);
            } else {
                ((CompositeState) created.get(decl.parent())).addState(state);
            }
        }

        for (TransitionDecl decl : transitions) {
            State source = lookup(created, decl.source(), "Transition source");
            State target = lookup(created, decl.target(), "Transition target");
            source.createTransition(target, decl.input(), decl.output(), decl.location());
        }

        for (Map.Entry<String, String> e : compositeInitials.entrySet()) {
            State owner = lookup(created, e.getKey(), "Initial state owner");
            if (!(owner instanceof CompositeState composite)) {
                throw new MalformedTreeException(owner.getId(), "Initial state declared on simple state " + e.getKey());
            }
            State target = lookup(created, e.getValue(), "Initial state target");
            if (target.getParentState() != composite) {
                throw new MalformedTreeException(composite.getId(),
                        "Initial state " + e.getValue() + " is not a direct child of " + e.getKey());
            }
            composite.setInitialState(target);
        }
        if (machineInitial != null) {
            State target = lookup(created, machineInitial, "Initial state target");
            if (target.getParentState() != null) {
                throw new MalformedTreeException(machine.getId(),
                        "Initial state " + machineInitial + " is not a top-level state");
            }
            machine.setInitialState(target);
        }

        for (State state : created.values()) {
            if (state instanceof CompositeState composite && composite.getInitialState() == null) {
                throw new MalformedTreeException(composite.getId(),
                        "Composite state " + composite.getName() + " has no initial state");
            }
        }
        log.debug("Built state machine name={} states={} transitions={} initialState={}",
                name, created.size(), transitions.size(), machineInitial);
        return machine;
    }

    private StateMachineBuilder declare(StateDecl decl) {
        Objects.requireNonNull(decl.key(), "stateName");
        if (states.containsKey(decl.key())) {
            throw new IllegalArgumentException("State already declared: " + decl.key());
        }
        states.put(decl.key(), decl);
        return this;
    }

    /** Parents exist, are composite, and no state transitively contains itself. */
    private void checkContainment() {
        for (StateDecl decl : states.values()) {
            Set<String> seen = new HashSet<>();
            seen.add(decl.key());
            for (String parent = decl.parent(); parent != null; parent = states.get(parent).parent()) {
                StateDecl parentDecl = states.get(parent);
                if (parentDecl == null) {
                    throw new MalformedTreeException(null, "Unknown parent state " + parent + " of " + decl.key());
                }
                if (!parentDecl.composite()) {
                    throw new MalformedTreeException(null, "Parent state " + parent + " of " + decl.key() + " is not composite");
                }
                if (!seen.add(parent)) {
                    throw new MalformedTreeException(null, "Cyclic containment through state " + parent);
                }
            }
        }
    }

    private static State lookup(Map<String, State> created, String stateName, String role) {
        State state = created.get(stateName);
        if (state == null) {
            throw new MalformedTreeException(null, role + " refers to unknown state " + stateName);
        }
        return state;
    }

    private record StateDecl(String key, String name, String parent, boolean composite, boolean isFinal, Location location) {
    }

    private record TransitionDecl(String source, String target, String input, String output, Location location) {
    }
}
