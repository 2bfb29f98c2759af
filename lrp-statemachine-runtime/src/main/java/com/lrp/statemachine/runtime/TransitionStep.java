package com.lrp.statemachine.runtime;

import com.lrp.protocol.message.Step;
import com.lrp.statemachine.ast.Transition;

import java.util.Map;

/** Step that fires one transition; {@code info.transition} is the transition id. */
public final class TransitionStep extends Step {

    public TransitionStep(Transition transition) {
        super(Transition.TYPE, Map.of("transition", transition.getId()));
    }
}
