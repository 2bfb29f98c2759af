package com.lrp.statemachine.runtime;

import com.lrp.protocol.message.BreakpointType;
import com.lrp.protocol.message.CheckBreakpointResponse;
import com.lrp.protocol.model.ASTElement;
import com.lrp.statemachine.ast.State;
import com.lrp.statemachine.ast.Transition;

import java.util.List;

/**
 * Contract of the execution engine running one state machine. The engine decides which
 * transition fires next; this layer only reads its state and forwards step and breakpoint
 * requests. Implementations are supplied by the embedding process through a {@link RuntimeFactory}.
 */
public interface Runtime {

    /** Full ordered input sequence given at start. */
    List<String> getInputs();

    /** Index in {@link #getInputs()} of the next input to consume. */
    int getNextConsumedInputIndex();

    State getCurrentState();

    /** Outputs produced so far, in order. */
    List<String> getOutputs();

    /** Transition the next step will fire, or null when no transition can fire. */
    Transition getNextTransition();

    boolean isExecutionDone();

    /** Fires the next transition. */
    void nextStep();

    /**
     * Evaluates a breakpoint of the given type on an AST element of the executed machine.
     * Type and element have already been resolved by the caller.
     */
    CheckBreakpointResponse checkBreakpoint(BreakpointType type, ASTElement element);
}
