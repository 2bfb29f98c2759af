package com.lrp.statemachine.runtime;

import com.lrp.statemachine.ast.StateMachine;

import java.util.List;

/** Creates the execution engine for a parsed state machine. */
@FunctionalInterface
public interface RuntimeFactory {

    Runtime create(StateMachine stateMachine, List<String> inputs);
}
