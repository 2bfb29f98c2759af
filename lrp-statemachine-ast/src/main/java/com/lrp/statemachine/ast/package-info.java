/**
 * AST of hierarchical state machines: {@link com.lrp.statemachine.ast.StateMachine} root,
 * {@link com.lrp.statemachine.ast.SimpleState} / {@link com.lrp.statemachine.ast.CompositeState},
 * the {@link com.lrp.statemachine.ast.InitialState} pseudostate and
 * {@link com.lrp.statemachine.ast.Transition}, each serializable to a
 * {@link com.lrp.protocol.model.WireRecord}.
 * {@link com.lrp.statemachine.ast.build.StateMachineBuilder} builds well-formed trees from declarations.
 */
package com.lrp.statemachine.ast;
