package com.lrp.statemachine.runtime;

import com.lrp.protocol.model.IdGenerator;
import com.lrp.statemachine.ast.StateMachine;

/**
 * Parser front-end: reads a source file and builds its AST (typically through
 * {@link com.lrp.statemachine.ast.build.StateMachineBuilder}). Node ids must come from
 * {@code ids}, the generator of the debug session that requested the parse.
 */
@FunctionalInterface
public interface StateMachineParser {

    StateMachine parse(String sourceFile, IdGenerator ids);
}
