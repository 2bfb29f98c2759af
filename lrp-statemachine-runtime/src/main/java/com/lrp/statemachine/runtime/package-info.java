/**
 * State machine execution as seen by the debugger: runtime snapshots, steps, breakpoint types and
 * the {@link com.lrp.statemachine.runtime.StateMachineLanguageRuntime} session facade.
 * The parser ({@link com.lrp.statemachine.runtime.StateMachineParser}) and the execution engine
 * ({@link com.lrp.statemachine.runtime.Runtime}, {@link com.lrp.statemachine.runtime.RuntimeFactory})
 * are supplied by the embedding process.
 */
package com.lrp.statemachine.runtime;
