package com.lrp.statemachine.ast;

/**
 * Structural kind of a {@link State}.
 *
 * @see State#getKind()
 */
public enum StateKind {
    /** Leaf state; never contains other states. */
    SIMPLE,
    /** Contains nested states and an initial pseudostate. */
    COMPOSITE
}
