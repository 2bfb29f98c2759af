package com.lrp.statemachine.runtime;

import com.lrp.protocol.model.IdGenerator;
import com.lrp.statemachine.ast.StateMachine;

import java.util.Objects;

/**
 * Per source file state of a debug session: the parsed AST, the id generator its nodes were
 * created with, and the runtime of the current execution (null until an execution is started).
 * Each session owns its tree; nothing is shared between sessions.
 */
public final class DebugSession {

    private final String sourceFile;
    private final StateMachine stateMachine;
    private final IdGenerator ids;
    private volatile Runtime runtime;

    DebugSession(String sourceFile, StateMachine stateMachine, IdGenerator ids) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public StateMachine getStateMachine() {
        return stateMachine;
    }

    public IdGenerator getIds() {
        return ids;
    }

    /** Runtime of the current execution, or null if none was started. */
    public Runtime getRuntime() {
        return runtime;
    }

    void setRuntime(Runtime runtime) {
        this.runtime = runtime;
    }

    /**
     * @throws IllegalStateException when no execution was started for this source file
     */
    Runtime requireRuntime() {
        Runtime r = runtime;
        if (r == null) {
            throw new IllegalStateException("No execution started for source file " + sourceFile);
        }
        return r;
    }
}
