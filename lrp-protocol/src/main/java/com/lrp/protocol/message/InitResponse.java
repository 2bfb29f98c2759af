package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Response to an init request: whether execution finished immediately. */
public final class InitResponse {

    private final boolean executionDone;

    public InitResponse(boolean executionDone) {
        this.executionDone = executionDone;
    }

    public InitResponse() {
        this(false);
    }

    @JsonProperty("isExecutionDone")
    public boolean isExecutionDone() {
        return executionDone;
    }
}
