package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Response to a step request: whether execution is done after the step. */
public final class StepResponse {

    private final boolean executionDone;

    public StepResponse(boolean executionDone) {
        this.executionDone = executionDone;
    }

    public StepResponse() {
        this(false);
    }

    @JsonProperty("isExecutionDone")
    public boolean isExecutionDone() {
        return executionDone;
    }
}
