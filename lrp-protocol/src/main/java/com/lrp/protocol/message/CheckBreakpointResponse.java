package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Result of a breakpoint check. A negative result is a normal answer, not an error; its message
 * explains why the breakpoint did not activate. The message is omitted from JSON when null.
 */
@JsonPropertyOrder({"isActivated", "message"})
public final class CheckBreakpointResponse {

    private final boolean activated;
    private final String message;

    public CheckBreakpointResponse(boolean activated, String message) {
        this.activated = activated;
        this.message = message;
    }

    public static CheckBreakpointResponse activated(String message) {
        return new CheckBreakpointResponse(true, message);
    }

    public static CheckBreakpointResponse notActivated() {
        return new CheckBreakpointResponse(false, null);
    }

    public static CheckBreakpointResponse notActivated(String message) {
        return new CheckBreakpointResponse(false, message);
    }

    @JsonProperty("isActivated")
    public boolean isActivated() {
        return activated;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getMessage() {
        return message;
    }
}
