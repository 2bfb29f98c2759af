package com.lrp.protocol.message;

import java.util.List;

/** Breakpoint types the backend supports. */
public final class GetBreakpointTypesResponse {

    private final List<BreakpointType> breakpointTypes;

    public GetBreakpointTypesResponse(List<BreakpointType> breakpointTypes) {
        this.breakpointTypes = breakpointTypes != null ? List.copyOf(breakpointTypes) : List.of();
    }

    public List<BreakpointType> getBreakpointTypes() {
        return breakpointTypes;
    }
}
