package com.lrp.protocol.message;

import com.lrp.config.LrpConfig;
import com.lrp.protocol.model.ModelElement;
import com.lrp.protocol.model.SerializationContext;
import com.lrp.protocol.model.WireRecord;

import java.util.Objects;

/**
 * Response to a runtime-state request. Refs of the runtime state point into the AST previously
 * returned by the parse request, so they are not validated here.
 */
public final class GetRuntimeStateResponse {

    private final WireRecord runtimeStateRoot;

    public GetRuntimeStateResponse(WireRecord runtimeStateRoot) {
        this.runtimeStateRoot = Objects.requireNonNull(runtimeStateRoot, "runtimeStateRoot");
    }

    public static GetRuntimeStateResponse of(ModelElement runtimeStateRoot, LrpConfig config) {
        return new GetRuntimeStateResponse(SerializationContext.fromConfig(config).serialize(runtimeStateRoot));
    }

    public static GetRuntimeStateResponse of(ModelElement runtimeStateRoot) {
        return of(runtimeStateRoot, LrpConfig.defaults());
    }

    public WireRecord getRuntimeStateRoot() {
        return runtimeStateRoot;
    }
}
