package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Inbound query: is the breakpoint of type {@code typeId} on AST element {@code elementId} activated? */
public final class CheckBreakpointArgs {

    private final String sourceFile;
    private final String typeId;
    private final String elementId;

    @JsonCreator
    public CheckBreakpointArgs(
            @JsonProperty("sourceFile") String sourceFile,
            @JsonProperty("typeId") String typeId,
            @JsonProperty("elementId") String elementId) {
        this.sourceFile = sourceFile;
        this.typeId = typeId;
        this.elementId = elementId;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public String getTypeId() {
        return typeId;
    }

    public String getElementId() {
        return elementId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CheckBreakpointArgs that = (CheckBreakpointArgs) o;
        return Objects.equals(sourceFile, that.sourceFile) && Objects.equals(typeId, that.typeId)
                && Objects.equals(elementId, that.elementId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceFile, typeId, elementId);
    }
}
