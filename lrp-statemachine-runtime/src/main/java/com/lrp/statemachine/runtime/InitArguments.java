package com.lrp.statemachine.runtime;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Arguments required to start an execution: source file and ordered input symbols. */
public final class InitArguments {

    private final String sourceFile;
    private final List<String> inputs;

    @JsonCreator
    public InitArguments(
            @JsonProperty("sourceFile") String sourceFile,
            @JsonProperty("inputs") List<String> inputs) {
        this.sourceFile = sourceFile;
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public List<String> getInputs() {
        return inputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InitArguments that = (InitArguments) o;
        return Objects.equals(sourceFile, that.sourceFile) && Objects.equals(inputs, that.inputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceFile, inputs);
    }
}
