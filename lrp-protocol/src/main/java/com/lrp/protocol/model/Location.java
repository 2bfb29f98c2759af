package com.lrp.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Source span of an AST node: 1-based line and column of the start and end positions.
 * The end column is exclusive, as reported by the parser that produced the node.
 */
@JsonPropertyOrder({"line", "column", "endLine", "endColumn"})
public final class Location {

    private final int line;
    private final int column;
    private final int endLine;
    private final int endColumn;

    @JsonCreator
    public Location(
            @JsonProperty("line") int line,
            @JsonProperty("column") int column,
            @JsonProperty("endLine") int endLine,
            @JsonProperty("endColumn") int endColumn) {
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location that = (Location) o;
        return line == that.line && column == that.column && endLine == that.endLine && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
