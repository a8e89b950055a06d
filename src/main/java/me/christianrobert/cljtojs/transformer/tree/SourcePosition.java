package me.christianrobert.cljtojs.transformer.tree;

import java.util.Objects;

/**
 * Location of a node in the source text (1-based line and column).
 */
public class SourcePosition {

    private final int line;
    private final int column;

    public SourcePosition(int line, int column) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column must be positive, got " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourcePosition that = (SourcePosition) o;
        return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
