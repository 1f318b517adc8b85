package com.pseudoparser.ast;

import java.util.Optional;

/**
 * Source span of a node. Lines and columns are 1-based; the end column is the
 * column of the last character covered by the span.
 */
public record SourcePosition(
    int line,
    int column,
    int endLine,
    int endColumn,
    String filename  // Can be null
) {
    public SourcePosition(int line, int column) {
        this(line, column, line, column, null);
    }

    public SourcePosition(int line, int column, int endLine, int endColumn) {
        this(line, column, endLine, endColumn, null);
    }

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position " + line + ":" + column);
        }
        // An end of 0 means "not known": collapse to the start
        if (endLine <= 0) {
            endLine = line;
        }
        if (endColumn <= 0) {
            endColumn = column;
        }
    }

    public Optional<String> file() {
        return Optional.ofNullable(filename);
    }

    /**
     * Returns a position running from the start of this one to the end of {@code other}.
     */
    public SourcePosition span(SourcePosition other) {
        return new SourcePosition(line, column, other.endLine(), other.endColumn(), filename);
    }

    @Override
    public String toString() {
        if (filename != null) {
            return filename + ":" + line + ":" + column;
        }
        return line + ":" + column;
    }
}
