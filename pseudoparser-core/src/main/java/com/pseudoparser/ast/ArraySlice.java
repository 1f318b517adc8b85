package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Ranged access such as {@code a[1:n]} or {@code m[i][:]}, one range per dimension.
 */
public final class ArraySlice extends Node {

    private final Node array;
    private final List<IndexRange> ranges;

    public ArraySlice(Node array, List<IndexRange> ranges) {
        this.array = Objects.requireNonNull(array, "array");
        this.ranges = List.copyOf(Objects.requireNonNull(ranges, "ranges"));
    }

    public Node array() {
        return array;
    }

    public List<IndexRange> ranges() {
        return ranges;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArraySlice(this);
    }

    @Override
    public String type() {
        return "ArraySlice";
    }

    @Override
    protected List<Object> fields() {
        return List.of(array, ranges);
    }
}
