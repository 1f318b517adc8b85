package com.pseudoparser.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One dimension of an {@link ArraySlice}. Both bounds are unevaluated
 * expressions; an empty bound is open. Ranges are inclusive.
 */
public record IndexRange(Optional<Node> start, Optional<Node> end) {

    public IndexRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static IndexRange of(Node start, Node end) {
        return new IndexRange(Optional.of(start), Optional.of(end));
    }

    public static IndexRange openStart(Node end) {
        return new IndexRange(Optional.empty(), Optional.of(end));
    }

    public static IndexRange openEnd(Node start) {
        return new IndexRange(Optional.of(start), Optional.empty());
    }

    public static IndexRange open() {
        return new IndexRange(Optional.empty(), Optional.empty());
    }

    /**
     * Single-element range used for a point index inside a slice, e.g. the
     * {@code i} in {@code m[i][1:3]}.
     */
    public static IndexRange at(Node index) {
        return new IndexRange(Optional.of(index), Optional.of(index));
    }

    public boolean isOpenStart() {
        return start.isEmpty();
    }

    public boolean isOpenEnd() {
        return end.isEmpty();
    }
}
