package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Point access {@code a[i][j]}: one unevaluated expression per dimension.
 */
public final class ArrayAccess extends Node {

    private final Node array;
    private final List<Node> indices;

    public ArrayAccess(Node array, List<? extends Node> indices) {
        this.array = Objects.requireNonNull(array, "array");
        this.indices = List.copyOf(Objects.requireNonNull(indices, "indices"));
    }

    public Node array() {
        return array;
    }

    public List<Node> indices() {
        return indices;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrayAccess(this);
    }

    @Override
    public String type() {
        return "ArrayAccess";
    }

    @Override
    protected List<Object> fields() {
        return List.of(array, indices);
    }
}
