package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code array A[n][m]}; dimensions are unevaluated expressions.
 */
public final class ArrayVarDecl extends Node {

    private final String name;
    private final List<Node> dimensions;

    public ArrayVarDecl(String name, List<? extends Node> dimensions) {
        this.name = Objects.requireNonNull(name, "name");
        this.dimensions = List.copyOf(Objects.requireNonNull(dimensions, "dimensions"));
    }

    public String name() {
        return name;
    }

    public List<Node> dimensions() {
        return dimensions;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrayVarDecl(this);
    }

    @Override
    public String type() {
        return "ArrayVarDecl";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name, dimensions);
    }
}
