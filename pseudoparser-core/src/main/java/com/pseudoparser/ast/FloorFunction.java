package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class FloorFunction extends Node {

    private final Node expression;

    public FloorFunction(Node expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Node expression() {
        return expression;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFloorFunction(this);
    }

    @Override
    public String type() {
        return "FloorFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(expression);
    }
}
