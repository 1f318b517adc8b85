package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class StrlenFunction extends Node {

    private final Node expression;

    public StrlenFunction(Node expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Node expression() {
        return expression;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStrlenFunction(this);
    }

    @Override
    public String type() {
        return "StrlenFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(expression);
    }
}
