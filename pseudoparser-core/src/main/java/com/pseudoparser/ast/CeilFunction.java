package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class CeilFunction extends Node {

    private final Node expression;

    public CeilFunction(Node expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Node expression() {
        return expression;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCeilFunction(this);
    }

    @Override
    public String type() {
        return "CeilFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(expression);
    }
}
