package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class WhileLoop extends Node {

    private final Node condition;
    private final List<Node> body;

    public WhileLoop(Node condition, List<? extends Node> body) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    public Node condition() {
        return condition;
    }

    public List<Node> body() {
        return body;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWhileLoop(this);
    }

    @Override
    public String type() {
        return "WhileLoop";
    }

    @Override
    protected List<Object> fields() {
        return List.of(condition, body);
    }
}
