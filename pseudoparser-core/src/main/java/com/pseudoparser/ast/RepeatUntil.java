package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Post-test loop: the body runs once before the condition is first checked.
 */
public final class RepeatUntil extends Node {

    private final List<Node> body;
    private final Node condition;

    public RepeatUntil(List<? extends Node> body, Node condition) {
        this.body = List.copyOf(Objects.requireNonNull(body, "body"));
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public List<Node> body() {
        return body;
    }

    public Node condition() {
        return condition;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRepeatUntil(this);
    }

    @Override
    public String type() {
        return "RepeatUntil";
    }

    @Override
    protected List<Object> fields() {
        return List.of(body, condition);
    }
}
