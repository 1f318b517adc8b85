package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Store into a {@link VarTarget}, {@link ArrayTarget} or {@link FieldTarget}.
 */
public final class Assignment extends Node {

    private final Node target;
    private final Node value;

    public Assignment(Node target, Node value) {
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Node target() {
        return target;
    }

    public Node value() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String type() {
        return "Assignment";
    }

    @Override
    protected List<Object> fields() {
        return List.of(target, value);
    }
}
