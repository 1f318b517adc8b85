package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class LengthFunction extends Node {

    private final Node array;

    public LengthFunction(Node array) {
        this.array = Objects.requireNonNull(array, "array");
    }

    public Node array() {
        return array;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLengthFunction(this);
    }

    @Override
    public String type() {
        return "LengthFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(array);
    }
}
