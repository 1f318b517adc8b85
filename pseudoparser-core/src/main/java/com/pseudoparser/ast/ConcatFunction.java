package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class ConcatFunction extends Node {

    private final Node left;
    private final Node right;

    public ConcatFunction(Node left, Node right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConcatFunction(this);
    }

    @Override
    public String type() {
        return "ConcatFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(left, right);
    }
}
