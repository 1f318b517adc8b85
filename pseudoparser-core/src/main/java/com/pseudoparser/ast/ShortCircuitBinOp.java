package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Logical {@code and}/{@code or}; the right operand is evaluated lazily.
 */
public final class ShortCircuitBinOp extends Node {

    private final String operator;
    private final Node left;
    private final Node right;

    public ShortCircuitBinOp(String operator, Node left, Node right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public String operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitShortCircuitBinOp(this);
    }

    @Override
    public String type() {
        return "ShortCircuitBinOp";
    }

    @Override
    protected List<Object> fields() {
        return List.of(operator, left, right);
    }
}
