package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Binary operation. {@code shortCircuit} marks a logical operator whose right
 * operand is only evaluated when the left one does not decide the result.
 *
 * @see ShortCircuitBinOp
 */
public final class BinOp extends Node {

    private final String operator;
    private final Node left;
    private final Node right;
    private final boolean shortCircuit;

    public BinOp(String operator, Node left, Node right, boolean shortCircuit) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.shortCircuit = shortCircuit;
    }

    public BinOp(String operator, Node left, Node right) {
        this(operator, left, right, false);
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

    public boolean shortCircuit() {
        return shortCircuit;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinOp(this);
    }

    @Override
    public String type() {
        return "BinOp";
    }

    @Override
    protected List<Object> fields() {
        return List.of(operator, left, right, shortCircuit);
    }
}
