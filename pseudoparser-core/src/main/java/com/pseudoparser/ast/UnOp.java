package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class UnOp extends Node {

    private final String operator;
    private final Node operand;

    public UnOp(String operator, Node operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public String operator() {
        return operator;
    }

    public Node operand() {
        return operand;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnOp(this);
    }

    @Override
    public String type() {
        return "UnOp";
    }

    @Override
    protected List<Object> fields() {
        return List.of(operator, operand);
    }
}
