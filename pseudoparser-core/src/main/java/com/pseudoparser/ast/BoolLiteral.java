package com.pseudoparser.ast;

import java.util.List;

public final class BoolLiteral extends Node {

    private final boolean value;

    public BoolLiteral(boolean value) {
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBoolLiteral(this);
    }

    @Override
    public String type() {
        return "BoolLiteral";
    }

    @Override
    protected List<Object> fields() {
        return List.of(value);
    }
}
