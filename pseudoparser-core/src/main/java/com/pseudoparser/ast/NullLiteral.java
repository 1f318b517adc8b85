package com.pseudoparser.ast;

import java.util.List;

public final class NullLiteral extends Node {

    public NullLiteral() {
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNullLiteral(this);
    }

    @Override
    public String type() {
        return "NullLiteral";
    }

    @Override
    protected List<Object> fields() {
        return List.of();
    }
}
