package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class FieldAccess extends Node {

    private final Node object;
    private final String field;

    public FieldAccess(Node object, String field) {
        this.object = Objects.requireNonNull(object, "object");
        this.field = Objects.requireNonNull(field, "field");
    }

    public Node object() {
        return object;
    }

    public String field() {
        return field;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFieldAccess(this);
    }

    @Override
    public String type() {
        return "FieldAccess";
    }

    @Override
    protected List<Object> fields() {
        return List.of(object, field);
    }
}
