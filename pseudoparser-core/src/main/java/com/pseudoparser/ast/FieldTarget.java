package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class FieldTarget extends Node {

    private final String object;
    private final String field;

    public FieldTarget(String object, String field) {
        this.object = Objects.requireNonNull(object, "object");
        this.field = Objects.requireNonNull(field, "field");
    }

    public String object() {
        return object;
    }

    public String field() {
        return field;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFieldTarget(this);
    }

    @Override
    public String type() {
        return "FieldTarget";
    }

    @Override
    protected List<Object> fields() {
        return List.of(object, field);
    }
}
