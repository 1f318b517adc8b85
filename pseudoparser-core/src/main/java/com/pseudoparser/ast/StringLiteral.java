package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * String literal with escapes already resolved.
 */
public final class StringLiteral extends Node {

    private final String value;

    public StringLiteral(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String value() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public String type() {
        return "StringLiteral";
    }

    @Override
    protected List<Object> fields() {
        return List.of(value);
    }
}
