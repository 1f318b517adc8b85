package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Numeric literal. The value is an {@link Integer}, a {@link Long}, a
 * {@link java.math.BigInteger} or a {@link Double}.
 */
public final class NumberLiteral extends Node {

    private final Number value;

    public NumberLiteral(Number value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public Number value() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }

    @Override
    public String type() {
        return "NumberLiteral";
    }

    @Override
    protected List<Object> fields() {
        return List.of(value);
    }
}
