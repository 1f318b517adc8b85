package com.pseudoparser.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code return} with an optional value; a bare {@code return} has no value,
 * not a {@link NullLiteral}.
 */
public final class ReturnStmt extends Node {

    private final Node value;  // Can be null

    public ReturnStmt(Node value) {
        this.value = value;
    }

    public Optional<Node> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReturnStmt(this);
    }

    @Override
    public String type() {
        return "ReturnStmt";
    }

    @Override
    protected List<Object> fields() {
        return List.of(value());
    }
}
