package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code var a, b = 1}. Each item is a {@link VarTarget} (no initializer)
 * or an {@link Assignment} (with initializer), in declaration order.
 */
public final class VarDecl extends Node {

    private final List<Node> items;

    public VarDecl(List<? extends Node> items) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public List<Node> items() {
        return items;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }

    @Override
    public String type() {
        return "VarDecl";
    }

    @Override
    protected List<Object> fields() {
        return List.of(items);
    }
}
