package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Read of a variable.
 */
public final class Var extends Node {

    private final String name;

    public Var(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVar(this);
    }

    @Override
    public String type() {
        return "Var";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name);
    }
}
