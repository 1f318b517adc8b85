package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class VarTarget extends Node {

    private final String name;

    public VarTarget(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVarTarget(this);
    }

    @Override
    public String type() {
        return "VarTarget";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name);
    }
}
