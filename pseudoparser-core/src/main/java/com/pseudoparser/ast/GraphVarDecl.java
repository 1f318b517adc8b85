package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class GraphVarDecl extends Node {

    private final String name;

    public GraphVarDecl(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGraphVarDecl(this);
    }

    @Override
    public String type() {
        return "GraphVarDecl";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name);
    }
}
