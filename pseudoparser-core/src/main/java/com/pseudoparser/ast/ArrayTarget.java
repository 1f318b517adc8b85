package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class ArrayTarget extends Node {

    private final String name;
    private final List<Node> indices;

    public ArrayTarget(String name, List<? extends Node> indices) {
        this.name = Objects.requireNonNull(name, "name");
        this.indices = List.copyOf(Objects.requireNonNull(indices, "indices"));
    }

    public String name() {
        return name;
    }

    public List<Node> indices() {
        return indices;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrayTarget(this);
    }

    @Override
    public String type() {
        return "ArrayTarget";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name, indices);
    }
}
