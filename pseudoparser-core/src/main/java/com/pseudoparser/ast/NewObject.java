package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class NewObject extends Node {

    private final String className;

    public NewObject(String className) {
        this.className = Objects.requireNonNull(className, "className");
    }

    public String className() {
        return className;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNewObject(this);
    }

    @Override
    public String type() {
        return "NewObject";
    }

    @Override
    protected List<Object> fields() {
        return List.of(className);
    }
}
