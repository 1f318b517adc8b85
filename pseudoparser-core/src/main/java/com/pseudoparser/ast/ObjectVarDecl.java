package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class ObjectVarDecl extends Node {

    private final String className;
    private final String name;

    public ObjectVarDecl(String className, String name) {
        this.className = Objects.requireNonNull(className, "className");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String className() {
        return className;
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitObjectVarDecl(this);
    }

    @Override
    public String type() {
        return "ObjectVarDecl";
    }

    @Override
    protected List<Object> fields() {
        return List.of(className, name);
    }
}
