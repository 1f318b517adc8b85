package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code class Point { x, y }}.
 */
public final class ClassDef extends Node {

    private final String name;
    private final List<String> fieldNames;

    public ClassDef(String name, List<String> fieldNames) {
        this.name = Objects.requireNonNull(name, "name");
        this.fieldNames = List.copyOf(Objects.requireNonNull(fieldNames, "fieldNames"));
    }

    public String name() {
        return name;
    }

    public List<String> fieldNames() {
        return fieldNames;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitClassDef(this);
    }

    @Override
    public String type() {
        return "ClassDef";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name, fieldNames);
    }
}
