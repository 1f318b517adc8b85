package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Root of every parse: top-level statements in source order.
 */
public final class Program extends Node {

    private final List<Node> statements;

    public Program(List<? extends Node> statements) {
        this.statements = List.copyOf(Objects.requireNonNull(statements, "statements"));
    }

    public List<Node> statements() {
        return statements;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    protected List<Object> fields() {
        return List.of(statements);
    }
}
