package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Call in statement position; the result, if any, is discarded.
 */
public final class CallStmt extends Node {

    private final String name;
    private final List<Node> args;

    public CallStmt(String name, List<? extends Node> args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = List.copyOf(Objects.requireNonNull(args, "args"));
    }

    public String name() {
        return name;
    }

    public List<Node> args() {
        return args;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallStmt(this);
    }

    @Override
    public String type() {
        return "CallStmt";
    }

    @Override
    protected List<Object> fields() {
        return List.of(name, args);
    }
}
