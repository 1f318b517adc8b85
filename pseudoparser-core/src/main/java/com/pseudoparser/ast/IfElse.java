package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class IfElse extends Node {

    private final Node condition;
    private final List<Node> thenBranch;
    private final List<Node> elseBranch;

    public IfElse(
        Node condition,
        List<? extends Node> thenBranch,
        List<? extends Node> elseBranch
    ) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.thenBranch = List.copyOf(Objects.requireNonNull(thenBranch, "thenBranch"));
        this.elseBranch = List.copyOf(Objects.requireNonNull(elseBranch, "elseBranch"));
    }

    public Node condition() {
        return condition;
    }

    public List<Node> thenBranch() {
        return thenBranch;
    }

    public List<Node> elseBranch() {
        return elseBranch;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfElse(this);
    }

    @Override
    public String type() {
        return "IfElse";
    }

    @Override
    protected List<Object> fields() {
        return List.of(condition, thenBranch, elseBranch);
    }
}
