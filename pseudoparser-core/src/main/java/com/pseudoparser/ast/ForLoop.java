package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Counted loop {@code for i = start to end { ... }}. The loop variable is
 * absent for {@code for start to end { ... }}. {@code preserveCounter} tells
 * whether the counter keeps its final value after the loop ({@code keep}, the
 * default) or not ({@code reset}).
 */
public final class ForLoop extends Node {

    private final String variable;  // Can be null
    private final Node start;
    private final Node end;
    private final List<Node> body;
    private final boolean preserveCounter;

    public ForLoop(
        String variable,
        Node start,
        Node end,
        List<? extends Node> body,
        boolean preserveCounter
    ) {
        this.variable = variable;
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        this.body = List.copyOf(Objects.requireNonNull(body, "body"));
        this.preserveCounter = preserveCounter;
    }

    public ForLoop(String variable, Node start, Node end, List<? extends Node> body) {
        this(variable, start, end, body, true);
    }

    public Optional<String> variable() {
        return Optional.ofNullable(variable);
    }

    public Node start() {
        return start;
    }

    public Node end() {
        return end;
    }

    public List<Node> body() {
        return body;
    }

    public boolean preserveCounter() {
        return preserveCounter;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForLoop(this);
    }

    @Override
    public String type() {
        return "ForLoop";
    }

    @Override
    protected List<Object> fields() {
        return List.of(variable(), start, end, body, preserveCounter);
    }
}
