package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class AddEdgeFunction extends Node {

    private final String graph;
    private final Node from;
    private final Node to;

    public AddEdgeFunction(String graph, Node from, Node to) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public String graph() {
        return graph;
    }

    public Node from() {
        return from;
    }

    public Node to() {
        return to;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAddEdgeFunction(this);
    }

    @Override
    public String type() {
        return "AddEdgeFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(graph, from, to);
    }
}
