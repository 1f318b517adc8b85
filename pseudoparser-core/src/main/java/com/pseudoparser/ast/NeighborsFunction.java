package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

public final class NeighborsFunction extends Node {

    private final String graph;
    private final Node node;

    public NeighborsFunction(String graph, Node node) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.node = Objects.requireNonNull(node, "node");
    }

    public String graph() {
        return graph;
    }

    public Node node() {
        return node;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNeighborsFunction(this);
    }

    @Override
    public String type() {
        return "NeighborsFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(graph, node);
    }
}
