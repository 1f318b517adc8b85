package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code traverse g from a to b}.
 */
public final class GraphTraversal extends Node {

    private final String graph;
    private final Node start;
    private final Node end;

    public GraphTraversal(String graph, Node start, Node end) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public String graph() {
        return graph;
    }

    public Node start() {
        return start;
    }

    public Node end() {
        return end;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGraphTraversal(this);
    }

    @Override
    public String type() {
        return "GraphTraversal";
    }

    @Override
    protected List<Object> fields() {
        return List.of(graph, start, end);
    }
}
