package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code connect g(a, b, c)}: an operation over a group of nodes of a graph.
 */
public final class GraphOperation extends Node {

    private final String graph;
    private final List<Node> nodes;

    public GraphOperation(String graph, List<? extends Node> nodes) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
    }

    public String graph() {
        return graph;
    }

    public List<Node> nodes() {
        return nodes;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGraphOperation(this);
    }

    @Override
    public String type() {
        return "GraphOperation";
    }

    @Override
    protected List<Object> fields() {
        return List.of(graph, nodes);
    }
}
