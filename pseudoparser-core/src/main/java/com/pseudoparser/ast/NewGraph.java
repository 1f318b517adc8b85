package com.pseudoparser.ast;

import java.util.List;

/**
 * {@code new graph()}.
 */
public final class NewGraph extends Node {

    public NewGraph() {
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNewGraph(this);
    }

    @Override
    public String type() {
        return "NewGraph";
    }

    @Override
    protected List<Object> fields() {
        return List.of();
    }
}
