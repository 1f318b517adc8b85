package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code substring(s, start, length)}.
 */
public final class SubstringFunction extends Node {

    private final Node string;
    private final Node start;
    private final Node length;

    public SubstringFunction(Node string, Node start, Node length) {
        this.string = Objects.requireNonNull(string, "string");
        this.start = Objects.requireNonNull(start, "start");
        this.length = Objects.requireNonNull(length, "length");
    }

    public Node string() {
        return string;
    }

    public Node start() {
        return start;
    }

    public Node length() {
        return length;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSubstringFunction(this);
    }

    @Override
    public String type() {
        return "SubstringFunction";
    }

    @Override
    protected List<Object> fields() {
        return List.of(string, start, length);
    }
}
