package com.pseudoparser.ast;

import java.util.List;
import java.util.Objects;

/**
 * Source comment kept as a statement. The text excludes the comment
 * delimiters and surrounding whitespace.
 */
public final class Comment extends Node {

    private final String text;

    public Comment(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
        return text;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComment(this);
    }

    @Override
    public String type() {
        return "Comment";
    }

    @Override
    protected List<Object> fields() {
        return List.of(text);
    }
}
