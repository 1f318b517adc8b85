package com.pseudoparser.builder;

import com.pseudoparser.ParsingException;
import com.pseudoparser.ast.IndexRange;
import com.pseudoparser.ast.Node;

/**
 * Builds the value of one bracketed indexer: an {@link IndexRange} for
 * {@code a:b}, {@code :b}, {@code a:} and {@code :}, or the bare expression for
 * a point index. Whether the enclosing access is a slice is decided by
 * {@link ExpressionHandler#handleArrayAccess}.
 */
public class IndexerProcessor {

    public IndexRange processRange(Node start, Node end) {
        return IndexRange.of(bound(start, "start"), bound(end, "end"));
    }

    public IndexRange processOpenStart(Node end) {
        return IndexRange.openStart(bound(end, "end"));
    }

    public IndexRange processOpenEnd(Node start) {
        return IndexRange.openEnd(bound(start, "start"));
    }

    public IndexRange processOpenBoth() {
        return IndexRange.open();
    }

    public Node processSingle(Node index) {
        return bound(index, "index");
    }

    private static Node bound(Node node, String what) {
        if (node == null) {
            throw new ParsingException("Indexer is missing its " + what + " expression");
        }
        return node;
    }
}
