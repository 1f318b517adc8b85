package com.pseudoparser.builder;

import com.pseudoparser.ParsingException;
import com.pseudoparser.ValidationException;
import com.pseudoparser.ast.ArrayAccess;
import com.pseudoparser.ast.ArraySlice;
import com.pseudoparser.ast.FieldAccess;
import com.pseudoparser.ast.FuncCallExpr;
import com.pseudoparser.ast.IndexRange;
import com.pseudoparser.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a postfix suffix into a call, element access, slice or field access.
 *
 * <p>The handlers take {@code [receiver, suffix items...]} where the suffix
 * items are the raw delimiter tokens plus the already built argument or index
 * values, in source order.</p>
 */
public class ExpressionHandler {

    private final TokenExtractor tokens;

    public ExpressionHandler(TokenExtractor tokens) {
        this.tokens = tokens;
    }

    /**
     * Applies one suffix to {@code receiver}, choosing the handler by the
     * opening delimiter: {@code (}, {@code [} or {@code .}.
     */
    public Node applySuffix(Node receiver, List<?> suffixItems) {
        if (suffixItems.isEmpty()) {
            throw new ParsingException("Empty suffix after " + tokens.describe(receiver));
        }
        List<Object> items = new ArrayList<>(suffixItems.size() + 1);
        items.add(receiver);
        items.addAll(suffixItems);

        Object opener = suffixItems.get(0);
        if (tokens.isDelimiter(opener, "(")) {
            return handleFunctionCall(items);
        }
        if (tokens.isDelimiter(opener, "[")) {
            return handleArrayAccess(items);
        }
        if (tokens.isDelimiter(opener, ".")) {
            return handleFieldAccess(items);
        }
        throw new ParsingException("Unrecognized suffix starting with " + tokens.describe(opener));
    }

    /**
     * {@code [callee, "(", arg, ",", arg, ")"]}
     */
    public FuncCallExpr handleFunctionCall(List<?> items) {
        Node callee = receiver(items);
        expectDelimiter(items, 1, "(");
        expectDelimiter(items, items.size() - 1, ")");

        List<Node> args = new ArrayList<>();
        for (Object item : items.subList(2, items.size() - 1)) {
            if (tokens.isDelimiter(item, ",")) {
                continue;
            }
            args.add(expression(item, "argument"));
        }
        return new FuncCallExpr(callee, args);
    }

    /**
     * {@code [array, "[", indexer, "]", "[", indexer, "]"...]} where each
     * indexer is an expression or an {@link IndexRange}. Gives an
     * {@link ArrayAccess} when every indexer is a bare expression, otherwise an
     * {@link ArraySlice} with point indexes widened to single-element ranges.
     */
    public Node handleArrayAccess(List<?> items) {
        Node array = receiver(items);
        List<Object> indexers = new ArrayList<>();
        boolean open = false;
        for (Object item : items.subList(1, items.size())) {
            if (tokens.isDelimiter(item, "[")) {
                if (open) {
                    throw new ParsingException("Unexpected '[' inside an index");
                }
                open = true;
            } else if (tokens.isDelimiter(item, "]")) {
                if (!open) {
                    throw new ParsingException("Unbalanced ']' in index of " + tokens.describe(array));
                }
                open = false;
            } else if (!open) {
                throw new ParsingException("Index " + tokens.describe(item) + " outside of brackets");
            } else if (item instanceof IndexRange || item instanceof Node) {
                indexers.add(item);
            } else {
                throw new ValidationException("Expected an index expression but found " + tokens.describe(item));
            }
        }
        if (open) {
            throw new ParsingException("Unclosed '[' in index of " + tokens.describe(array));
        }
        if (indexers.isEmpty()) {
            throw new ParsingException("Element access on " + tokens.describe(array) + " has no index");
        }

        boolean ranged = indexers.stream().anyMatch(IndexRange.class::isInstance);
        if (!ranged) {
            List<Node> indices = new ArrayList<>(indexers.size());
            for (Object indexer : indexers) {
                indices.add((Node) indexer);
            }
            return new ArrayAccess(array, indices);
        }
        List<IndexRange> ranges = new ArrayList<>(indexers.size());
        for (Object indexer : indexers) {
            if (indexer instanceof IndexRange range) {
                ranges.add(range);
            } else {
                ranges.add(IndexRange.at((Node) indexer));
            }
        }
        return new ArraySlice(array, ranges);
    }

    /**
     * {@code [object, ".", field]}
     */
    public FieldAccess handleFieldAccess(List<?> items) {
        Node object = receiver(items);
        expectDelimiter(items, 1, ".");
        if (items.size() != 3) {
            throw new ParsingException("Field access on " + tokens.describe(object)
                + " expects exactly one field name");
        }
        return new FieldAccess(object, tokens.extractName(items.get(2)));
    }

    private Node receiver(List<?> items) {
        if (items.isEmpty()) {
            throw new ParsingException("Suffix without a receiver");
        }
        return expression(items.get(0), "receiver");
    }

    private Node expression(Object item, String role) {
        if (item instanceof Node node) {
            return node;
        }
        throw new ValidationException("Expected an expression as " + role + " but found " + tokens.describe(item));
    }

    private void expectDelimiter(List<?> items, int index, String delimiter) {
        if (index < 1 || index >= items.size() || !tokens.isDelimiter(items.get(index), delimiter)) {
            Object found = index >= 1 && index < items.size() ? items.get(index) : null;
            throw new ParsingException("Expected '" + delimiter + "' but found " + tokens.describe(found));
        }
    }
}
