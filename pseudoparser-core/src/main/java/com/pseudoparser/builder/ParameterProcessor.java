package com.pseudoparser.builder;

import com.pseudoparser.ValidationException;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.Parameter;
import com.pseudoparser.ast.ParameterType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds subroutine {@link Parameter}s from the items of one parameter
 * production.
 */
public class ParameterProcessor {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");

    private final TokenExtractor tokens;

    public ParameterProcessor(TokenExtractor tokens) {
        this.tokens = tokens;
    }

    /** {@code [name]} */
    public Parameter processSimpleParameter(List<?> items) {
        expectSize(items, 1, "Simple");
        return new Parameter(identifier(items.get(0), "parameter name"), ParameterType.SIMPLE, null, null);
    }

    /** {@code [name, "[", dim, "]", ...]} */
    public Parameter processArrayParameter(List<?> items) {
        if (items.isEmpty()) {
            throw new ValidationException("Array parameter has no name");
        }
        String name = identifier(items.get(0), "parameter name");
        List<Node> dimensions = new ArrayList<>();
        for (Object item : items.subList(1, items.size())) {
            if (tokens.isDelimiter(item, "[") || tokens.isDelimiter(item, "]")) {
                continue;
            }
            if (!(item instanceof Node dimension)) {
                throw new ValidationException("Array parameter '" + name + "' has a dimension that is not an expression: "
                    + tokens.describe(item));
            }
            dimensions.add(dimension);
        }
        if (dimensions.isEmpty()) {
            throw new ValidationException("Array parameter '" + name + "' declares no dimensions");
        }
        return new Parameter(name, ParameterType.ARRAY, dimensions, null);
    }

    /** {@code [className, name]} */
    public Parameter processObjectParameter(List<?> items) {
        expectSize(items, 2, "Object");
        String className = identifier(items.get(0), "class name");
        String name = identifier(items.get(1), "parameter name");
        return new Parameter(name, ParameterType.OBJECT, null, className);
    }

    /** {@code ["graph", name]}, or just {@code [name]} */
    public Parameter processGraphParameter(List<?> items) {
        Object nameItem;
        if (items.size() == 2) {
            if (!tokens.isDelimiter(items.get(0), "graph")) {
                throw new ValidationException("Expected 'graph' but found " + tokens.describe(items.get(0)));
            }
            nameItem = items.get(1);
        } else {
            expectSize(items, 1, "Graph");
            nameItem = items.get(0);
        }
        return new Parameter(identifier(nameItem, "parameter name"), ParameterType.GRAPH, null, null);
    }

    private String identifier(Object item, String role) {
        if (item == null || item instanceof Node) {
            throw new ValidationException("Expected a " + role + " token but found " + tokens.describe(item));
        }
        String text = tokens.extractName(item);
        if (!IDENTIFIER.matcher(text).matches()) {
            throw new ValidationException("'" + text + "' is not a valid " + role);
        }
        return text;
    }

    private void expectSize(List<?> items, int size, String kind) {
        if (items.size() != size) {
            throw new ValidationException(kind + " parameter expects " + size + " item(s) but got " + items.size());
        }
    }
}
