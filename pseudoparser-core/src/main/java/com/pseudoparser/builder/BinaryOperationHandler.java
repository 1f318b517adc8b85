package com.pseudoparser.builder;

import com.pseudoparser.ParsingException;
import com.pseudoparser.ValidationException;
import com.pseudoparser.ast.BinOp;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.ShortCircuitBinOp;

import java.util.List;
import java.util.Set;

/**
 * Builds binary operator nodes and folds operand chains such as
 * {@code a + b - c} left-associatively.
 */
public class BinaryOperationHandler {

    static final Set<String> SHORT_CIRCUIT_OPERATORS = Set.of("and", "or");

    private final TokenExtractor tokens;
    private final boolean dedicatedShortCircuitNodes;

    public BinaryOperationHandler(TokenExtractor tokens) {
        this(tokens, true);
    }

    /**
     * @param dedicatedShortCircuitNodes when false, {@code and}/{@code or} give a
     *     {@link BinOp} with its short-circuit flag set instead of a
     *     {@link ShortCircuitBinOp}
     */
    public BinaryOperationHandler(TokenExtractor tokens, boolean dedicatedShortCircuitNodes) {
        this.tokens = tokens;
        this.dedicatedShortCircuitNodes = dedicatedShortCircuitNodes;
    }

    public Node createBinaryOperation(String operator, Node left, Node right) {
        if (operator == null) {
            throw new ParsingException("Binary operation without an operator");
        }
        if (left == null || right == null) {
            throw new ParsingException("Operator '" + operator + "' is missing its "
                + (left == null ? "left" : "right") + " operand");
        }
        if (SHORT_CIRCUIT_OPERATORS.contains(operator)) {
            if (dedicatedShortCircuitNodes) {
                return new ShortCircuitBinOp(operator, left, right);
            }
            return new BinOp(operator, left, right, true);
        }
        return new BinOp(operator, left, right);
    }

    /**
     * Folds {@code [operand, op, operand, op, operand...]} into a left-leaning
     * tree. A single operand comes back unchanged.
     */
    public Node processChain(List<?> items) {
        if (items.isEmpty()) {
            throw new ParsingException("Empty operand chain");
        }
        if (items.size() % 2 == 0) {
            throw new ParsingException("Operator " + tokens.describe(items.get(items.size() - 1))
                + " is missing its right operand");
        }
        Node result = operand(items.get(0));
        for (int i = 1; i < items.size(); i += 2) {
            String operator = tokens.extractName(items.get(i));
            result = createBinaryOperation(operator, result, operand(items.get(i + 1)));
        }
        return result;
    }

    private Node operand(Object item) {
        if (item == null) {
            throw new ParsingException("Missing operand in binary operation");
        }
        if (item instanceof Node node) {
            return node;
        }
        throw new ValidationException("Expected an operand but found " + tokens.describe(item));
    }
}
