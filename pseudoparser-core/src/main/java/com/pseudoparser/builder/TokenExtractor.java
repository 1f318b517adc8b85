package com.pseudoparser.builder;

import com.pseudoparser.ValidationException;
import com.pseudoparser.ast.BoolLiteral;
import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.NumberLiteral;
import com.pseudoparser.ast.Parameter;
import com.pseudoparser.ast.StringLiteral;
import com.pseudoparser.ast.Var;
import com.pseudoparser.ast.VarTarget;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.math.BigInteger;

/**
 * Reads names and literal values out of parse-tree items.
 *
 * <p>An item is whatever a production hands to a builder: an ANTLR
 * {@link Token} or {@link TerminalNode}, a raw lexeme {@link String}, or a node
 * built earlier in the pass. This is the only place where items are inspected
 * by their runtime shape.</p>
 */
public class TokenExtractor {

    /**
     * Returns the canonical name of an item.
     *
     * @throws ValidationException if the item does not carry a name
     */
    public String extractName(Object item) {
        if (item instanceof Token token) {
            return token.getText();
        }
        if (item instanceof TerminalNode terminal) {
            return terminal.getSymbol().getText();
        }
        if (item instanceof String lexeme) {
            return lexeme;
        }
        if (item instanceof Var var) {
            return var.name();
        }
        if (item instanceof VarTarget target) {
            return target.name();
        }
        if (item instanceof Parameter parameter) {
            return parameter.name();
        }
        throw new ValidationException("Expected a name but found " + describe(item));
    }

    /**
     * Returns the literal value of an item: the narrowest of {@link Integer},
     * {@link Long} and {@link java.math.BigInteger} for integers, a
     * {@link Double} for decimals, a {@link String} with escapes resolved for
     * string literals, a {@link Boolean} for {@code true}/{@code false}.
     *
     * @throws ValidationException if the item is not a literal
     */
    public Object extractValue(Object item) {
        if (item instanceof NumberLiteral number) {
            return number.value();
        }
        if (item instanceof StringLiteral string) {
            return string.value();
        }
        if (item instanceof BoolLiteral bool) {
            return bool.value();
        }
        if (item instanceof Token || item instanceof TerminalNode || item instanceof String) {
            return valueOf(extractName(item));
        }
        throw new ValidationException("Expected a literal but found " + describe(item));
    }

    /**
     * Returns the text of a comment token without its delimiters and
     * surrounding whitespace.
     *
     * @throws ValidationException if the item is not a comment
     */
    public String extractCommentText(Object item) {
        if (!(item instanceof Token || item instanceof TerminalNode || item instanceof String)) {
            throw new ValidationException("Expected a comment but found " + describe(item));
        }
        String lexeme = extractName(item);
        if (lexeme.startsWith("//")) {
            return lexeme.substring(2).strip();
        }
        if (lexeme.startsWith("/*") && lexeme.endsWith("*/") && lexeme.length() >= 4) {
            return lexeme.substring(2, lexeme.length() - 2).strip();
        }
        throw new ValidationException("Expected a comment but found " + describe(item));
    }

    /**
     * @return true if the item is a token (or lexeme) whose text is exactly {@code text}
     */
    public boolean isDelimiter(Object item, String text) {
        if (item instanceof Token || item instanceof TerminalNode || item instanceof String) {
            return text.equals(extractName(item));
        }
        return false;
    }

    /**
     * Short human readable description of an item, for error messages.
     */
    public String describe(Object item) {
        if (item == null) {
            return "nothing";
        }
        if (item instanceof Node node) {
            return node.type() + " node";
        }
        if (item instanceof Token || item instanceof TerminalNode || item instanceof String) {
            return "'" + extractName(item) + "'";
        }
        return item.getClass().getSimpleName();
    }

    private Object valueOf(String lexeme) {
        if ("true".equals(lexeme)) {
            return Boolean.TRUE;
        }
        if ("false".equals(lexeme)) {
            return Boolean.FALSE;
        }
        if (lexeme.length() >= 2 && lexeme.startsWith("\"") && lexeme.endsWith("\"")) {
            return unescape(lexeme.substring(1, lexeme.length() - 1));
        }
        if (!lexeme.isEmpty() && Character.isDigit(lexeme.charAt(0))) {
            return parseNumber(lexeme);
        }
        throw new ValidationException("Cannot extract a literal value from '" + lexeme + "'");
    }

    private Number parseNumber(String lexeme) {
        try {
            if (lexeme.indexOf('.') >= 0 || lexeme.indexOf('e') >= 0 || lexeme.indexOf('E') >= 0) {
                return Double.valueOf(lexeme);
            }
            BigInteger value = new BigInteger(lexeme);
            if (value.bitLength() < Integer.SIZE) {
                return Integer.valueOf(value.intValue());
            }
            if (value.bitLength() < Long.SIZE) {
                return Long.valueOf(value.longValue());
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Malformed number literal '" + lexeme + "'", e);
        }
    }

    private String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= body.length()) {
                throw new ValidationException("Dangling escape at end of string \"" + body + "\"");
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                case '\\' -> sb.append('\\');
                case 'u' -> {
                    if (i + 4 >= body.length()) {
                        throw new ValidationException("Truncated unicode escape in string \"" + body + "\"");
                    }
                    String hex = body.substring(i + 1, i + 5);
                    try {
                        sb.append((char) Integer.parseInt(hex, 16));
                    } catch (NumberFormatException e) {
                        throw new ValidationException("Invalid unicode escape \\u" + hex, e);
                    }
                    i += 4;
                }
                default -> throw new ValidationException("Unknown escape \\" + escaped + " in string \"" + body + "\"");
            }
        }
        return sb.toString();
    }
}
