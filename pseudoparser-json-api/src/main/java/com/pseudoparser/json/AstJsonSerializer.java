package com.pseudoparser.json;

import com.pseudoparser.ast.Node;

/**
 * Writes AST nodes as JSON. Every node becomes an object with a {@code type}
 * discriminator, its fields, and a {@code loc} object when its position is
 * known.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} with indentation.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
