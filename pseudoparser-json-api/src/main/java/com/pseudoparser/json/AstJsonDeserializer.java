package com.pseudoparser.json;

import com.pseudoparser.ast.Node;
import com.pseudoparser.ast.Program;

/**
 * Rebuilds AST nodes from JSON written by an {@link AstJsonSerializer}.
 * Positions are restored; analysis hints are not part of the JSON form.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if the JSON is not a valid program
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads a node of whatever kind the {@code type} field names.
     *
     * @throws AstJsonException if the JSON is not a valid node
     */
    Node deserializeNode(String json) throws AstJsonException;

    /**
     * Reads a node that must be of the given kind.
     *
     * @param json the JSON text
     * @param type the expected node class
     * @param <T> the node type
     * @return the node
     * @throws AstJsonException if the JSON is invalid or describes another kind
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
