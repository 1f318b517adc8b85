package com.pseudoparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMapper instances that can write and read AST nodes.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PseudoJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class PseudoJackson {

    private PseudoJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper with the {@link AstModule} registered.
     *
     * Null values are kept: absent optional fields appear as {@code null} so
     * every node of a kind has the same set of keys.
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
