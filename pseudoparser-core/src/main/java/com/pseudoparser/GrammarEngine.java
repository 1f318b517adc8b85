package com.pseudoparser;

/**
 * Turns source text into a concrete parse tree.
 */
public interface GrammarEngine {

    /**
     * @param code source text
     * @param sourceName file name used in error positions, or {@code null}
     * @return the parse tree with its token stream
     * @throws ParsingException on the first lexical or syntax error
     */
    ParseResult parse(String code, String sourceName);
}
