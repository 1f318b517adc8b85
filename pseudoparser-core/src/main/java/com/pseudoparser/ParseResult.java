package com.pseudoparser;

import com.pseudoparser.grammar.PseudoParser;
import org.antlr.v4.runtime.BufferedTokenStream;

import java.util.Objects;

/**
 * Parse tree of one source text and the token stream it was read from.
 * Comments are only reachable through the stream's hidden channel.
 *
 * @param tree root of the parse tree
 * @param tokens the token stream, or {@code null} when comments are not available
 */
public record ParseResult(PseudoParser.ProgramContext tree, BufferedTokenStream tokens) {

    public ParseResult {
        Objects.requireNonNull(tree, "tree");
    }

    public ParseResult(PseudoParser.ProgramContext tree) {
        this(tree, null);
    }
}
