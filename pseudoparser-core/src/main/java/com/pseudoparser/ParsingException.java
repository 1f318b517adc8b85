package com.pseudoparser;

import com.pseudoparser.ast.SourcePosition;

import java.util.Optional;

/**
 * Lexical or syntax error, builder failure on a malformed parse tree, or a
 * failure to read a source file.
 */
public class ParsingException extends LanguageException {

    private final String filePath;  // Can be null
    private final SourcePosition position;  // Can be null

    public ParsingException(String message) {
        this(message, null, null, null);
    }

    public ParsingException(String message, Throwable cause) {
        this(message, cause, null, null);
    }

    public ParsingException(String message, Throwable cause, String filePath) {
        this(message, cause, filePath, null);
    }

    public ParsingException(String message, Throwable cause, String filePath, SourcePosition position) {
        super(message, cause);
        this.filePath = filePath;
        this.position = position;
    }

    /**
     * Adds context to a failure, unless it already is a {@code ParsingException},
     * in which case it is returned as is so messages never nest.
     *
     * @param failure what went wrong
     * @param context prefix describing what was being parsed
     * @param filePath source file, or {@code null} for in-memory text
     */
    public static ParsingException wrap(Throwable failure, String context, String filePath) {
        if (failure instanceof ParsingException pe) {
            return pe;
        }
        return new ParsingException(context + ": " + failure.getMessage(), failure, filePath);
    }

    public Optional<String> getFilePath() {
        return Optional.ofNullable(filePath);
    }

    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }
}
