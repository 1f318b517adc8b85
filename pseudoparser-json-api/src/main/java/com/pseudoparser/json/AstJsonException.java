package com.pseudoparser.json;

import java.util.Optional;

/**
 * Thrown when an AST cannot be written as JSON, or JSON cannot be read back
 * into an AST.
 */
public class AstJsonException extends RuntimeException {

    private final String jsonPath;  // Can be null

    public AstJsonException(String message) {
        this(message, (String) null);
    }

    /**
     * @param jsonPath JSON pointer of the offending value, e.g. {@code /statements/0/body}
     */
    public AstJsonException(String message, String jsonPath) {
        super(jsonPath == null ? message : message + " at " + (jsonPath.isEmpty() ? "/" : jsonPath));
        this.jsonPath = jsonPath;
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
        this.jsonPath = null;
    }

    public Optional<String> getJsonPath() {
        return Optional.ofNullable(jsonPath);
    }
}
