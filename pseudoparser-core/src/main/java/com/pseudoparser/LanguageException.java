package com.pseudoparser;

/**
 * Root of the errors raised while turning source text into an AST.
 */
public class LanguageException extends RuntimeException {

    public LanguageException(String message) {
        super(message);
    }

    public LanguageException(String message, Throwable cause) {
        super(message, cause);
    }
}
