package com.pseudoparser;

/**
 * A parse-tree item that is valid for the grammar but has the wrong shape for
 * the AST being built, e.g. a built expression where a class name was expected.
 */
public class ValidationException extends LanguageException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
