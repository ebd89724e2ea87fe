package com.example.routines.docgen.expression;

/**
 * Compile or evaluation failure of a template expression. Never leaves the
 * resolver: the caller gets the unresolved source text instead.
 */
public class ExpressionException extends Exception {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
