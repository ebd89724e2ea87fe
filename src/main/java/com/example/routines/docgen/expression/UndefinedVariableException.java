package com.example.routines.docgen.expression;

/**
 * A name or subscript that does not exist in the data context.
 * The {@code default} filter recovers from it.
 */
public class UndefinedVariableException extends ExpressionException {

    public UndefinedVariableException(String path) {
        super("'" + path + "' is undefined");
    }
}
