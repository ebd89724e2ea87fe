package com.example.routines.docgen.expression;

import java.util.Map;

/**
 * Parsed expression. Evaluation only reads from the supplied data map.
 */
interface ExpressionNode {
    Object evaluate(Map<String, Object> data) throws ExpressionException;
}
