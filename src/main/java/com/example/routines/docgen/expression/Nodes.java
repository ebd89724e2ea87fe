package com.example.routines.docgen.expression;

import com.example.routines.docgen.util.Values;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The node kinds of the expression grammar.
 */
final class Nodes {

    private Nodes() {
    }

    static final class Literal implements ExpressionNode {
        private final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        public Object evaluate(Map<String, Object> data) {
            return value;
        }
    }

    static final class Name implements ExpressionNode {
        private final DataPathReader reader;

        Name(List<Object> segments) {
            this.reader = new DataPathReader(segments);
        }

        @Override
        public Object evaluate(Map<String, Object> data) throws ExpressionException {
            return reader.read(data);
        }
    }

    static final class Not implements ExpressionNode {
        private final ExpressionNode operand;

        Not(ExpressionNode operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(Map<String, Object> data) throws ExpressionException {
            return !Values.isTruthy(operand.evaluate(data));
        }
    }

    /** {@code and}/{@code or}, returning the operand that decided the result. */
    static final class Logical implements ExpressionNode {
        private final boolean isAnd;
        private final ExpressionNode left;
        private final ExpressionNode right;

        Logical(boolean isAnd, ExpressionNode left, ExpressionNode right) {
            this.isAnd = isAnd;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Map<String, Object> data) throws ExpressionException {
            Object l = left.evaluate(data);
            if (isAnd != Values.isTruthy(l)) {
                return l;
            }
            return right.evaluate(data);
        }
    }

    static final class Comparison implements ExpressionNode {
        private final String operator;
        private final ExpressionNode left;
        private final ExpressionNode right;

        Comparison(String operator, ExpressionNode left, ExpressionNode right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Map<String, Object> data) throws ExpressionException {
            Object l = left.evaluate(data);
            Object r = right.evaluate(data);
            switch (operator) {
                case "==":
                    return isEqual(l, r);
                case "!=":
                    return !isEqual(l, r);
                case "<":
                    return compare(l, r) < 0;
                case "<=":
                    return compare(l, r) <= 0;
                case ">":
                    return compare(l, r) > 0;
                case ">=":
                    return compare(l, r) >= 0;
                default:
                    throw new ExpressionException("Unknown operator " + operator);
            }
        }

        private static boolean isEqual(Object l, Object r) {
            if (l instanceof Number && r instanceof Number) {
                return toDecimal(l).compareTo(toDecimal(r)) == 0;
            }
            return Objects.equals(l, r);
        }

        private int compare(Object l, Object r) throws ExpressionException {
            if (l instanceof Number && r instanceof Number) {
                return toDecimal(l).compareTo(toDecimal(r));
            }
            if (l instanceof String && r instanceof String) {
                return ((String) l).compareTo((String) r);
            }
            throw new ExpressionException("Cannot compare " + typeName(l) + " " + operator + " " + typeName(r));
        }

        private static BigDecimal toDecimal(Object number) {
            return new BigDecimal(number.toString());
        }

        private static String typeName(Object value) {
            return value == null ? "none" : value.getClass().getSimpleName();
        }
    }

    static final class FilterCall implements ExpressionNode {
        private final String filter;
        private final ExpressionNode operand;
        private final List<ExpressionNode> arguments;

        FilterCall(String filter, ExpressionNode operand, List<ExpressionNode> arguments) {
            this.filter = filter;
            this.operand = operand;
            this.arguments = arguments;
        }

        @Override
        public Object evaluate(Map<String, Object> data) throws ExpressionException {
            if (Filters.DEFAULT.equals(filter)) {
                Object fallback = arguments.isEmpty() ? "" : arguments.get(0).evaluate(data);
                try {
                    Object value = operand.evaluate(data);
                    return value == null ? fallback : value;
                } catch (UndefinedVariableException e) {
                    return fallback;
                }
            }
            return Filters.apply(filter, operand.evaluate(data));
        }
    }
}
