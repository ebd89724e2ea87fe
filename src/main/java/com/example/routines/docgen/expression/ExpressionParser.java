package com.example.routines.docgen.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for the body of a {@code {{ ... }}} block.
 *
 * <pre>
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := filtered (OP filtered)?
 * filtered   := primary ('|' NAME ('(' args ')')?)*
 * primary    := literal | '(' or ')' | NAME ('.' NAME | '[' NUMBER|STRING ']')*
 * </pre>
 */
class ExpressionParser {
    /** Deepest allowed nesting of parentheses, {@code not} and filter arguments. */
    static final int MAX_DEPTH = 64;
    /** Longest accepted expression; also bounds the depth of left-nested chains. */
    static final int MAX_TOKENS = 512;

    private final List<Token> tokens;
    private int index;
    private int depth;

    ExpressionParser(String expression) throws ExpressionException {
        this.tokens = new ExpressionLexer(expression).tokenize();
        if (tokens.size() > MAX_TOKENS) {
            throw new ExpressionException("Expression has more than " + MAX_TOKENS + " tokens");
        }
    }

    ExpressionNode parse() throws ExpressionException {
        if (peek().is(Token.Type.EOF)) {
            throw new ExpressionException("Empty expression");
        }
        ExpressionNode node = parseOr();
        Token trailing = peek();
        if (!trailing.is(Token.Type.EOF)) {
            throw new ExpressionException("Unexpected '" + trailing.getText() + "' at " + trailing.getPosition());
        }
        return node;
    }

    private ExpressionNode parseOr() throws ExpressionException {
        enter();
        ExpressionNode left = parseAnd();
        while (peek().isKeyword("or")) {
            index++;
            left = new Nodes.Logical(false, left, parseAnd());
        }
        depth--;
        return left;
    }

    private ExpressionNode parseAnd() throws ExpressionException {
        ExpressionNode left = parseNot();
        while (peek().isKeyword("and")) {
            index++;
            left = new Nodes.Logical(true, left, parseNot());
        }
        return left;
    }

    private ExpressionNode parseNot() throws ExpressionException {
        if (peek().isKeyword("not")) {
            index++;
            enter();
            ExpressionNode operand = parseNot();
            depth--;
            return new Nodes.Not(operand);
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() throws ExpressionException {
        ExpressionNode left = parseFiltered();
        if (peek().is(Token.Type.OPERATOR)) {
            String operator = next().getText();
            return new Nodes.Comparison(operator, left, parseFiltered());
        }
        return left;
    }

    private ExpressionNode parseFiltered() throws ExpressionException {
        ExpressionNode node = parsePrimary();
        while (peek().is(Token.Type.PIPE)) {
            index++;
            String filter = expect(Token.Type.NAME).getText();
            if (!Filters.isKnown(filter)) {
                throw new ExpressionException("Filter '" + filter + "' is not allowed");
            }
            List<ExpressionNode> arguments = new ArrayList<>();
            if (peek().is(Token.Type.LPAREN)) {
                index++;
                if (!peek().is(Token.Type.RPAREN)) {
                    arguments.add(parseOr());
                    while (peek().is(Token.Type.COMMA)) {
                        index++;
                        arguments.add(parseOr());
                    }
                }
                expect(Token.Type.RPAREN);
            }
            node = new Nodes.FilterCall(filter, node, arguments);
        }
        return node;
    }

    private ExpressionNode parsePrimary() throws ExpressionException {
        Token token = next();
        switch (token.getType()) {
            case STRING:
                return new Nodes.Literal(token.getText());
            case NUMBER:
                return new Nodes.Literal(number(token.getText()));
            case LPAREN:
                ExpressionNode inner = parseOr();
                expect(Token.Type.RPAREN);
                return inner;
            case NAME:
                return parseName(token);
            default:
                throw new ExpressionException("Unexpected '" + token.getText() + "' at " + token.getPosition());
        }
    }

    private ExpressionNode parseName(Token first) throws ExpressionException {
        String lowered = first.getText().toLowerCase(Locale.ROOT);
        switch (lowered) {
            case "true":
                return new Nodes.Literal(Boolean.TRUE);
            case "false":
                return new Nodes.Literal(Boolean.FALSE);
            case "none":
            case "null":
                return new Nodes.Literal(null);
            default:
                break;
        }
        List<Object> segments = new ArrayList<>();
        segments.add(checkedName(first));
        while (true) {
            if (peek().is(Token.Type.DOT)) {
                index++;
                segments.add(checkedName(expect(Token.Type.NAME)));
            } else if (peek().is(Token.Type.LBRACKET)) {
                index++;
                Token key = next();
                if (key.is(Token.Type.NUMBER) && !key.getText().contains(".")) {
                    segments.add(subscriptIndex(key));
                } else if (key.is(Token.Type.STRING)) {
                    segments.add(checkedName(key));
                } else {
                    throw new ExpressionException("Invalid subscript at " + key.getPosition());
                }
                expect(Token.Type.RBRACKET);
            } else {
                return new Nodes.Name(segments);
            }
        }
    }

    private static Integer subscriptIndex(Token token) throws ExpressionException {
        try {
            return Integer.valueOf(token.getText());
        } catch (NumberFormatException e) {
            throw new ExpressionException("Subscript out of range at " + token.getPosition(), e);
        }
    }

    private void enter() throws ExpressionException {
        if (++depth > MAX_DEPTH) {
            throw new ExpressionException("Expression nested deeper than " + MAX_DEPTH + " levels");
        }
    }

    private static String checkedName(Token token) throws ExpressionException {
        if (token.getText().startsWith("_")) {
            throw new ExpressionException("Access to '" + token.getText() + "' is not allowed");
        }
        return token.getText();
    }

    private static Object number(String text) {
        if (text.contains(".")) {
            return new BigDecimal(text);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return new BigDecimal(text);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (!token.is(Token.Type.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(Token.Type type) throws ExpressionException {
        Token token = next();
        if (!token.is(type)) {
            throw new ExpressionException("Expected " + type + " but found '" + token.getText()
                    + "' at " + token.getPosition());
        }
        return token;
    }
}
