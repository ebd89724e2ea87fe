package com.example.routines.docgen.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the inside of a {@code {{ ... }}} block into tokens.
 */
class ExpressionLexer {
    private final String input;
    private int pos;

    ExpressionLexer(String input) {
        this.input = input;
    }

    List<Token> tokenize() throws ExpressionException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos));
                return tokens;
            }
            char c = input.charAt(pos);
            int start = pos;
            if (Character.isLetter(c) || c == '_') {
                while (pos < input.length()
                        && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                    pos++;
                }
                tokens.add(new Token(Token.Type.NAME, input.substring(start, pos), start));
            } else if (Character.isDigit(c)) {
                tokens.add(new Token(Token.Type.NUMBER, readNumber(), start));
            } else if (c == '\'' || c == '"') {
                tokens.add(new Token(Token.Type.STRING, readString(c), start));
            } else if (c == '=' || c == '!' || c == '<' || c == '>') {
                tokens.add(new Token(Token.Type.OPERATOR, readOperator(), start));
            } else {
                tokens.add(new Token(punctuation(c), String.valueOf(c), start));
                pos++;
            }
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private String readNumber() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < input.length() && input.charAt(pos) == '.' && Character.isDigit(input.charAt(pos + 1))) {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        return input.substring(start, pos);
    }

    private String readString(char quote) throws ExpressionException {
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\\' && pos < input.length()) {
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    default:
                        sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        throw new ExpressionException("Unterminated string literal");
    }

    private String readOperator() throws ExpressionException {
        char c = input.charAt(pos);
        boolean followedByEquals = pos + 1 < input.length() && input.charAt(pos + 1) == '=';
        if (followedByEquals) {
            pos += 2;
            return c + "=";
        }
        if (c == '<' || c == '>') {
            pos++;
            return String.valueOf(c);
        }
        throw new ExpressionException("Unexpected '" + c + "' at " + pos);
    }

    private Token.Type punctuation(char c) throws ExpressionException {
        switch (c) {
            case '.':
                return Token.Type.DOT;
            case '[':
                return Token.Type.LBRACKET;
            case ']':
                return Token.Type.RBRACKET;
            case '(':
                return Token.Type.LPAREN;
            case ')':
                return Token.Type.RPAREN;
            case '|':
                return Token.Type.PIPE;
            case ',':
                return Token.Type.COMMA;
            default:
                throw new ExpressionException("Unexpected '" + c + "' at " + pos);
        }
    }
}
