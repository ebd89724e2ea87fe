package com.example.routines.docgen.expression;

import lombok.Value;

@Value
class Token {
    enum Type {
        NAME, STRING, NUMBER, DOT, LBRACKET, RBRACKET, LPAREN, RPAREN, PIPE, COMMA, OPERATOR, EOF
    }

    Type type;
    String text;
    int position;

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isKeyword(String keyword) {
        return type == Type.NAME && text.equals(keyword);
    }
}
