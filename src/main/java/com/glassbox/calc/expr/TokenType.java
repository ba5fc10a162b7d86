package com.glassbox.calc.expr;

enum TokenType {
    NUMBER, REF, FUNCTION,
    LPAREN, RPAREN, COMMA,
    PLUS, MINUS, STAR, SLASH, CARET,
    LT, LE, GT, GE, EQ, NE,
    EOF
}
