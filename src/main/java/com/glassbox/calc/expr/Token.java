package com.glassbox.calc.expr;

record Token(TokenType type, String text, double number, int pos) {

    static Token of(TokenType type, String text, int pos) {
        return new Token(type, text, 0.0, pos);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of formula" : "'" + text + "'";
    }
}
