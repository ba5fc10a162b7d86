package com.glassbox.calc.expr;

import java.util.ArrayList;
import java.util.List;

import com.glassbox.calc.namespace.Ref;

/**
 * Splits a formula into tokens.
 * <p>
 * Identifiers are runs of letters, digits, {@code _} and {@code .}. An
 * identifier followed by {@code (} is a function name; any other identifier
 * must be a well-formed reference.
 */
final class Lexer {
    private final String src;
    private int pos;

    Lexer(String src) {
        this.src = src;
    }

    List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                out.add(Token.of(TokenType.EOF, "", pos));
                return out;
            }
            char c = src.charAt(pos);
            int start = pos;
            if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                out.add(number());
            } else if (Character.isLetter(c) || c == '_') {
                out.add(identifier());
            } else {
                pos++;
                TokenType t = switch (c) {
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case ',' -> TokenType.COMMA;
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    case '^' -> TokenType.CARET;
                    case '<' -> {
                        if (match('='))
                            yield TokenType.LE;
                        yield match('>') ? TokenType.NE : TokenType.LT;
                    }
                    case '>' -> match('=') ? TokenType.GE : TokenType.GT;
                    case '=' -> {
                        match('=');
                        yield TokenType.EQ;
                    }
                    case '!' -> {
                        if (match('='))
                            yield TokenType.NE;
                        throw new FormulaSyntaxException("Unexpected character '!'", start);
                    }
                    default -> throw new FormulaSyntaxException("Unexpected character '" + c + "'", start);
                };
                out.add(Token.of(t, src.substring(start, pos), start));
            }
        }
    }

    private Token number() {
        int start = pos;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.'))
            pos++;
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-'))
                pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                    pos++;
            } else {
                pos = save;
            }
        }
        String text = src.substring(start, pos);
        try {
            return new Token(TokenType.NUMBER, text, Double.parseDouble(text), start);
        } catch (NumberFormatException e) {
            throw new FormulaSyntaxException("Malformed number '" + text + "'", start);
        }
    }

    private Token identifier() {
        int start = pos;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.')
                pos++;
            else
                break;
        }
        String text = src.substring(start, pos);
        int look = pos;
        while (look < src.length() && Character.isWhitespace(src.charAt(look)))
            look++;
        if (look < src.length() && src.charAt(look) == '(')
            return Token.of(TokenType.FUNCTION, text, start);
        if (!Ref.isReference(text))
            throw new FormulaSyntaxException("Unrecognised identifier '" + text + "'", start);
        return Token.of(TokenType.REF, text, start);
    }

    private boolean match(char expected) {
        if (pos < src.length() && src.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos)))
            pos++;
    }
}
