package com.hkmatrix.core.parse;

import java.util.ArrayList;
import java.util.List;

/** Tokenizer for the bracketed literal syntax, e.g. {@code [[1, 2], [3, -4.5e1]]}. */
class MatrixLexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    MatrixLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", 0.0, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            // ';' is a row separator, structurally the same as ','
            case ',': case ';': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '.':
                if (isDigit(peek())) number();
                else throw error("Unexpected '.'");
                break;
            default:
                if (isDigit(c)) number();
                else throw error("Unexpected character: " + c);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                current = mark;
                throw error("Malformed exponent");
            }
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) throw error("Number out of range: " + text);
        tokens.add(new Token(TokenType.NUMBER, text, value, start));
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), 0.0, start));
    }

    private ParseError error(String msg) {
        return new ParseError("[col " + (start + 1) + "] " + msg);
    }
}
