package com.hkmatrix.core.parse;

final class Token {
    final TokenType type;
    final String lexeme;
    final double value;
    final int position;

    Token(TokenType type, String lexeme, double value, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.value = value;
        this.position = position;
    }
}
