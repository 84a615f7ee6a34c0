package com.hkmatrix.core.parse;

enum TokenType {
    LEFT_BRACKET, RIGHT_BRACKET,
    LEFT_PAREN, RIGHT_PAREN,
    COMMA, PLUS, MINUS,
    NUMBER,
    EOF
}
