package com.mollang.playground.compiler.lexer;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    STRING,
    SYMBOL,
    END_OF_INPUT
}
