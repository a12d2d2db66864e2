package com.mollang.playground.dto;


public record SyntaxToken(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String tokenType,
    String value,
    String semanticInfo
) {
    public enum TokenType {
        KEYWORD,
        OPERATOR,
        BUILT_IN_FUNCTION,
        BUILT_IN_CONSTANT,
        USER_VARIABLE,
        USER_FUNCTION,
        IDENTIFIER,
        STRING_LITERAL,
        NUMBER_LITERAL,
        PUNCTUATION
    }
}
