package com.mollang.playground.compiler.lexer;

public record Token(TokenKind kind, String text, SourcePosition start, SourcePosition end) {

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isKeyword(Keyword keyword) {
        return is(TokenKind.KEYWORD, keyword.word());
    }

    public boolean isEndOfInput() {
        return kind == TokenKind.END_OF_INPUT;
    }

    @Override
    public String toString() {
        return "<" + kind + " '" + text + "' at " + start + ">";
    }
}
