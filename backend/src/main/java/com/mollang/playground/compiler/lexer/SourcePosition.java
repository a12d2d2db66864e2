package com.mollang.playground.compiler.lexer;

/**
 * A location in the source text. Lines and columns are 1-based and columns count UTF-16 units,
 * the offset is the 0-based character index.
 */
public record SourcePosition(int line, int column, int offset) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
