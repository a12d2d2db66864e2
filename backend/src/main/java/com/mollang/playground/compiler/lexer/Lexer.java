package com.mollang.playground.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Splits Mollang source text into tokens. Lexing never fails: every input produces a token list
 * ending with a single {@link TokenKind#END_OF_INPUT} token.
 */
public class Lexer {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?[0-9]+");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int current = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            char c = peek();
            if (isWhitespace(c)) {
                advance();
            } else if (isBracket(c)) {
                SourcePosition start = position();
                advance();
                tokens.add(new Token(TokenKind.SYMBOL, String.valueOf(c), start, position()));
            } else if (isQuote(c)) {
                quoted(c);
            } else {
                word();
            }
        }
        SourcePosition end = position();
        tokens.add(new Token(TokenKind.END_OF_INPUT, "", end, end));
        return tokens;
    }

    /**
     * Parses a base-10 {@code int} literal: an optional sign followed by ASCII digits, within
     * 32-bit range.
     */
    public static OptionalInt parseInteger(String text) {
        if (text == null || !INTEGER_PATTERN.matcher(text).matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public static TokenKind classify(String word) {
        if (Keyword.isKeyword(word)) {
            return TokenKind.KEYWORD;
        }
        if (IdentifierRule.isVariableName(word)) {
            return TokenKind.IDENTIFIER;
        }
        if (parseInteger(word).isPresent()) {
            return TokenKind.NUMBER;
        }
        // function names such as 캠프1 land here
        return TokenKind.IDENTIFIER;
    }

    private void quoted(char quote) {
        SourcePosition start = position();
        advance();
        int contentStart = current;
        while (!isAtEnd() && peek() != quote) {
            advance();
        }
        String content = source.substring(contentStart, current);
        if (!isAtEnd()) {
            advance();
        }
        tokens.add(new Token(TokenKind.STRING, content, start, position()));
    }

    private void word() {
        SourcePosition start = position();
        int wordStart = current;
        while (!isAtEnd() && !isWhitespace(peek()) && !isBracket(peek())) {
            advance();
        }
        String word = source.substring(wordStart, current);
        if (word.isEmpty()) {
            return;
        }
        SourcePosition end = position();

        // 밥은 is written as one word: variable name plus assign marker
        String marker = Keyword.ASSIGN.word();
        if (!Keyword.isKeyword(word) && !IdentifierRule.isVariableName(word) && word.endsWith(marker)) {
            String name = word.substring(0, word.length() - marker.length());
            if (IdentifierRule.isVariableName(name)) {
                SourcePosition split = new SourcePosition(
                        start.line(), start.column() + name.length(), start.offset() + name.length());
                tokens.add(new Token(TokenKind.IDENTIFIER, name, start, split));
                tokens.add(new Token(TokenKind.KEYWORD, marker, split, end));
                return;
            }
        }
        tokens.add(new Token(classify(word), word, start, end));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return source.charAt(current);
    }

    private void advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private SourcePosition position() {
        return new SourcePosition(line, column, current);
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r';
    }

    static boolean isBracket(char c) {
        return c == '[' || c == ']';
    }

    static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
