package com.mollang.playground.compiler.parser;

import com.mollang.playground.compiler.lexer.Token;

/**
 * Raised when the token sequence is not a Mollang program. Parsing stops at the first error.
 */
public class ParseException extends Exception {

    public enum Reason {
        UNEXPECTED_END_OF_INPUT,
        INVALID_STATEMENT_START,
        INVALID_EXPRESSION_TERM,
        UNKNOWN_OPERATOR,
        MISSING_ASSIGN_MARKER,
        MISSING_BLOCK,
        NESTED_FUNCTION_DEFINITION,
        DUPLICATE_FUNCTION_DEFINITION,
        RETURN_OUTSIDE_FUNCTION
    }

    private final Reason reason;
    private final Token token;

    public ParseException(Reason reason, Token token, String message) {
        super(message + " at " + token.start());
        this.reason = reason;
        this.token = token;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the token the parser stopped at
     */
    public Token getToken() {
        return token;
    }
}
