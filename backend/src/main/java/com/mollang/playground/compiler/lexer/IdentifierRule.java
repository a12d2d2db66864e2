package com.mollang.playground.compiler.lexer;

/**
 * Decides whether a word names a variable: either the shorthand {@code 밥}, or {@code 바}
 * followed by any number of {@code 아} and closed by {@code 압}.
 */
public final class IdentifierRule {

    public static final String SHORTHAND = "밥";

    public static final int PREFIX = '바';
    public static final int FILLER = '아';
    public static final int SUFFIX = '압';

    private IdentifierRule() {
    }

    public static boolean isVariableName(String word) {
        if (word == null) {
            return false;
        }
        if (word.equals(SHORTHAND)) {
            return true;
        }

        int[] codePoints = word.codePoints().toArray();
        if (codePoints.length < 2
                || codePoints[0] != PREFIX
                || codePoints[codePoints.length - 1] != SUFFIX) {
            return false;
        }
        for (int i = 1; i < codePoints.length - 1; i++) {
            if (codePoints[i] != FILLER) {
                return false;
            }
        }
        return true;
    }

    public static boolean isFunctionName(String word) {
        return word != null && word.startsWith(Keyword.FUNCTION.word());
    }
}
