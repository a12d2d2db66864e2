package com.mollang.playground.runtime;

public record InterpreterLimits(long maxSteps, int maxCallDepth, int maxOutputLength, int maxTextLength) {

    public InterpreterLimits {
        if (maxSteps <= 0 || maxCallDepth <= 0 || maxOutputLength <= 0 || maxTextLength <= 0) {
            throw new IllegalArgumentException("Interpreter limits must be positive");
        }
    }

    public static InterpreterLimits defaults() {
        return new InterpreterLimits(1_000_000L, 1_000, 50_000, 1_000_000);
    }

    /**
     * Limits for running trusted programs from the command line: only the call depth stays bounded.
     */
    public static InterpreterLimits relaxed() {
        return new InterpreterLimits(Long.MAX_VALUE, 1_000, Integer.MAX_VALUE, Integer.MAX_VALUE);
    }
}
