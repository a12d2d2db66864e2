package com.mollang.playground.runtime;

/**
 * A failure while running a Mollang program. The program stops at the first one.
 */
public class MolRuntimeException extends RuntimeException {

    public enum Kind {
        UNSUPPORTED_OPERANDS,
        NON_BOOLEAN_CONDITION,
        UNDEFINED_FUNCTION,
        STEP_LIMIT_EXCEEDED,
        CALL_DEPTH_EXCEEDED,
        OUTPUT_LIMIT_EXCEEDED,
        TEXT_LIMIT_EXCEEDED
    }

    private final Kind kind;

    public MolRuntimeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
