package com.mollang.playground.exception;

/**
 * The native toolchain could not be run or did not finish in time.
 */
public class CompilationException extends Exception {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
