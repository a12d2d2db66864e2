package com.mollang.playground.exception;

/**
 * A compiled program could not be started or its output could not be collected.
 */
public class ExecutionException extends Exception {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
