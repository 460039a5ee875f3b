package com.oracle.lats.core;

/**
 * Raised by adapters when an external call (model or sandbox) fails.
 */
public class LatsExecutionException extends RuntimeException {

    public LatsExecutionException(String message) {
        super(message);
    }

    public LatsExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
