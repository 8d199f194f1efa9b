package com.di.ladder.exception;

/**
 * Base type of failures raised by the ladder engine.
 */
public class LadderException extends RuntimeException {

    public LadderException(String message) {
        super(message);
    }

    public LadderException(String message, Throwable cause) {
        super(message, cause);
    }
}
