package com.ivamare.interactions.exception;

/**
 * Base exception for all interaction dispatch errors.
 */
public class InteractionsException extends RuntimeException {

    public InteractionsException(String message) {
        super(message);
    }

    public InteractionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
