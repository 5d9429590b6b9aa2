package com.ivamare.interactions.exception;

/**
 * Wraps a failure raised by a handler routine during synchronous dispatch.
 */
public class HandlerExecutionException extends InteractionsException {

    public HandlerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
