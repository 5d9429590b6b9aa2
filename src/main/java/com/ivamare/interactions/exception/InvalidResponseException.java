package com.ivamare.interactions.exception;

/**
 * Thrown when a handler's return value cannot be turned into a valid response,
 * for example when it exceeds a message limit.
 */
public class InvalidResponseException extends InteractionsException {

    public InvalidResponseException(String message) {
        super(message);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
