package com.ivamare.interactions.exception;

/**
 * Thrown when an inbound request fails signature verification.
 */
public class InvalidSignatureException extends InteractionsException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
