package com.ivamare.interactions.web;

import com.ivamare.interactions.exception.InvalidSignatureException;

/**
 * Verifies that an inbound request was signed by the platform.
 */
public interface SignatureVerifier {

    /**
     * @param signature hex signature header
     * @param timestamp timestamp header
     * @param body raw request body
     * @throws InvalidSignatureException if the signature is missing or invalid
     */
    void verify(String signature, String timestamp, String body);
}
