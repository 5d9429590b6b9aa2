package com.ivamare.interactions.web;

import com.ivamare.interactions.exception.InvalidSignatureException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

/**
 * Ed25519 verification of {@code timestamp + body} against the application's public key.
 */
public class Ed25519SignatureVerifier implements SignatureVerifier {

    // ASN.1 SubjectPublicKeyInfo header for a raw 32 byte Ed25519 key
    private static final String X509_PREFIX = "302a300506032b6570032100";

    private final PublicKey publicKey;

    /**
     * @param publicKeyHex hex-encoded raw 32 byte public key
     * @throws IllegalArgumentException if the key is malformed
     */
    public Ed25519SignatureVerifier(String publicKeyHex) {
        try {
            byte[] encoded = HexFormat.of().parseHex(X509_PREFIX + publicKeyHex.trim());
            this.publicKey = KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Ed25519 public key", e);
        }
    }

    @Override
    public void verify(String signature, String timestamp, String body) {
        if (signature == null || timestamp == null) {
            throw new InvalidSignatureException("Missing signature headers");
        }

        boolean valid;
        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(publicKey);
            verifier.update(timestamp.getBytes(StandardCharsets.UTF_8));
            verifier.update(body.getBytes(StandardCharsets.UTF_8));
            valid = verifier.verify(HexFormat.of().parseHex(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new InvalidSignatureException("Malformed signature: " + e.getMessage());
        }

        if (!valid) {
            throw new InvalidSignatureException("Signature does not match request body");
        }
    }
}
