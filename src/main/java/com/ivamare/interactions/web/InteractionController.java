package com.ivamare.interactions.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.interactions.dispatch.DispatchOutcome;
import com.ivamare.interactions.dispatch.InteractionDispatcher;
import com.ivamare.interactions.exception.AlreadyRespondedException;
import com.ivamare.interactions.exception.InteractionsException;
import com.ivamare.interactions.exception.InvalidResponseException;
import com.ivamare.interactions.exception.InvalidSignatureException;
import com.ivamare.interactions.model.InteractionContext;
import com.ivamare.interactions.model.ResponseEnvelope;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP endpoint receiving signed interaction webhooks.
 *
 * <ul>
 *   <li>PING is answered with a pong</li>
 *   <li>unknown interactions get {@code 404 {"error":"command not found"}}</li>
 *   <li>anything else is dispatched and the outcome's wire response is returned</li>
 * </ul>
 * Background work of the outcome is started by {@link InteractionDeliveryInterceptor}
 * after the response has been written.
 */
@RestController
public class InteractionController {

    private static final Logger log = LoggerFactory.getLogger(InteractionController.class);

    public static final String SIGNATURE_HEADER = "X-Signature-Ed25519";
    public static final String TIMESTAMP_HEADER = "X-Signature-Timestamp";

    private final SignatureVerifier signatureVerifier;
    private final InteractionDecoder decoder;
    private final InteractionDispatcher dispatcher;

    public InteractionController(
            SignatureVerifier signatureVerifier,
            InteractionDecoder decoder,
            InteractionDispatcher dispatcher) {
        this.signatureVerifier = signatureVerifier;
        this.decoder = decoder;
        this.dispatcher = dispatcher;
    }

    @PostMapping(path = "${interactions.path:/interactions}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> interact(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = TIMESTAMP_HEADER, required = false) String timestamp,
            @RequestBody String body,
            HttpServletRequest request) {

        signatureVerifier.verify(signature, timestamp, body);

        JsonNode payload = decoder.parse(body);
        if (decoder.isPing(payload)) {
            return ResponseEntity.ok(ResponseEnvelope.pong().toWire());
        }

        InteractionContext context = decoder.decode(payload);
        DispatchOutcome outcome = dispatcher.dispatch(context);
        if (!outcome.isFound()) {
            return error(HttpStatus.NOT_FOUND, "command not found");
        }

        request.setAttribute(InteractionDeliveryInterceptor.OUTCOME_ATTRIBUTE, outcome);
        return ResponseEntity.ok(outcome.toWire());
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Rejected interaction request: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "invalid request signature");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedPayload(IllegalArgumentException e) {
        log.warn("Malformed interaction payload: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid payload");
    }

    @ExceptionHandler(InvalidResponseException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidResponse(InvalidResponseException e) {
        log.error("Handler returned an invalid response", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "invalid response type");
    }

    @ExceptionHandler(AlreadyRespondedException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyResponded(AlreadyRespondedException e) {
        log.error("Handler responded more than once", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "interaction already responded");
    }

    @ExceptionHandler(InteractionsException.class)
    public ResponseEntity<Map<String, Object>> handleHandlerFailure(InteractionsException e) {
        log.error("Interaction handler failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
