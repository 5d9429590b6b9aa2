package com.ivamare.interactions.followup;

import com.ivamare.interactions.model.InteractionCredentials;

import java.util.Map;

/**
 * Client for the interaction follow-up webhook.
 *
 * <p>Calls are made from background continuations. Failures surface as
 * {@link com.ivamare.interactions.exception.FollowupDeliveryException}; this client
 * does not retry.
 */
public interface FollowupClient {

    /**
     * Replace the original response of an interaction (used after a deferral).
     *
     * @param credentials interaction credentials
     * @param payload message payload ({@code data} of a response envelope)
     */
    void editOriginalResponse(InteractionCredentials credentials, Map<String, Object> payload);

    /**
     * Post a new follow-up message.
     *
     * @param credentials interaction credentials
     * @param payload message payload
     * @return the created message as returned by the platform (may be empty)
     */
    Map<String, Object> sendFollowupMessage(InteractionCredentials credentials, Map<String, Object> payload);

    /**
     * Delete the original response.
     *
     * @param credentials interaction credentials
     */
    void deleteOriginalResponse(InteractionCredentials credentials);

    /**
     * Edit a follow-up message created earlier.
     *
     * @param credentials interaction credentials
     * @param messageId id of the follow-up message
     * @param payload message payload
     */
    void editFollowupMessage(InteractionCredentials credentials, String messageId, Map<String, Object> payload);
}
