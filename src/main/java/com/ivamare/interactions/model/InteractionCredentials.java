package com.ivamare.interactions.model;

import java.util.Objects;

/**
 * Credentials that address the follow-up webhook of one interaction.
 *
 * @param applicationId Application the interaction was sent to
 * @param interactionId Interaction id
 * @param token Interaction token, valid for follow-ups after the initial response
 */
public record InteractionCredentials(
    String applicationId,
    String interactionId,
    String token
) {
    public InteractionCredentials {
        Objects.requireNonNull(applicationId, "applicationId");
        Objects.requireNonNull(token, "token");
    }

    @Override
    public String toString() {
        // token is a secret
        return "InteractionCredentials[applicationId=" + applicationId + ", interactionId=" + interactionId + "]";
    }
}
