package com.ivamare.interactions.exception;

/**
 * Thrown when a second initial response is committed for the same interaction.
 *
 * <p>This is a handler bug and is never swallowed by the dispatcher.
 */
public class AlreadyRespondedException extends InteractionsException {

    private final String interactionId;

    public AlreadyRespondedException(String interactionId) {
        super("Interaction " + interactionId + " has already been responded to");
        this.interactionId = interactionId;
    }

    public String getInteractionId() {
        return interactionId;
    }
}
