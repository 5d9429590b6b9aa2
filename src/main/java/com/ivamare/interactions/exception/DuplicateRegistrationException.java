package com.ivamare.interactions.exception;

import com.ivamare.interactions.model.HandlerKind;

/**
 * Thrown when a handler is registered for a key that already has one.
 */
public class DuplicateRegistrationException extends InteractionsException {

    private final HandlerKind kind;
    private final String matchKey;

    public DuplicateRegistrationException(HandlerKind kind, String matchKey) {
        super("Handler already registered for " + kind + "." + (matchKey != null ? matchKey : "<generic>"));
        this.kind = kind;
        this.matchKey = matchKey;
    }

    public HandlerKind getKind() {
        return kind;
    }

    /**
     * @return the name or custom-id template, or null for generic and catch-all handlers
     */
    public String getMatchKey() {
        return matchKey;
    }
}
