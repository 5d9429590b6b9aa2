package com.ivamare.interactions.exception;

import com.ivamare.interactions.model.HandlerKind;

/**
 * Thrown when no handler, generic fallback or catch-all matches an interaction.
 */
public class HandlerNotFoundException extends InteractionsException {

    private final HandlerKind kind;
    private final String matchKey;

    public HandlerNotFoundException(HandlerKind kind, String matchKey) {
        super("No handler registered for " + kind + "." + matchKey);
        this.kind = kind;
        this.matchKey = matchKey;
    }

    public HandlerKind getKind() {
        return kind;
    }

    public String getMatchKey() {
        return matchKey;
    }
}
