package com.ivamare.interactions.model;

/**
 * Closed set of handler kinds, decided once when an interaction is decoded.
 */
public enum HandlerKind {
    COMMAND,
    COMPONENT,
    AUTOCOMPLETE,
    MODAL_SUBMIT,
    CATCH_ALL;

    /**
     * Whether interactions of this kind are raced against the auto-defer timer.
     *
     * @return true for commands and component interactions
     */
    public boolean supportsAutoDefer() {
        return this == COMMAND || this == COMPONENT;
    }

    /**
     * Whether interactions of this kind are matched against custom-id templates.
     *
     * @return true for component and modal-submit interactions
     */
    public boolean usesCustomId() {
        return this == COMPONENT || this == MODAL_SUBMIT;
    }

    /**
     * Wire code of a deferred acknowledgment for this kind.
     *
     * <p>Component interactions acknowledge with an update-message defer; commands
     * and modal submissions with a channel-message defer.
     *
     * @return deferred response type
     * @throws IllegalStateException if this kind cannot be deferred
     */
    public ResponseType deferredResponseType() {
        return switch (this) {
            case COMPONENT -> ResponseType.DEFERRED_UPDATE_MESSAGE;
            case COMMAND, MODAL_SUBMIT -> ResponseType.DEFERRED_CHANNEL_MESSAGE;
            case AUTOCOMPLETE, CATCH_ALL -> throw new IllegalStateException(this + " interactions cannot be deferred");
        };
    }

    /**
     * Check that a sub-type filter is valid for this kind.
     *
     * @param subType sub-type filter (nullable)
     * @return true if the filter may be used with this kind
     */
    public boolean accepts(InteractionSubType subType) {
        if (subType == null) {
            return true;
        }
        return switch (this) {
            case COMMAND -> subType instanceof CommandType;
            case COMPONENT -> subType instanceof ComponentType componentType && componentType.isInteractive();
            case AUTOCOMPLETE, MODAL_SUBMIT, CATCH_ALL -> false;
        };
    }
}
