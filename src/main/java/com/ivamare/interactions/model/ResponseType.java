package com.ivamare.interactions.model;

/**
 * Wire response type codes.
 */
public enum ResponseType {
    PONG(1),
    CHANNEL_MESSAGE(4),
    DEFERRED_CHANNEL_MESSAGE(5),
    DEFERRED_UPDATE_MESSAGE(6),
    UPDATE_MESSAGE(7),
    AUTOCOMPLETE_RESULT(8),
    MODAL(9);

    private final int value;

    ResponseType(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true for both deferred acknowledgment codes
     */
    public boolean isDeferred() {
        return this == DEFERRED_CHANNEL_MESSAGE || this == DEFERRED_UPDATE_MESSAGE;
    }

    public static ResponseType fromValue(int value) {
        for (ResponseType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ResponseType: " + value);
    }
}
