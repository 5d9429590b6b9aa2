package com.ivamare.interactions.model;

/**
 * Inbound interaction type as sent by the platform.
 */
public enum InteractionType {
    PING(1),
    APPLICATION_COMMAND(2),
    MESSAGE_COMPONENT(3),
    APPLICATION_COMMAND_AUTOCOMPLETE(4),
    MODAL_SUBMIT(5);

    private final int value;

    InteractionType(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Map to the handler kind used for routing.
     *
     * @return handler kind
     * @throws IllegalStateException for PING, which is never routed to a handler
     */
    public HandlerKind toHandlerKind() {
        return switch (this) {
            case APPLICATION_COMMAND -> HandlerKind.COMMAND;
            case MESSAGE_COMPONENT -> HandlerKind.COMPONENT;
            case APPLICATION_COMMAND_AUTOCOMPLETE -> HandlerKind.AUTOCOMPLETE;
            case MODAL_SUBMIT -> HandlerKind.MODAL_SUBMIT;
            case PING -> throw new IllegalStateException("PING interactions are not routed");
        };
    }

    public static InteractionType fromValue(int value) {
        for (InteractionType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown InteractionType: " + value);
    }
}
