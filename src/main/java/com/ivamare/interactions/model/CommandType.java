package com.ivamare.interactions.model;

import java.util.Optional;

/**
 * Application command sub-type.
 */
public enum CommandType implements InteractionSubType {
    CHAT_INPUT(1),
    USER(2),
    MESSAGE(3);

    private final int value;

    CommandType(int value) {
        this.value = value;
    }

    @Override
    public int getValue() {
        return value;
    }

    public static CommandType fromValue(int value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown CommandType: " + value));
    }

    /**
     * @param value wire value
     * @return the matching type, empty for values this version does not know
     */
    public static Optional<CommandType> find(int value) {
        for (CommandType type : values()) {
            if (type.value == value) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
