package com.ivamare.interactions.model;

import java.util.Optional;

/**
 * Message component sub-type.
 */
public enum ComponentType implements InteractionSubType {
    ACTION_ROW(1),
    BUTTON(2),
    SELECT(3),
    TEXT_INPUT(4);

    private final int value;

    ComponentType(int value) {
        this.value = value;
    }

    @Override
    public int getValue() {
        return value;
    }

    /**
     * @return true if users can interact with this component type directly
     */
    public boolean isInteractive() {
        return this == BUTTON || this == SELECT;
    }

    public static ComponentType fromValue(int value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown ComponentType: " + value));
    }

    /**
     * @param value wire value
     * @return the matching type, empty for values this version does not know
     */
    public static Optional<ComponentType> find(int value) {
        for (ComponentType type : values()) {
            if (type.value == value) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
