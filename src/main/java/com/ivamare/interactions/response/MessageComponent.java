package com.ivamare.interactions.response;

import com.ivamare.interactions.model.ComponentType;

import java.util.Map;

/**
 * A component that can be placed in an {@link ActionRow}.
 */
public interface MessageComponent {

    ComponentType type();

    /**
     * Space this component takes in a row. A row holds at most {@value ActionRow#MAX_WEIGHT}.
     *
     * @return component weight
     */
    int weight();

    /**
     * @return wire representation
     */
    Map<String, Object> toMap();
}
