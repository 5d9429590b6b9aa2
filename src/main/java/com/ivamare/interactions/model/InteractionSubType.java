package com.ivamare.interactions.model;

/**
 * Sub-type used to narrow handler lookup within a {@link HandlerKind}.
 *
 * <p>Implemented by {@link CommandType} for commands and {@link ComponentType}
 * for component interactions.
 */
public interface InteractionSubType {

    /**
     * @return the numeric wire value of this sub-type
     */
    int getValue();
}
