package com.ivamare.interactions.handler;

import com.ivamare.interactions.model.InteractionContext;

/**
 * Functional interface for interaction handlers.
 *
 * <p>A handler returns either a {@link com.ivamare.interactions.model.ResponseEnvelope}
 * or a loose value the {@link com.ivamare.interactions.response.ResponseResolver}
 * understands: a string, an embed, a component, a list of choices, a map of raw
 * fields, a {@link com.ivamare.interactions.model.ResponseType} tag, or an
 * {@code Object[]} combining several of them.
 *
 * <p>A handler may instead commit its response early through
 * {@link InteractionContext#respond} and return null.
 */
@FunctionalInterface
public interface InteractionHandler {

    /**
     * Handle an interaction.
     *
     * @param context The decoded interaction
     * @return response-like value (may be null if a response was committed through the context)
     * @throws Exception on processing failure
     */
    Object handle(InteractionContext context) throws Exception;
}
