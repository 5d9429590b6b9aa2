package com.ivamare.interactions.dispatch;

import com.ivamare.interactions.model.InteractionContext;

/**
 * Single entry point used by the transport for every inbound interaction.
 */
public interface InteractionDispatcher {

    /**
     * Resolve, execute and respond to an interaction.
     *
     * <p>Returns a not-found outcome when no handler matches. Errors raised while
     * producing the initial response propagate to the caller; errors in background
     * continuations are logged and never surface here.
     *
     * @param context the decoded interaction
     * @return outcome carrying the wire response
     * @throws com.ivamare.interactions.exception.AlreadyRespondedException if a handler
     *         committed more than one initial response
     * @throws com.ivamare.interactions.exception.UnsupportedResponseElementException if the
     *         handler result cannot be turned into a response
     * @throws com.ivamare.interactions.exception.HandlerExecutionException if the handler failed
     */
    DispatchOutcome dispatch(InteractionContext context);
}
