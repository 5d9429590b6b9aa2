package com.ivamare.interactions.dispatch;

import com.ivamare.interactions.model.InteractionContext;
import com.ivamare.interactions.model.ResponseEnvelope;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Result of dispatching one interaction.
 *
 * <p>The transport writes {@link #toWire()} as the HTTP response and then calls
 * {@link #markDelivered()}. Background work (deferred continuation, follow-up
 * routine) starts only then, so it never overtakes the initial response.
 */
public final class DispatchOutcome {

    public enum Status {
        RESPONDED,
        DEFERRED,
        NOT_FOUND
    }

    private final Status status;
    private final InteractionContext context;
    private final ResponseEnvelope response;
    private final Consumer<DispatchOutcome> afterDelivery;
    private final Runnable onAbandon;

    private final AtomicReference<DispatchState> state;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean abandoned;
    private final CompletableFuture<DispatchState> settled = new CompletableFuture<>();

    private DispatchOutcome(Status status, DispatchState state, InteractionContext context,
                            ResponseEnvelope response, Consumer<DispatchOutcome> afterDelivery,
                            Runnable onAbandon) {
        this.status = status;
        this.state = new AtomicReference<>(state);
        this.context = context;
        this.response = response;
        this.afterDelivery = afterDelivery;
        this.onAbandon = onAbandon;
    }

    public static DispatchOutcome notFound(InteractionContext context) {
        return new DispatchOutcome(Status.NOT_FOUND, DispatchState.HANDLER_NOT_FOUND, context, null, null, null);
    }

    /**
     * @param context the interaction
     * @param response immediate response
     * @param afterDelivery work to start once the response is delivered (nullable)
     * @return responded outcome
     */
    public static DispatchOutcome responded(InteractionContext context, ResponseEnvelope response,
                                            Consumer<DispatchOutcome> afterDelivery) {
        return new DispatchOutcome(Status.RESPONDED, DispatchState.RESPONDED_IMMEDIATE,
            context, Objects.requireNonNull(response, "response"), afterDelivery, null);
    }

    /**
     * @param context the interaction
     * @param acknowledgment deferred acknowledgment with its final wire type
     * @param afterDelivery background continuation started once the acknowledgment is delivered
     * @return deferred outcome
     */
    public static DispatchOutcome deferred(InteractionContext context, ResponseEnvelope acknowledgment,
                                           Consumer<DispatchOutcome> afterDelivery) {
        return deferred(context, acknowledgment, afterDelivery, null);
    }

    /**
     * @param context the interaction
     * @param acknowledgment deferred acknowledgment with its final wire type
     * @param afterDelivery background continuation started once the acknowledgment is delivered
     * @param onAbandon run instead of the continuation when the acknowledgment cannot be delivered (nullable)
     * @return deferred outcome
     */
    public static DispatchOutcome deferred(InteractionContext context, ResponseEnvelope acknowledgment,
                                           Consumer<DispatchOutcome> afterDelivery, Runnable onAbandon) {
        return new DispatchOutcome(Status.DEFERRED, DispatchState.DEFERRED,
            context, Objects.requireNonNull(acknowledgment, "acknowledgment"), afterDelivery, onAbandon);
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status != Status.NOT_FOUND;
    }

    public InteractionContext context() {
        return context;
    }

    public Optional<ResponseEnvelope> response() {
        return Optional.ofNullable(response);
    }

    /**
     * @return wire response for the transport
     * @throws IllegalStateException if no handler was found
     */
    public Map<String, Object> toWire() {
        if (response == null) {
            throw new IllegalStateException("No response for interaction without handler");
        }
        return response.toWire();
    }

    public DispatchState state() {
        return state.get();
    }

    /**
     * Move to the next lifecycle state.
     *
     * @param next next state
     * @throws IllegalStateException if the transition is not allowed
     */
    public void advance(DispatchState next) {
        DispatchState current = state.get();
        if (!current.canTransitionTo(next) || !state.compareAndSet(current, next)) {
            throw new IllegalStateException("Cannot move interaction " + context.interactionId()
                + " from " + current + " to " + next);
        }
    }

    /**
     * Signal that the transport has delivered the response. Idempotent.
     */
    public void markDelivered() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        if (afterDelivery == null) {
            settle();
        } else {
            afterDelivery.accept(this);
        }
    }

    /**
     * Signal that the transport could not deliver the response. Background work is
     * skipped and the outcome settles in its current state. Has no effect once
     * {@link #markDelivered()} has been called.
     */
    public void abandon() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        abandoned = true;
        try {
            if (onAbandon != null) {
                onAbandon.run();
            }
        } finally {
            settle();
        }
    }

    public boolean isDelivered() {
        return released.get() && !abandoned;
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    /**
     * Mark all background work for this interaction as finished, successfully or not.
     */
    public void settle() {
        settled.complete(state.get());
    }

    /**
     * @return future completed with the final state once background work has finished
     */
    public CompletableFuture<DispatchState> settled() {
        return settled;
    }

    @Override
    public String toString() {
        return "DispatchOutcome[status=" + status + ", state=" + state.get() + ", response=" + response + "]";
    }
}
