package com.ivamare.interactions.dispatch.impl;

import com.ivamare.interactions.dispatch.ContinuationSupervisor;
import com.ivamare.interactions.dispatch.DispatchOutcome;
import com.ivamare.interactions.dispatch.DispatchState;
import com.ivamare.interactions.dispatch.InteractionDispatcher;
import com.ivamare.interactions.exception.AlreadyRespondedException;
import com.ivamare.interactions.exception.HandlerExecutionException;
import com.ivamare.interactions.exception.InteractionsException;
import com.ivamare.interactions.exception.UnsupportedResponseElementException;
import com.ivamare.interactions.followup.FollowupClient;
import com.ivamare.interactions.handler.HandlerRegistration;
import com.ivamare.interactions.handler.HandlerRegistry;
import com.ivamare.interactions.handler.InteractionHandler;
import com.ivamare.interactions.model.DeferPolicy;
import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionContext;
import com.ivamare.interactions.model.ResponseEnvelope;
import com.ivamare.interactions.response.ResponseResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Default implementation of InteractionDispatcher.
 *
 * <p>The handler always runs as its own task. When auto-defer applies, the serving
 * thread waits for it only up to the policy timeout; if the task is still running,
 * a deferred acknowledgment is returned and the task keeps running. Its eventual
 * result is delivered by editing the original response once the acknowledgment
 * has been delivered.
 */
public class DefaultInteractionDispatcher implements InteractionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultInteractionDispatcher.class);

    private static final Object PENDING = new Object();

    private final HandlerRegistry registry;
    private final ResponseResolver resolver;
    private final FollowupClient followupClient;
    private final ContinuationSupervisor supervisor;
    private final DeferPolicy defaultPolicy;

    public DefaultInteractionDispatcher(
            HandlerRegistry registry,
            ResponseResolver resolver,
            FollowupClient followupClient,
            ContinuationSupervisor supervisor,
            DeferPolicy defaultPolicy) {
        this.registry = registry;
        this.resolver = resolver;
        this.followupClient = followupClient;
        this.supervisor = supervisor;
        this.defaultPolicy = defaultPolicy.resolve(DeferPolicy.defaults());
    }

    @Override
    public DispatchOutcome dispatch(InteractionContext context) {
        DispatchState state = DispatchState.RECEIVED;

        Optional<HandlerRegistry.Resolution> resolution =
            registry.resolve(context.kind(), context.name(), context.subType());
        state = transition(context, state, DispatchState.ROUTED);

        if (resolution.isEmpty()) {
            transition(context, state, DispatchState.HANDLER_NOT_FOUND);
            log.debug("No handler for {}", context);
            return DispatchOutcome.notFound(context);
        }

        HandlerRegistration registration = resolution.get().registration();
        context.bindParameters(resolution.get().parameters());

        CompletableFuture<Object> task = supervisor.launch(registration.handler(), context);
        state = transition(context, state, DispatchState.EXECUTING);

        DeferPolicy policy = registration.deferPolicy().resolve(defaultPolicy);
        Object result;
        if (policy.isEnabled() && context.kind().supportsAutoDefer()) {
            result = awaitWithin(task, policy, context);
            if (result == PENDING) {
                transition(context, state, DispatchState.DEFERRED);
                return autoDefer(context, registration, task, policy);
            }
        } else {
            result = await(task, context);
        }

        return respond(context, registration, state, result);
    }

    private DispatchOutcome respond(InteractionContext context, HandlerRegistration registration,
                                    DispatchState state, Object result) {
        ResponseEnvelope envelope;
        if (result == null && context.committedResponse().isPresent()) {
            envelope = context.committedResponse().get();
        } else {
            envelope = resolver.resolve(result);
            if (envelope.isDeferred()) {
                transition(context, state, DispatchState.DEFERRED);
                return explicitDefer(context, registration, envelope);
            }
            context.markResponded();
        }

        transition(context, state, DispatchState.RESPONDED_IMMEDIATE);
        log.debug("Responding to {} with type {}", context, envelope.type());

        Consumer<DispatchOutcome> afterDelivery = registration.followup()
            .<Consumer<DispatchOutcome>>map(routine -> outcome -> runInBackground(outcome,
                "followup for interaction " + context.interactionId(),
                () -> sendFollowup(context, routine)))
            .orElse(null);

        return DispatchOutcome.responded(context, envelope, afterDelivery);
    }

    private DispatchOutcome explicitDefer(InteractionContext context, HandlerRegistration registration,
                                          ResponseEnvelope envelope) {
        ensureNotResponded(context);
        ResponseEnvelope acknowledgment = toWireType(context, envelope);
        Optional<InteractionHandler> continuation = envelope.continuation();

        log.debug("Handler deferred {} explicitly", context);

        return DispatchOutcome.deferred(context, acknowledgment, outcome -> runInBackground(outcome,
            "deferred continuation for interaction " + context.interactionId(),
            () -> {
                if (continuation.isPresent()) {
                    deliver(context, continuation.get().handle(context));
                }
                runFollowup(context, registration, outcome);
            }));
    }

    private DispatchOutcome autoDefer(InteractionContext context, HandlerRegistration registration,
                                      CompletableFuture<Object> task, DeferPolicy policy) {
        ensureNotResponded(context);
        ResponseEnvelope acknowledgment = toWireType(context, ResponseEnvelope.deferred(policy.isEphemeral()));

        log.info("Handler {} did not finish within {}, deferring interaction {}",
            registration.describe(), policy.timeout(), context.interactionId());

        return DispatchOutcome.deferred(context, acknowledgment,
            outcome -> runInBackground(outcome,
                "auto-deferred continuation for interaction " + context.interactionId(),
                () -> {
                    deliver(context, awaitInBackground(task));
                    runFollowup(context, registration, outcome);
                }),
            () -> drain(context, task));
    }

    // settles the outcome even when a stopped supervisor drops the work
    private void runInBackground(DispatchOutcome outcome, String description,
                                 ContinuationSupervisor.Continuation work) {
        boolean accepted = supervisor.supervise(description, () -> {
            try {
                work.run();
            } finally {
                outcome.settle();
            }
        });
        if (!accepted) {
            outcome.settle();
        }
    }

    // the acknowledgment never reached the platform, so the result is only observed and logged
    private static void drain(InteractionContext context, CompletableFuture<Object> task) {
        task.whenComplete((result, failure) -> {
            if (failure != null) {
                log.error("Handler for undelivered interaction {} failed", context.interactionId(), failure);
            } else {
                log.warn("Discarding result of handler for undelivered interaction {}", context.interactionId());
            }
        });
    }

    /**
     * Deliver the eventual result of a deferred interaction by editing the original response.
     */
    private void deliver(InteractionContext context, Object result) throws Exception {
        Object current = result;
        while (true) {
            ResponseEnvelope envelope;
            if (current == null) {
                Optional<ResponseEnvelope> committed = context.committedResponse();
                if (committed.isEmpty()) {
                    log.warn("Deferred handler for {} produced no response", context);
                    return;
                }
                envelope = committed.get();
            } else {
                envelope = resolver.resolve(current);
            }

            if (!envelope.isDeferred()) {
                followupClient.editOriginalResponse(context.credentials(), envelope.data());
                log.debug("Delivered deferred response for {}", context);
                return;
            }

            // already acknowledged, so a nested deferral just runs its continuation
            Optional<InteractionHandler> next = envelope.continuation();
            if (next.isEmpty()) {
                log.debug("Deferred handler for {} returned a bare deferral, nothing to deliver", context);
                return;
            }
            current = next.get().handle(context);
        }
    }

    private void runFollowup(InteractionContext context, HandlerRegistration registration,
                             DispatchOutcome outcome) throws Exception {
        Optional<InteractionHandler> routine = registration.followup();
        if (routine.isPresent()) {
            sendFollowup(context, routine.get());
        }
        outcome.advance(DispatchState.FOLLOWUP_SENT);
    }

    private void sendFollowup(InteractionContext context, InteractionHandler routine) throws Exception {
        Object result = routine.handle(context);
        if (result == null) {
            log.debug("Follow-up routine for {} returned nothing", context);
            return;
        }
        ResponseEnvelope envelope = resolver.resolve(result);
        followupClient.sendFollowupMessage(context.credentials(), envelope.data());
        log.debug("Sent follow-up message for {}", context);
    }

    // deferred acknowledgments carry a kind-specific wire code
    private static ResponseEnvelope toWireType(InteractionContext context, ResponseEnvelope envelope) {
        if (context.kind() == HandlerKind.AUTOCOMPLETE) {
            throw new UnsupportedResponseElementException(ResponseEnvelope.class);
        }
        return envelope.withType(context.kind().deferredResponseType());
    }

    private static void ensureNotResponded(InteractionContext context) {
        if (context.isResponded()) {
            throw new AlreadyRespondedException(context.interactionId());
        }
    }

    private static Object awaitWithin(CompletableFuture<Object> task, DeferPolicy policy,
                                      InteractionContext context) {
        try {
            return task.get(policy.timeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return PENDING;
        } catch (ExecutionException e) {
            throw unwrap(e, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException("Interrupted while waiting for handler of " + context, e);
        }
    }

    private static Object await(CompletableFuture<Object> task, InteractionContext context) {
        try {
            return task.get();
        } catch (ExecutionException e) {
            throw unwrap(e, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException("Interrupted while waiting for handler of " + context, e);
        }
    }

    private static Object awaitInBackground(CompletableFuture<Object> task) throws Exception {
        try {
            return task.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static RuntimeException unwrap(ExecutionException e, InteractionContext context) {
        Throwable cause = e.getCause();
        if (cause instanceof InteractionsException interactionsException) {
            return interactionsException;
        }
        return new HandlerExecutionException("Handler failed for " + context, cause);
    }

    private static DispatchState transition(InteractionContext context, DispatchState from, DispatchState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + to + " for " + context);
        }
        log.trace("Interaction {} {} -> {}", context.interactionId(), from, to);
        return to;
    }
}
