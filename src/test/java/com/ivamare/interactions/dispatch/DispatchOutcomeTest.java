package com.ivamare.interactions.dispatch;

import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionContext;
import com.ivamare.interactions.model.InteractionCredentials;
import com.ivamare.interactions.model.ResponseEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DispatchOutcome")
class DispatchOutcomeTest {

    private final InteractionContext context = InteractionContext
        .builder(new InteractionCredentials("app", "i-1", "tok"), HandlerKind.COMMAND)
        .name("ping")
        .build();

    @Test
    @DisplayName("markDelivered should run the delivery hook once")
    void markDeliveredShouldRunOnce() {
        AtomicInteger calls = new AtomicInteger();
        DispatchOutcome outcome = DispatchOutcome.deferred(context, ResponseEnvelope.deferred(false), o -> {
            calls.incrementAndGet();
            o.settle();
        });

        outcome.markDelivered();
        outcome.markDelivered();

        assertEquals(1, calls.get());
        assertTrue(outcome.isDelivered());
        assertTrue(outcome.settled().isDone());
    }

    @Test
    @DisplayName("outcome without background work should settle on delivery")
    void shouldSettleWithoutHook() {
        DispatchOutcome outcome = DispatchOutcome.responded(context, ResponseEnvelope.message("hi"), null);

        assertFalse(outcome.settled().isDone());
        outcome.markDelivered();

        assertEquals(DispatchState.RESPONDED_IMMEDIATE, outcome.settled().join());
    }

    @Test
    @DisplayName("abandon should skip the delivery hook and settle")
    void abandonShouldSkipDelivery() {
        AtomicInteger delivered = new AtomicInteger();
        AtomicInteger abandoned = new AtomicInteger();
        DispatchOutcome outcome = DispatchOutcome.deferred(context, ResponseEnvelope.deferred(false),
            o -> delivered.incrementAndGet(), abandoned::incrementAndGet);

        outcome.abandon();
        outcome.markDelivered();
        outcome.abandon();

        assertEquals(0, delivered.get());
        assertEquals(1, abandoned.get());
        assertTrue(outcome.isAbandoned());
        assertFalse(outcome.isDelivered());
        assertEquals(DispatchState.DEFERRED, outcome.settled().join());
    }

    @Test
    @DisplayName("abandon should have no effect after delivery")
    void abandonAfterDeliveryShouldBeIgnored() {
        AtomicInteger abandoned = new AtomicInteger();
        DispatchOutcome outcome = DispatchOutcome.deferred(context, ResponseEnvelope.deferred(false),
            DispatchOutcome::settle, abandoned::incrementAndGet);

        outcome.markDelivered();
        outcome.abandon();

        assertEquals(0, abandoned.get());
        assertTrue(outcome.isDelivered());
        assertFalse(outcome.isAbandoned());
    }

    @Test
    @DisplayName("should only allow lifecycle transitions")
    void shouldEnforceTransitions() {
        DispatchOutcome deferred = DispatchOutcome.deferred(context, ResponseEnvelope.deferred(false), null);
        DispatchOutcome responded = DispatchOutcome.responded(context, ResponseEnvelope.message("hi"), null);

        deferred.advance(DispatchState.FOLLOWUP_SENT);

        assertEquals(DispatchState.FOLLOWUP_SENT, deferred.state());
        assertThrows(IllegalStateException.class, () -> deferred.advance(DispatchState.FOLLOWUP_SENT));
        assertThrows(IllegalStateException.class, () -> responded.advance(DispatchState.DEFERRED));
    }

    @Test
    @DisplayName("state graph should have the expected terminal states")
    void stateGraphShouldHaveTerminals() {
        assertTrue(DispatchState.RECEIVED.canTransitionTo(DispatchState.ROUTED));
        assertTrue(DispatchState.ROUTED.canTransitionTo(DispatchState.HANDLER_NOT_FOUND));
        assertFalse(DispatchState.RESPONDED_IMMEDIATE.canTransitionTo(DispatchState.DEFERRED));
        assertTrue(DispatchState.FOLLOWUP_SENT.isTerminal());
        assertTrue(DispatchState.HANDLER_NOT_FOUND.isTerminal());
        assertFalse(DispatchState.DEFERRED.isTerminal());
    }
}
