package com.ivamare.interactions.dispatch.impl;

import com.ivamare.interactions.dispatch.ContinuationSupervisor;
import com.ivamare.interactions.dispatch.DispatchOutcome;
import com.ivamare.interactions.dispatch.DispatchState;
import com.ivamare.interactions.exception.AlreadyRespondedException;
import com.ivamare.interactions.exception.FollowupDeliveryException;
import com.ivamare.interactions.exception.HandlerExecutionException;
import com.ivamare.interactions.exception.UnsupportedResponseElementException;
import com.ivamare.interactions.followup.FollowupClient;
import com.ivamare.interactions.handler.HandlerRegistration;
import com.ivamare.interactions.handler.impl.DefaultHandlerRegistry;
import com.ivamare.interactions.model.CommandType;
import com.ivamare.interactions.model.ComponentType;
import com.ivamare.interactions.model.DeferPolicy;
import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionContext;
import com.ivamare.interactions.model.InteractionCredentials;
import com.ivamare.interactions.model.InteractionSubType;
import com.ivamare.interactions.model.ResponseEnvelope;
import com.ivamare.interactions.model.ResponseType;
import com.ivamare.interactions.response.ResponseResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultInteractionDispatcher")
class DefaultInteractionDispatcherTest {

    private static final InteractionCredentials CREDENTIALS = new InteractionCredentials("app", "i-1", "tok");
    private static final DeferPolicy IMMEDIATE_DEFER = DeferPolicy.enabled(Duration.ZERO, false);

    @Mock
    private FollowupClient followupClient;

    private DefaultHandlerRegistry registry;
    private ContinuationSupervisor supervisor;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        registry = new DefaultHandlerRegistry();
        supervisor = new ContinuationSupervisor(Duration.ofSeconds(1));
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        supervisor.stopNow();
    }

    private DefaultInteractionDispatcher dispatcher(DeferPolicy defaults) {
        return new DefaultInteractionDispatcher(registry, new ResponseResolver(), followupClient, supervisor, defaults);
    }

    private void register(HandlerRegistration.Builder builder) {
        registry.register(builder.build());
    }

    private static InteractionContext context(HandlerKind kind, String name, InteractionSubType subType) {
        return InteractionContext.builder(CREDENTIALS, kind).name(name).subType(subType).build();
    }

    private static InteractionContext command(String name) {
        return context(HandlerKind.COMMAND, name, CommandType.CHAT_INPUT);
    }

    private Object blockUntilReleased(Object result) throws InterruptedException {
        assertTrue(release.await(5, TimeUnit.SECONDS));
        return result;
    }

    private static DispatchState deliverAndWait(DispatchOutcome outcome) throws Exception {
        outcome.markDelivered();
        return outcome.settled().get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("immediate responses")
    class ImmediateTests {

        @Test
        @DisplayName("should return the resolved handler result")
        void shouldReturnHandlerResult() throws Exception {
            register(HandlerRegistration.command("ping").handler(ctx -> "pong"));
            InteractionContext context = command("ping");

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults()).dispatch(context);

            assertEquals(DispatchOutcome.Status.RESPONDED, outcome.status());
            assertEquals(DispatchState.RESPONDED_IMMEDIATE, outcome.state());
            assertEquals(Map.of("type", 4, "data", Map.of("content", "pong")), outcome.toWire());
            assertTrue(context.isResponded());

            assertEquals(DispatchState.RESPONDED_IMMEDIATE, deliverAndWait(outcome));
            verifyNoInteractions(followupClient);
        }

        @Test
        @DisplayName("should report a missing handler")
        void shouldReportMissingHandler() {
            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults()).dispatch(command("nope"));

            assertFalse(outcome.isFound());
            assertEquals(DispatchState.HANDLER_NOT_FOUND, outcome.state());
            assertTrue(outcome.response().isEmpty());
            assertThrows(IllegalStateException.class, outcome::toWire);
        }

        @Test
        @DisplayName("should bind template parameters before the handler runs")
        void shouldBindTemplateParameters() {
            register(HandlerRegistration.component("role:{id:int}")
                .handler(ctx -> "role " + ctx.parameter("id").getClass().getSimpleName()));

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults())
                .dispatch(context(HandlerKind.COMPONENT, "role:7", ComponentType.BUTTON));

            assertEquals("role Long", outcome.response().orElseThrow().data().get("content"));
        }

        @Test
        @DisplayName("should use a response committed through the context")
        void shouldUseCommittedResponse() {
            register(HandlerRegistration.command("ping").handler(ctx -> {
                ctx.respond(ResponseEnvelope.ephemeralMessage("only you"));
                return null;
            }));

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults()).dispatch(command("ping"));

            assertTrue(outcome.response().orElseThrow().isEphemeral());
        }

        @Test
        @DisplayName("should reject a second initial response")
        void shouldRejectSecondResponse() {
            register(HandlerRegistration.command("ping").handler(ctx -> {
                ctx.respond("first");
                return "second";
            }));

            assertThrows(AlreadyRespondedException.class, () -> dispatcher(DeferPolicy.defaults()).dispatch(command("ping")));
        }

        @Test
        @DisplayName("should wrap handler failures")
        void shouldWrapHandlerFailures() {
            IllegalStateException failure = new IllegalStateException("boom");
            register(HandlerRegistration.command("ping").handler(ctx -> {
                throw failure;
            }));

            HandlerExecutionException e = assertThrows(HandlerExecutionException.class,
                () -> dispatcher(DeferPolicy.defaults()).dispatch(command("ping")));
            assertSame(failure, e.getCause());
        }

        @Test
        @DisplayName("should reject unsupported handler results")
        void shouldRejectUnsupportedResults() {
            register(HandlerRegistration.command("ping").handler(ctx -> 42));

            assertThrows(UnsupportedResponseElementException.class,
                () -> dispatcher(DeferPolicy.defaults()).dispatch(command("ping")));
        }

        @Test
        @DisplayName("should wait for handlers that opt out of auto-defer")
        void shouldWaitWhenAutoDeferDisabled() {
            register(HandlerRegistration.command("slow").autoDefer(false).handler(ctx -> {
                Thread.sleep(50);
                return "finally";
            }));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("slow"));

            assertEquals(DispatchOutcome.Status.RESPONDED, outcome.status());
            assertEquals("finally", outcome.response().orElseThrow().data().get("content"));
        }

        @Test
        @DisplayName("should never auto-defer autocomplete")
        void shouldNotAutoDeferAutocomplete() {
            register(HandlerRegistration.autocomplete("color").handler(ctx -> {
                Thread.sleep(50);
                return List.of("red", "green");
            }));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(context(HandlerKind.AUTOCOMPLETE, "color", null));

            assertEquals(ResponseType.AUTOCOMPLETE_RESULT, outcome.response().orElseThrow().type());
        }
    }

    @Nested
    @DisplayName("auto-defer")
    class AutoDeferTests {

        @Test
        @DisplayName("should defer a slow command and edit the original response later")
        void shouldDeferSlowCommand() throws Exception {
            register(HandlerRegistration.command("report").handler(ctx -> blockUntilReleased("done")));
            InteractionContext context = command("report");

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(context);

            assertEquals(DispatchOutcome.Status.DEFERRED, outcome.status());
            assertEquals(Map.of("type", 5), outcome.toWire());
            assertFalse(context.isResponded());

            release.countDown();
            assertEquals(DispatchState.FOLLOWUP_SENT, deliverAndWait(outcome));

            verify(followupClient).editOriginalResponse(CREDENTIALS, Map.of("content", "done"));
        }

        @Test
        @DisplayName("should defer components with an update acknowledgment")
        void shouldDeferComponentWithUpdate() {
            register(HandlerRegistration.component("refresh").handler(ctx -> blockUntilReleased("fresh")));

            DispatchOutcome outcome = dispatcher(DeferPolicy.enabled(Duration.ZERO, true))
                .dispatch(context(HandlerKind.COMPONENT, "refresh", ComponentType.BUTTON));

            assertEquals(ResponseType.DEFERRED_UPDATE_MESSAGE, outcome.response().orElseThrow().type());
            assertEquals(Map.of("type", 6, "data", Map.of("flags", 64)), outcome.toWire());
        }

        @Test
        @DisplayName("should let a handler-level policy enable auto-defer")
        void handlerPolicyShouldEnableAutoDefer() {
            register(HandlerRegistration.command("report")
                .deferPolicy(DeferPolicy.enabled(Duration.ZERO, false))
                .handler(ctx -> blockUntilReleased("done")));

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults()).dispatch(command("report"));

            assertEquals(DispatchOutcome.Status.DEFERRED, outcome.status());
        }

        @Test
        @DisplayName("should not start the continuation before delivery")
        void shouldWaitForDelivery() throws Exception {
            register(HandlerRegistration.command("report").handler(ctx -> blockUntilReleased("done")));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("report"));
            release.countDown();

            verify(followupClient, after(200).never()).editOriginalResponse(any(), any());

            deliverAndWait(outcome);
            verify(followupClient).editOriginalResponse(any(), any());
        }

        @Test
        @DisplayName("should respond immediately when the handler beats the timer")
        void shouldRespondWhenHandlerIsFast() {
            register(HandlerRegistration.command("ping").handler(ctx -> "pong"));

            DispatchOutcome outcome = dispatcher(DeferPolicy.enabled(Duration.ofSeconds(5), false))
                .dispatch(command("ping"));

            assertEquals(DispatchOutcome.Status.RESPONDED, outcome.status());
        }

        @Test
        @DisplayName("should send the follow-up after editing the original response")
        void shouldSendFollowupAfterEdit() throws Exception {
            register(HandlerRegistration.command("report")
                .handler(ctx -> blockUntilReleased("done"))
                .followup(ctx -> "and one more thing"));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("report"));
            release.countDown();
            deliverAndWait(outcome);

            InOrder inOrder = inOrder(followupClient);
            inOrder.verify(followupClient).editOriginalResponse(CREDENTIALS, Map.of("content", "done"));
            inOrder.verify(followupClient).sendFollowupMessage(CREDENTIALS, Map.of("content", "and one more thing"));
        }

        @Test
        @DisplayName("should contain background failures")
        void shouldContainBackgroundFailures() throws Exception {
            register(HandlerRegistration.command("report").handler(ctx -> blockUntilReleased("done")));
            doThrow(new FollowupDeliveryException(404, "Unknown Webhook"))
                .when(followupClient).editOriginalResponse(any(), any());

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("report"));
            release.countDown();

            assertEquals(DispatchState.DEFERRED, deliverAndWait(outcome));
            assertTrue(supervisor.isRunning());
        }

        @Test
        @DisplayName("should settle when the supervisor drops the continuation")
        void shouldSettleWhenContinuationDropped() throws Exception {
            register(HandlerRegistration.command("report").handler(ctx -> blockUntilReleased("done")));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("report"));
            supervisor.stopNow();

            assertEquals(DispatchState.DEFERRED, deliverAndWait(outcome));
            verifyNoInteractions(followupClient);
        }

        @Test
        @DisplayName("should settle without delivering when the acknowledgment is abandoned")
        void shouldSettleWhenAbandoned() throws Exception {
            register(HandlerRegistration.command("report").handler(ctx -> blockUntilReleased("done")));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("report"));
            outcome.abandon();
            release.countDown();

            assertEquals(DispatchState.DEFERRED, outcome.settled().get(5, TimeUnit.SECONDS));
            verify(followupClient, after(200).never()).editOriginalResponse(any(), any());
        }

        @Test
        @DisplayName("should skip delivery when the deferred handler fails")
        void shouldSkipDeliveryOnFailure() throws Exception {
            register(HandlerRegistration.command("report").handler(ctx -> {
                blockUntilReleased(null);
                throw new IllegalStateException("late failure");
            }));

            DispatchOutcome outcome = dispatcher(IMMEDIATE_DEFER).dispatch(command("report"));
            release.countDown();

            assertEquals(DispatchState.DEFERRED, deliverAndWait(outcome));
            verifyNoInteractions(followupClient);
        }
    }

    @Nested
    @DisplayName("explicit deferral")
    class ExplicitDeferTests {

        @Test
        @DisplayName("should acknowledge and run the continuation after delivery")
        void shouldRunContinuation() throws Exception {
            register(HandlerRegistration.command("think")
                .handler(ctx -> ResponseEnvelope.deferred(later -> "thought about it", false)));

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults()).dispatch(command("think"));

            assertEquals(DispatchOutcome.Status.DEFERRED, outcome.status());
            assertEquals(Map.of("type", 5), outcome.toWire());

            assertEquals(DispatchState.FOLLOWUP_SENT, deliverAndWait(outcome));
            verify(followupClient).editOriginalResponse(CREDENTIALS, Map.of("content", "thought about it"));
        }

        @Test
        @DisplayName("should correct the wire type for components")
        void shouldCorrectWireTypeForComponents() {
            register(HandlerRegistration.component("wait").handler(ctx -> ResponseEnvelope.deferred(true)));

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults())
                .dispatch(context(HandlerKind.COMPONENT, "wait", ComponentType.BUTTON));

            assertEquals(6, outcome.toWire().get("type"));
        }

        @Test
        @DisplayName("should reject deferral of autocomplete")
        void shouldRejectAutocompleteDeferral() {
            register(HandlerRegistration.autocomplete("color").handler(ctx -> ResponseEnvelope.deferred(false)));

            assertThrows(UnsupportedResponseElementException.class,
                () -> dispatcher(DeferPolicy.defaults()).dispatch(context(HandlerKind.AUTOCOMPLETE, "color", null)));
        }
    }

    @Nested
    @DisplayName("follow-up routine")
    class FollowupTests {

        @Test
        @DisplayName("should run once after the immediate response is delivered")
        void shouldRunOnceAfterDelivery() throws Exception {
            register(HandlerRegistration.command("ping")
                .handler(ctx -> "pong")
                .followup(ctx -> new Object[] {"extra", Map.of("ephemeral", true)}));

            DispatchOutcome outcome = dispatcher(DeferPolicy.defaults()).dispatch(command("ping"));
            verify(followupClient, after(100).never()).sendFollowupMessage(any(), any());

            deliverAndWait(outcome);
            outcome.markDelivered();

            verify(followupClient, times(1))
                .sendFollowupMessage(CREDENTIALS, Map.of("content", "extra", "flags", 64));
        }

        @Test
        @DisplayName("should skip sending when the routine returns nothing")
        void shouldSkipEmptyFollowup() throws Exception {
            register(HandlerRegistration.command("ping").handler(ctx -> "pong").followup(ctx -> null));

            deliverAndWait(dispatcher(DeferPolicy.defaults()).dispatch(command("ping")));

            verifyNoInteractions(followupClient);
        }
    }
}
