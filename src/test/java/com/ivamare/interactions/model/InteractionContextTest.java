package com.ivamare.interactions.model;

import com.ivamare.interactions.exception.AlreadyRespondedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InteractionContext")
class InteractionContextTest {

    private static final InteractionCredentials CREDENTIALS = new InteractionCredentials("app", "i-1", "secret-token");

    private InteractionContext context;

    @BeforeEach
    void setUp() {
        Map<String, Object> options = new HashMap<>();
        options.put("user", "42");
        options.put("reason", null);

        context = InteractionContext.builder(CREDENTIALS, HandlerKind.COMMAND)
            .name("ban")
            .subType(CommandType.CHAT_INPUT)
            .options(options)
            .guildId("g")
            .userId("u")
            .build();
    }

    @Test
    @DisplayName("should expose routing fields and tolerate null option values")
    void shouldExposeFields() {
        assertEquals("i-1", context.interactionId());
        assertEquals(HandlerKind.COMMAND, context.kind());
        assertEquals("ban", context.name());
        assertEquals(CommandType.CHAT_INPUT, context.subType());
        assertEquals("42", context.option("user").orElseThrow());
        assertTrue(context.option("reason").isEmpty());
        assertEquals(List.of(), context.values());
        assertEquals("g", context.guildId());
    }

    @Test
    @DisplayName("should reject catch-all as an interaction kind")
    void shouldRejectCatchAll() {
        assertThrows(IllegalArgumentException.class,
            () -> InteractionContext.builder(CREDENTIALS, HandlerKind.CATCH_ALL).build());
    }

    @Test
    @DisplayName("should bind template parameters")
    void shouldBindParameters() {
        context.bindParameters(Map.of("role", 123L));

        assertEquals(123L, context.parameter("role"));
        assertNull(context.parameter("missing"));
    }

    @Test
    @DisplayName("credentials should not print the token")
    void credentialsShouldHideToken() {
        assertFalse(CREDENTIALS.toString().contains("secret-token"));
    }

    @Nested
    @DisplayName("single response")
    class SingleResponseTests {

        @Test
        @DisplayName("respond should commit the response once")
        void respondShouldCommitOnce() {
            context.respond("done");

            assertTrue(context.isResponded());
            assertEquals("done", context.committedResponse().orElseThrow().data().get("content"));
            assertThrows(AlreadyRespondedException.class, () -> context.respond("again"));
        }

        @Test
        @DisplayName("markResponded should fail the second time")
        void markRespondedShouldFailTwice() {
            context.markResponded();

            AlreadyRespondedException e = assertThrows(AlreadyRespondedException.class, context::markResponded);
            assertEquals("i-1", e.getInteractionId());
        }

        @Test
        @DisplayName("respond should refuse deferrals")
        void respondShouldRefuseDeferrals() {
            assertThrows(IllegalArgumentException.class, () -> context.respond(ResponseEnvelope.deferred(false)));
            assertFalse(context.isResponded());
        }
    }
}
