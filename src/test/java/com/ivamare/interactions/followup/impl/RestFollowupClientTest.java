package com.ivamare.interactions.followup.impl;

import com.ivamare.interactions.exception.FollowupDeliveryException;
import com.ivamare.interactions.model.InteractionCredentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RestFollowupClient")
class RestFollowupClientTest {

    private static final String BASE_URL = "https://discord.test/api/v10";
    private static final InteractionCredentials CREDENTIALS = new InteractionCredentials("app", "i-1", "tok");

    private MockRestServiceServer server;
    private RestFollowupClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestFollowupClient(builder, BASE_URL, "test-agent");
    }

    @Nested
    @DisplayName("routes")
    class RouteTests {

        @Test
        @DisplayName("should PATCH the original response")
        void shouldEditOriginal() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok/messages/@original"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(header("User-Agent", "test-agent"))
                .andExpect(jsonPath("$.content").value("done"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            client.editOriginalResponse(CREDENTIALS, Map.of("content", "done"));

            server.verify();
        }

        @Test
        @DisplayName("should POST a follow-up and return the created message")
        void shouldSendFollowup() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.flags").value(64))
                .andRespond(withSuccess("{\"id\":\"m-1\",\"content\":\"extra\"}", MediaType.APPLICATION_JSON));

            Map<String, Object> created = client.sendFollowupMessage(CREDENTIALS, Map.of("content", "extra", "flags", 64));

            assertEquals("m-1", created.get("id"));
            server.verify();
        }

        @Test
        @DisplayName("should DELETE the original response")
        void shouldDeleteOriginal() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok/messages/@original"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withNoContent());

            client.deleteOriginalResponse(CREDENTIALS);

            server.verify();
        }

        @Test
        @DisplayName("should PATCH a follow-up message by id")
        void shouldEditFollowup() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok/messages/m-1"))
                .andExpect(method(HttpMethod.PATCH))
                .andRespond(withSuccess());

            client.editFollowupMessage(CREDENTIALS, "m-1", Map.of("content", "edited"));

            server.verify();
        }
    }

    @Nested
    @DisplayName("errors")
    class ErrorTests {

        @Test
        @DisplayName("should classify 403 as forbidden")
        void shouldClassifyForbidden() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok/messages/@original"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).body("{\"message\":\"Missing Access\"}"));

            FollowupDeliveryException e = assertThrows(FollowupDeliveryException.class,
                () -> client.editOriginalResponse(CREDENTIALS, Map.of("content", "x")));

            assertTrue(e.isForbidden());
            assertEquals(403, e.getStatusCode());
            assertTrue(e.getResponseBody().contains("Missing Access"));
        }

        @Test
        @DisplayName("should classify 404 as not found")
        void shouldClassifyNotFound() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

            FollowupDeliveryException e = assertThrows(FollowupDeliveryException.class,
                () -> client.sendFollowupMessage(CREDENTIALS, Map.of("content", "x")));

            assertTrue(e.isNotFound());
        }

        @Test
        @DisplayName("should classify 5xx as server error")
        void shouldClassifyServerError() {
            server.expect(requestTo(BASE_URL + "/webhooks/app/tok/messages/@original"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

            FollowupDeliveryException e = assertThrows(FollowupDeliveryException.class,
                () -> client.deleteOriginalResponse(CREDENTIALS));

            assertTrue(e.isServerError());
            assertFalse(e.isForbidden());
        }
    }
}
