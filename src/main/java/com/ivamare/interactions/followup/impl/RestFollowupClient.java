package com.ivamare.interactions.followup.impl;

import com.ivamare.interactions.exception.FollowupDeliveryException;
import com.ivamare.interactions.followup.FollowupClient;
import com.ivamare.interactions.model.InteractionCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link FollowupClient} backed by Spring's {@link RestClient}.
 */
public class RestFollowupClient implements FollowupClient {

    private static final Logger log = LoggerFactory.getLogger(RestFollowupClient.class);

    static final String ORIGINAL_PATH = "/webhooks/{applicationId}/{token}/messages/@original";
    static final String FOLLOWUP_PATH = "/webhooks/{applicationId}/{token}";
    static final String MESSAGE_PATH = "/webhooks/{applicationId}/{token}/messages/{messageId}";

    private static final ParameterizedTypeReference<Map<String, Object>> MESSAGE_TYPE =
        new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    /**
     * Creates a client from a builder, pointing it at the given API base URL.
     *
     * @param builder RestClient builder (possibly pre-configured by the application)
     * @param baseUrl API base URL, e.g. {@code https://discord.com/api/v10}
     * @param userAgent User-Agent header value
     */
    public RestFollowupClient(RestClient.Builder builder, String baseUrl, String userAgent) {
        this(builder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
            .build());
    }

    /**
     * Creates a client with a fully configured RestClient (for testing).
     *
     * @param restClient configured client
     */
    public RestFollowupClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public void editOriginalResponse(InteractionCredentials credentials, Map<String, Object> payload) {
        log.debug("Editing original response of interaction {}", credentials.interactionId());

        restClient.patch()
            .uri(ORIGINAL_PATH, credentials.applicationId(), credentials.token())
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, response) -> {
                throw deliveryFailure(response);
            })
            .toBodilessEntity();
    }

    @Override
    public Map<String, Object> sendFollowupMessage(InteractionCredentials credentials, Map<String, Object> payload) {
        log.debug("Sending follow-up message for interaction {}", credentials.interactionId());

        Map<String, Object> created = restClient.post()
            .uri(FOLLOWUP_PATH, credentials.applicationId(), credentials.token())
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, response) -> {
                throw deliveryFailure(response);
            })
            .body(MESSAGE_TYPE);
        return created != null ? created : Map.of();
    }

    @Override
    public void deleteOriginalResponse(InteractionCredentials credentials) {
        log.debug("Deleting original response of interaction {}", credentials.interactionId());

        restClient.delete()
            .uri(ORIGINAL_PATH, credentials.applicationId(), credentials.token())
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, response) -> {
                throw deliveryFailure(response);
            })
            .toBodilessEntity();
    }

    @Override
    public void editFollowupMessage(InteractionCredentials credentials, String messageId,
                                    Map<String, Object> payload) {
        log.debug("Editing follow-up message {} of interaction {}", messageId, credentials.interactionId());

        restClient.patch()
            .uri(MESSAGE_PATH, credentials.applicationId(), credentials.token(), messageId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(payload)
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, response) -> {
                throw deliveryFailure(response);
            })
            .toBodilessEntity();
    }

    private static FollowupDeliveryException deliveryFailure(ClientHttpResponse response) throws IOException {
        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        return new FollowupDeliveryException(response.getStatusCode().value(), body);
    }
}
