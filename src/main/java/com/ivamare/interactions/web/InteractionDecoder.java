package com.ivamare.interactions.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.interactions.model.CommandType;
import com.ivamare.interactions.model.ComponentType;
import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionContext;
import com.ivamare.interactions.model.InteractionCredentials;
import com.ivamare.interactions.model.InteractionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes inbound interaction JSON into an {@link InteractionContext}.
 */
public class InteractionDecoder {

    private static final Logger log = LoggerFactory.getLogger(InteractionDecoder.class);

    private static final int SUB_COMMAND = 1;
    private static final int SUB_COMMAND_GROUP = 2;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String defaultApplicationId;

    /**
     * @param objectMapper JSON mapper
     * @param defaultApplicationId application id used when the payload carries none (nullable)
     */
    public InteractionDecoder(ObjectMapper objectMapper, String defaultApplicationId) {
        this.objectMapper = objectMapper;
        this.defaultApplicationId = defaultApplicationId;
    }

    /**
     * @param body raw request body
     * @return parsed payload
     * @throws IllegalArgumentException if the body is not a JSON object
     */
    public JsonNode parse(String body) {
        try {
            JsonNode payload = objectMapper.readTree(body);
            if (payload == null || !payload.isObject()) {
                throw new IllegalArgumentException("Interaction payload is not a JSON object");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed interaction payload", e);
        }
    }

    public InteractionType type(JsonNode payload) {
        return InteractionType.fromValue(payload.path("type").asInt());
    }

    public boolean isPing(JsonNode payload) {
        return type(payload) == InteractionType.PING;
    }

    /**
     * @param payload parsed payload of a non-ping interaction
     * @return routed interaction context
     * @throws IllegalArgumentException if required fields are missing
     */
    public InteractionContext decode(JsonNode payload) {
        HandlerKind kind = type(payload).toHandlerKind();
        JsonNode data = payload.path("data");

        var builder = InteractionContext.builder(credentials(payload), kind)
            .data(data.isObject() ? objectMapper.convertValue(data, MAP_TYPE) : Map.of())
            .guildId(text(payload, "guild_id"))
            .channelId(text(payload, "channel_id"))
            .userId(userId(payload));

        switch (kind) {
            case COMMAND, AUTOCOMPLETE -> {
                builder.name(text(data, "name")).options(flattenOptions(data.path("options")));
                if (data.has("type") && kind == HandlerKind.COMMAND) {
                    builder.subType(commandType(data.path("type").asInt()));
                }
            }
            case COMPONENT -> builder
                .name(text(data, "custom_id"))
                .subType(componentType(data.path("component_type").asInt()))
                .values(values(data.path("values")));
            case MODAL_SUBMIT -> builder
                .name(text(data, "custom_id"))
                .options(modalInputs(data.path("components")));
            default -> throw new IllegalArgumentException("Cannot decode interaction of kind " + kind);
        }
        return builder.build();
    }

    private InteractionCredentials credentials(JsonNode payload) {
        String applicationId = text(payload, "application_id");
        String token = text(payload, "token");
        if (token == null) {
            throw new IllegalArgumentException("Interaction payload has no token");
        }
        if (applicationId == null) {
            applicationId = defaultApplicationId;
        }
        if (applicationId == null) {
            throw new IllegalArgumentException("Interaction payload has no application id");
        }
        return new InteractionCredentials(applicationId, text(payload, "id"), token);
    }

    // sub-command names are dropped, their leaf options are merged
    private Map<String, Object> flattenOptions(JsonNode options) {
        Map<String, Object> flattened = new LinkedHashMap<>();
        for (JsonNode option : options) {
            int type = option.path("type").asInt();
            if (type == SUB_COMMAND || type == SUB_COMMAND_GROUP) {
                flattened.putAll(flattenOptions(option.path("options")));
            } else if (option.has("name")) {
                flattened.put(option.get("name").asText(), objectMapper.convertValue(option.get("value"), Object.class));
            }
        }
        return flattened;
    }

    private static Map<String, Object> modalInputs(JsonNode rows) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            for (JsonNode input : row.path("components")) {
                if (input.has("custom_id")) {
                    inputs.put(input.get("custom_id").asText(), input.path("value").asText(null));
                }
            }
        }
        return inputs;
    }

    private static List<String> values(JsonNode values) {
        List<String> result = new ArrayList<>();
        values.forEach(value -> result.add(value.asText()));
        return result;
    }

    // unknown command types stay unfiltered so generic and catch-all handlers still apply
    private static CommandType commandType(int value) {
        Optional<CommandType> type = CommandType.find(value);
        if (type.isEmpty()) {
            log.debug("Unknown command type {}, routing without sub-type", value);
        }
        return type.orElse(null);
    }

    // user, role, mentionable and channel selects are routed like string selects
    private static ComponentType componentType(int value) {
        if (value >= 5 && value <= 8) {
            return ComponentType.SELECT;
        }
        Optional<ComponentType> type = ComponentType.find(value);
        if (type.isEmpty()) {
            log.debug("Unknown component type {}, routing without sub-type", value);
        }
        return type.orElse(null);
    }

    private static String userId(JsonNode payload) {
        String memberUser = text(payload.path("member").path("user"), "id");
        return memberUser != null ? memberUser : text(payload.path("user"), "id");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
