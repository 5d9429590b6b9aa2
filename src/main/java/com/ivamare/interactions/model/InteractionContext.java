package com.ivamare.interactions.model;

import com.ivamare.interactions.exception.AlreadyRespondedException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One decoded inbound interaction.
 *
 * <p>Created per request and discarded once its response and any background
 * follow-up complete. The {@code responded} flag moves from false to true at most
 * once; a second initial response raises {@link AlreadyRespondedException}.
 */
public class InteractionContext {

    private final InteractionCredentials credentials;
    private final HandlerKind kind;
    private final String name;
    private final InteractionSubType subType;
    private final Map<String, Object> data;
    private final Map<String, Object> options;
    private final List<String> values;
    private final String guildId;
    private final String channelId;
    private final String userId;

    private final AtomicBoolean responded = new AtomicBoolean(false);
    private final AtomicReference<ResponseEnvelope> committedResponse = new AtomicReference<>();
    private volatile Map<String, Object> parameters = Map.of();

    private InteractionContext(Builder builder) {
        this.credentials = Objects.requireNonNull(builder.credentials, "credentials");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        if (kind == HandlerKind.CATCH_ALL) {
            throw new IllegalArgumentException("CATCH_ALL is a registration kind, not an interaction kind");
        }
        this.name = builder.name;
        this.subType = builder.subType;
        this.data = copyOf(builder.data);
        this.options = copyOf(builder.options);
        this.values = builder.values != null ? List.copyOf(builder.values) : List.of();
        this.guildId = builder.guildId;
        this.channelId = builder.channelId;
        this.userId = builder.userId;
    }

    public static Builder builder(InteractionCredentials credentials, HandlerKind kind) {
        return new Builder(credentials, kind);
    }

    public InteractionCredentials credentials() {
        return credentials;
    }

    public String interactionId() {
        return credentials.interactionId();
    }

    public HandlerKind kind() {
        return kind;
    }

    /**
     * Command name for commands and autocomplete, custom id for components and modals.
     *
     * @return routing key (nullable)
     */
    public String name() {
        return name;
    }

    public InteractionSubType subType() {
        return subType;
    }

    /**
     * @return raw {@code data} object of the inbound payload
     */
    public Map<String, Object> data() {
        return data;
    }

    /**
     * Command option values by name, or submitted text-input values by custom id for modals.
     *
     * @return option values
     */
    public Map<String, Object> options() {
        return options;
    }

    public Optional<Object> option(String optionName) {
        return Optional.ofNullable(options.get(optionName));
    }

    /**
     * @return selected values of a select menu interaction
     */
    public List<String> values() {
        return values;
    }

    public String guildId() {
        return guildId;
    }

    public String channelId() {
        return channelId;
    }

    public String userId() {
        return userId;
    }

    // --- Custom-id template parameters ---

    /**
     * Bind parameters extracted from a custom-id template at resolution time.
     *
     * @param extracted parameter values in declaration order
     */
    public void bindParameters(Map<String, Object> extracted) {
        this.parameters = copyOf(extracted);
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public Object parameter(String parameterName) {
        return parameters.get(parameterName);
    }

    // --- Single-response contract ---

    /**
     * Commit an initial response from inside a handler.
     *
     * @param response the response
     * @throws AlreadyRespondedException if a response was already committed
     * @throws IllegalArgumentException if the response is a deferral; return it from the handler instead
     */
    public void respond(ResponseEnvelope response) {
        Objects.requireNonNull(response, "response");
        if (response.isDeferred()) {
            throw new IllegalArgumentException("Deferred responses must be returned from the handler");
        }
        markResponded();
        committedResponse.set(response);
    }

    public void respond(String content) {
        respond(ResponseEnvelope.message(content));
    }

    /**
     * Flip the responded flag.
     *
     * @throws AlreadyRespondedException if the flag was already set
     */
    public void markResponded() {
        if (!responded.compareAndSet(false, true)) {
            throw new AlreadyRespondedException(interactionId());
        }
    }

    public boolean isResponded() {
        return responded.get();
    }

    /**
     * @return response committed through {@link #respond}, if any
     */
    public Optional<ResponseEnvelope> committedResponse() {
        return Optional.ofNullable(committedResponse.get());
    }

    // payload maps may hold JSON nulls, which Map.copyOf rejects
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    @Override
    public String toString() {
        return "InteractionContext[id=" + interactionId() + ", kind=" + kind + ", name=" + name
            + ", subType=" + subType + "]";
    }

    /**
     * Builder for {@link InteractionContext}.
     */
    public static class Builder {

        private final InteractionCredentials credentials;
        private final HandlerKind kind;
        private String name;
        private InteractionSubType subType;
        private Map<String, Object> data;
        private Map<String, Object> options;
        private List<String> values;
        private String guildId;
        private String channelId;
        private String userId;

        private Builder(InteractionCredentials credentials, HandlerKind kind) {
            this.credentials = credentials;
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder subType(InteractionSubType subType) {
            this.subType = subType;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = options;
            return this;
        }

        public Builder values(List<String> values) {
            this.values = values;
            return this;
        }

        public Builder guildId(String guildId) {
            this.guildId = guildId;
            return this;
        }

        public Builder channelId(String channelId) {
            this.channelId = channelId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public InteractionContext build() {
            return new InteractionContext(this);
        }
    }
}
