package com.ivamare.interactions.model;

import com.ivamare.interactions.handler.InteractionHandler;
import com.ivamare.interactions.response.Choice;
import com.ivamare.interactions.response.Components;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical response to an interaction: a wire response type plus a payload map.
 *
 * <p>Envelopes are immutable. A deferred envelope may carry a continuation routine
 * whose result is delivered by editing the original response once it completes.
 */
public final class ResponseEnvelope {

    /**
     * Message flag that hides a response from everyone but the invoking user.
     */
    public static final int EPHEMERAL_FLAG = 1 << 6;

    public enum Variant {
        MESSAGE,
        DEFERRED,
        AUTOCOMPLETE,
        MODAL,
        RAW
    }

    private final Variant variant;
    private final ResponseType type;
    private final Map<String, Object> data;
    private final InteractionHandler continuation;

    private ResponseEnvelope(Variant variant, ResponseType type, Map<String, Object> data,
                             InteractionHandler continuation) {
        this.variant = variant;
        this.type = Objects.requireNonNull(type, "type");
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        this.continuation = continuation;
    }

    /**
     * Create an envelope whose variant follows from the response type.
     *
     * @param type response type
     * @param data payload (nullable)
     * @return envelope
     */
    public static ResponseEnvelope of(ResponseType type, Map<String, Object> data) {
        return new ResponseEnvelope(variantOf(type), type, data, null);
    }

    public static ResponseEnvelope message(String content) {
        return of(ResponseType.CHANNEL_MESSAGE, Map.of("content", content));
    }

    public static ResponseEnvelope ephemeralMessage(String content) {
        return of(ResponseType.CHANNEL_MESSAGE, Map.of("content", content, "flags", EPHEMERAL_FLAG));
    }

    public static ResponseEnvelope updateMessage(String content) {
        return of(ResponseType.UPDATE_MESSAGE, Map.of("content", content));
    }

    /**
     * Deferred acknowledgment. The wire code is corrected per interaction kind at dispatch.
     *
     * @param ephemeral whether the eventual response is ephemeral
     * @return deferred envelope without continuation
     */
    public static ResponseEnvelope deferred(boolean ephemeral) {
        return deferred(null, ephemeral);
    }

    /**
     * Deferred acknowledgment whose continuation produces the real response.
     *
     * @param continuation routine run in the background after the acknowledgment is delivered
     * @param ephemeral whether the eventual response is ephemeral
     * @return deferred envelope
     */
    public static ResponseEnvelope deferred(InteractionHandler continuation, boolean ephemeral) {
        return new ResponseEnvelope(Variant.DEFERRED, ResponseType.DEFERRED_CHANNEL_MESSAGE,
            ephemeral ? Map.of("flags", EPHEMERAL_FLAG) : Map.of(), continuation);
    }

    public static ResponseEnvelope autocomplete(List<Choice> choices) {
        return of(ResponseType.AUTOCOMPLETE_RESULT,
            Map.of("choices", choices.stream().map(Choice::toMap).toList()));
    }

    public static ResponseEnvelope modal(String customId, String title, Components components) {
        return of(ResponseType.MODAL, Map.of(
            "custom_id", customId,
            "title", title,
            "components", components.toList()
        ));
    }

    public static ResponseEnvelope pong() {
        return new ResponseEnvelope(Variant.RAW, ResponseType.PONG, null, null);
    }

    /**
     * Pass a payload through untouched.
     *
     * @param type response type
     * @param data payload
     * @return raw envelope
     */
    public static ResponseEnvelope raw(ResponseType type, Map<String, Object> data) {
        return new ResponseEnvelope(Variant.RAW, type, data, null);
    }

    public Variant variant() {
        return variant;
    }

    public ResponseType type() {
        return type;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Optional<InteractionHandler> continuation() {
        return Optional.ofNullable(continuation);
    }

    public boolean isDeferred() {
        return type.isDeferred();
    }

    public boolean isEphemeral() {
        return data.get("flags") instanceof Number flags && (flags.intValue() & EPHEMERAL_FLAG) != 0;
    }

    /**
     * Copy of this envelope with another wire type; payload and continuation are kept.
     *
     * @param newType response type
     * @return envelope with the new type
     */
    public ResponseEnvelope withType(ResponseType newType) {
        if (newType == type) {
            return this;
        }
        Variant newVariant = variant == Variant.RAW ? Variant.RAW : variantOf(newType);
        return new ResponseEnvelope(newVariant, newType, data, continuation);
    }

    /**
     * Wire format: {@code {"type": code, "data": {...}}}, data omitted when empty.
     *
     * @return wire map
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.getValue());
        if (!data.isEmpty()) {
            wire.put("data", data);
        }
        return wire;
    }

    private static Variant variantOf(ResponseType type) {
        return switch (type) {
            case CHANNEL_MESSAGE, UPDATE_MESSAGE -> Variant.MESSAGE;
            case DEFERRED_CHANNEL_MESSAGE, DEFERRED_UPDATE_MESSAGE -> Variant.DEFERRED;
            case AUTOCOMPLETE_RESULT -> Variant.AUTOCOMPLETE;
            case MODAL -> Variant.MODAL;
            case PONG -> Variant.RAW;
        };
    }

    @Override
    public String toString() {
        return "ResponseEnvelope[variant=" + variant + ", type=" + type + ", data=" + data + "]";
    }
}
