package com.ivamare.interactions.response;

import com.ivamare.interactions.exception.InvalidResponseException;
import com.ivamare.interactions.exception.UnsupportedResponseElementException;
import com.ivamare.interactions.model.ResponseEnvelope;
import com.ivamare.interactions.model.ResponseType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns whatever a handler returned into a {@link ResponseEnvelope}.
 *
 * <p>An envelope passes through unchanged. Anything else is treated as one element,
 * or as several elements when it is an {@code Object[]}. Elements are applied in order:
 * <ul>
 *   <li>{@link ResponseType}: forces the response type</li>
 *   <li>{@link Embed}: appended to the embeds, type defaults to message</li>
 *   <li>{@link MessageComponent} or {@link Components}: appended to the component
 *       tree, type defaults to modal for text inputs and message otherwise</li>
 *   <li>{@link CharSequence}: becomes the content, type defaults to message</li>
 *   <li>{@link List}: appended to the autocomplete choices, type defaults to autocomplete</li>
 *   <li>{@link Map}: merged into the payload as raw overrides</li>
 * </ul>
 * Scalar fields are last-write-wins and collections append. Anything else raises
 * {@link UnsupportedResponseElementException}. A result that breaks a message limit
 * (embed count, component rows) raises {@link InvalidResponseException}.
 */
public class ResponseResolver {

    public static final int MAX_EMBEDS = 10;

    /**
     * Resolve a handler result.
     *
     * @param result value returned by a handler
     * @return canonical envelope
     * @throws UnsupportedResponseElementException if an element cannot be interpreted
     * @throws InvalidResponseException if the result breaks a message limit
     */
    public ResponseEnvelope resolve(Object result) {
        if (result instanceof ResponseEnvelope envelope) {
            return envelope;
        }
        if (result == null) {
            throw new UnsupportedResponseElementException(null);
        }

        Accumulator accumulator = new Accumulator();
        try {
            if (result instanceof Object[] elements) {
                for (Object element : elements) {
                    accumulator.apply(element);
                }
            } else {
                accumulator.apply(result);
            }
        } catch (IllegalArgumentException e) {
            // component row limits are enforced by the builders
            throw new InvalidResponseException("Invalid handler response: " + e.getMessage(), e);
        }
        return accumulator.build();
    }

    private static final class Accumulator {

        private ResponseType type;
        private String content;
        private final List<Map<String, Object>> embeds = new ArrayList<>();
        private Components components;
        private final List<Map<String, Object>> choices = new ArrayList<>();
        private final Map<String, Object> overrides = new LinkedHashMap<>();

        void apply(Object element) {
            if (element instanceof ResponseType tag) {
                type = tag;
            } else if (element instanceof Embed embed) {
                if (embeds.size() >= MAX_EMBEDS) {
                    throw new InvalidResponseException("Cannot add more than " + MAX_EMBEDS + " embeds to a message");
                }
                embeds.add(embed.toMap());
                defaultType(ResponseType.CHANNEL_MESSAGE);
            } else if (element instanceof MessageComponent component) {
                componentTree().add(component);
                defaultType(component instanceof TextInput ? ResponseType.MODAL : ResponseType.CHANNEL_MESSAGE);
            } else if (element instanceof Components tree) {
                componentTree().addAll(tree);
                boolean modal = tree.all().stream().anyMatch(TextInput.class::isInstance);
                defaultType(modal ? ResponseType.MODAL : ResponseType.CHANNEL_MESSAGE);
            } else if (element instanceof CharSequence text) {
                content = text.toString();
                defaultType(ResponseType.CHANNEL_MESSAGE);
            } else if (element instanceof List<?> list) {
                list.forEach(item -> choices.add(toChoice(item)));
                defaultType(ResponseType.AUTOCOMPLETE_RESULT);
            } else if (element instanceof Map<?, ?> map) {
                map.forEach((key, value) -> overrides.put(String.valueOf(key), value));
            } else {
                throw new UnsupportedResponseElementException(element != null ? element.getClass() : null);
            }
        }

        ResponseEnvelope build() {
            ResponseType resolved = type != null ? type : ResponseType.CHANNEL_MESSAGE;

            Map<String, Object> data = new LinkedHashMap<>();
            if (resolved == ResponseType.AUTOCOMPLETE_RESULT) {
                data.put("choices", List.copyOf(choices));
            } else {
                if (content != null) {
                    data.put("content", content);
                }
                if (!embeds.isEmpty()) {
                    data.put("embeds", List.copyOf(embeds));
                }
                if (components != null && !components.isEmpty()) {
                    data.put("components", components.toList());
                }
            }

            overrides.forEach((key, value) -> {
                if ("ephemeral".equals(key)) {
                    if (Boolean.TRUE.equals(value)) {
                        data.put("flags", ResponseEnvelope.EPHEMERAL_FLAG);
                    }
                } else {
                    data.put(key, value);
                }
            });

            return ResponseEnvelope.of(resolved, data);
        }

        private void defaultType(ResponseType fallback) {
            if (type == null) {
                type = fallback;
            }
        }

        private Components componentTree() {
            if (components == null) {
                components = new Components();
            }
            return components;
        }

        private static Map<String, Object> toChoice(Object item) {
            if (item instanceof Choice choice) {
                return choice.toMap();
            }
            if (item instanceof CharSequence text) {
                return Choice.of(text.toString()).toMap();
            }
            if (item instanceof Number number) {
                return new Choice(number.toString(), number).toMap();
            }
            throw new UnsupportedResponseElementException(item != null ? item.getClass() : null);
        }
    }
}
