package com.ivamare.interactions.response;

import com.ivamare.interactions.model.ComponentType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text field shown in a modal. Not allowed in messages.
 *
 * @param customId Custom id of the field, used as key of the submitted value
 * @param label Field label
 * @param paragraph Multi-line field if true, single line otherwise
 * @param required Whether the field must be filled in
 * @param placeholder Placeholder text (nullable)
 * @param value Pre-filled value (nullable)
 */
public record TextInput(
    String customId,
    String label,
    boolean paragraph,
    boolean required,
    String placeholder,
    String value
) implements MessageComponent {

    public static TextInput of(String customId, String label) {
        return new TextInput(customId, label, false, true, null, null);
    }

    public static TextInput paragraph(String customId, String label) {
        return new TextInput(customId, label, true, true, null, null);
    }

    @Override
    public ComponentType type() {
        return ComponentType.TEXT_INPUT;
    }

    @Override
    public int weight() {
        return ActionRow.MAX_WEIGHT;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type().getValue());
        map.put("custom_id", customId);
        map.put("label", label);
        map.put("style", paragraph ? 2 : 1);
        map.put("required", required);
        if (placeholder != null) {
            map.put("placeholder", placeholder);
        }
        if (value != null) {
            map.put("value", value);
        }
        return map;
    }
}
