package com.ivamare.interactions.response;

import com.ivamare.interactions.model.ComponentType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Clickable button. Link buttons carry a URL instead of a custom id.
 *
 * @param label Button text
 * @param customId Custom id sent back on click (null for link buttons)
 * @param style Button style
 * @param url Target of a link button (nullable)
 * @param emoji Emoji name (nullable)
 * @param disabled Whether the button is greyed out
 */
public record Button(
    String label,
    String customId,
    ButtonStyle style,
    String url,
    String emoji,
    boolean disabled
) implements MessageComponent {

    public Button {
        if (url != null) {
            style = ButtonStyle.LINK;
        }
        if (style == null) {
            style = ButtonStyle.PRIMARY;
        }
        if (style == ButtonStyle.LINK && url == null) {
            throw new IllegalArgumentException("Link button requires a URL");
        }
        if (style != ButtonStyle.LINK && customId == null) {
            throw new IllegalArgumentException("Button requires a custom id");
        }
    }

    public static Button of(String label, String customId) {
        return new Button(label, customId, ButtonStyle.PRIMARY, null, null, false);
    }

    public static Button of(String label, String customId, ButtonStyle style) {
        return new Button(label, customId, style, null, null, false);
    }

    public static Button link(String label, String url) {
        return new Button(label, null, ButtonStyle.LINK, url, null, false);
    }

    public Button asDisabled() {
        return new Button(label, customId, style, url, emoji, true);
    }

    @Override
    public ComponentType type() {
        return ComponentType.BUTTON;
    }

    @Override
    public int weight() {
        return 1;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type().getValue());
        map.put("style", style.getValue());
        if (label != null) {
            map.put("label", label);
        }
        if (customId != null) {
            map.put("custom_id", customId);
        }
        if (url != null) {
            map.put("url", url);
        }
        if (emoji != null) {
            map.put("emoji", Map.of("name", emoji));
        }
        map.put("disabled", disabled);
        return map;
    }
}
