package com.ivamare.interactions.response;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One option of a {@link SelectMenu}.
 *
 * @param label Text shown to the user
 * @param value Value sent back when selected
 * @param description Additional text (nullable)
 * @param selectedByDefault Whether the option is pre-selected
 */
public record SelectOption(
    String label,
    String value,
    String description,
    boolean selectedByDefault
) {
    public static SelectOption of(String label, String value) {
        return new SelectOption(label, value, null, false);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("label", label);
        map.put("value", value);
        if (description != null) {
            map.put("description", description);
        }
        if (selectedByDefault) {
            map.put("default", true);
        }
        return map;
    }
}
