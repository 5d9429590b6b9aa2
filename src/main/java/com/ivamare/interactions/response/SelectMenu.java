package com.ivamare.interactions.response;

import com.ivamare.interactions.model.ComponentType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * String select menu. Takes a whole action row.
 *
 * @param customId Custom id sent back on selection
 * @param placeholder Placeholder text (nullable)
 * @param options Between 1 and 25 options
 * @param minValues Minimum number of selections, clamped to at least 0
 * @param maxValues Maximum number of selections, clamped to at most 25
 * @param disabled Whether the menu is greyed out
 */
public record SelectMenu(
    String customId,
    String placeholder,
    List<SelectOption> options,
    int minValues,
    int maxValues,
    boolean disabled
) implements MessageComponent {

    public static final int MAX_OPTIONS = 25;

    public SelectMenu {
        options = List.copyOf(options);
        if (options.isEmpty()) {
            throw new IllegalArgumentException("Select requires at least one option");
        }
        if (options.size() > MAX_OPTIONS) {
            throw new IllegalArgumentException("Select cannot have more than " + MAX_OPTIONS + " options");
        }
        if (minValues > maxValues) {
            throw new IllegalArgumentException("minValues cannot be greater than maxValues");
        }
        minValues = Math.max(minValues, 0);
        maxValues = Math.min(maxValues, MAX_OPTIONS);
    }

    public static SelectMenu of(String customId, List<SelectOption> options) {
        return new SelectMenu(customId, null, options, 1, 1, false);
    }

    @Override
    public ComponentType type() {
        return ComponentType.SELECT;
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
        if (placeholder != null) {
            map.put("placeholder", placeholder);
        }
        map.put("options", options.stream().map(SelectOption::toMap).toList());
        map.put("min_values", minValues);
        map.put("max_values", maxValues);
        map.put("disabled", disabled);
        return map;
    }
}
