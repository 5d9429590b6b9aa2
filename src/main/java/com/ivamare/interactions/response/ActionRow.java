package com.ivamare.interactions.response;

import com.ivamare.interactions.model.ComponentType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Row of components. Buttons weigh 1, selects and text inputs fill the row.
 */
public class ActionRow {

    public static final int MAX_WEIGHT = 5;

    private final List<MessageComponent> components = new ArrayList<>();
    private int weight;

    public boolean fits(MessageComponent component) {
        return weight + component.weight() <= MAX_WEIGHT;
    }

    public void add(MessageComponent component) {
        if (!fits(component)) {
            throw new IllegalArgumentException("Cannot add component, row weight limit exceeded");
        }
        components.add(component);
        weight += component.weight();
    }

    public boolean remove(String customId) {
        for (int i = 0; i < components.size(); i++) {
            if (customId.equals(customIdOf(components.get(i)))) {
                weight -= components.remove(i).weight();
                return true;
            }
        }
        return false;
    }

    public List<MessageComponent> components() {
        return List.copyOf(components);
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public int weight() {
        return weight;
    }

    public Map<String, Object> toMap() {
        return Map.of(
            "type", ComponentType.ACTION_ROW.getValue(),
            "components", components.stream().map(MessageComponent::toMap).toList()
        );
    }

    private static String customIdOf(MessageComponent component) {
        if (component instanceof Button button) {
            return button.customId();
        }
        if (component instanceof SelectMenu select) {
            return select.customId();
        }
        if (component instanceof TextInput input) {
            return input.customId();
        }
        return null;
    }
}
